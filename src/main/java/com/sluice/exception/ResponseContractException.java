/*
 * Copyright 2022-2026 Revetware LLC.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.sluice.exception;

import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.NotThreadSafe;

/**
 * Thrown when application code misuses a {@link com.sluice.ResponseWriter}, for example by starting a response twice,
 * writing body data before the response was started, or writing more bytes than its {@code Content-Length} declared.
 * <p>
 * Once thrown, the exchange is failed: the client receives a 500 if nothing has gone out on the wire yet, otherwise the
 * connection is closed.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@NotThreadSafe
public class ResponseContractException extends IllegalStateException {
	public ResponseContractException(@Nullable String message) {
		super(message);
	}
}
