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
 * Thrown to application code that pulls request body data or pushes response data after the client has gone away,
 * or after the exchange was cancelled by a server shutdown or a disconnect grace period running out.
 * <p>
 * This is not an HTTP error: there is nobody left to answer.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@NotThreadSafe
public class ClientDisconnectedException extends RuntimeException {
	public ClientDisconnectedException(@Nullable String message) {
		super(message);
	}

	public ClientDisconnectedException(@Nullable String message,
																		 @Nullable Throwable cause) {
		super(message, cause);
	}
}
