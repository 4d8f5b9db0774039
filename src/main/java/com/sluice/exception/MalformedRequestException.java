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

import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.NotThreadSafe;

import static java.util.Objects.requireNonNull;

/**
 * Indicates bytes on the wire that do not form a valid HTTP/1.1 request: a bad request line or header,
 * conflicting message lengths, broken chunked encoding and so forth.
 * <p>
 * Always fatal to the connection.  Application code sees this when it pulls a request body whose framing broke
 * partway through.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@NotThreadSafe
public class MalformedRequestException extends RuntimeException {
	@NonNull
	private final Integer statusCode;

	public MalformedRequestException(@Nullable String message) {
		this(message, 400);
	}

	/**
	 * @param message    the detail message
	 * @param statusCode the status the server answers with if it still can, e.g. {@code 431} for an oversized head
	 */
	public MalformedRequestException(@Nullable String message,
																	 @NonNull Integer statusCode) {
		super(message);
		requireNonNull(statusCode);
		this.statusCode = statusCode;
	}

	public MalformedRequestException(@Nullable String message,
																	 @Nullable Throwable cause) {
		super(message, cause);
		this.statusCode = cause instanceof MalformedRequestException malformedRequestException
				? malformedRequestException.getStatusCode()
				: 400;
	}

	@NonNull
	public Integer getStatusCode() {
		return this.statusCode;
	}
}
