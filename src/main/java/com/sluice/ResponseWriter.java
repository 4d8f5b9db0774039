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

package com.sluice;

import com.sluice.exception.ClientDisconnectedException;
import com.sluice.exception.ResponseContractException;
import org.jspecify.annotations.NonNull;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static java.util.Objects.requireNonNull;

/**
 * Push-style sink for a single HTTP response.
 * <p>
 * A response is produced with exactly one {@link #start(Integer, Map)} call, then any number of {@link #write(byte[])}
 * calls, then one {@link #end()}.  Breaking that order throws {@link ResponseContractException} and fails the exchange.
 * <p>
 * Framing is chosen from the headers passed to {@code start}: a {@code Content-Length} header is honored as-is,
 * otherwise HTTP/1.1 responses are sent with chunked transfer encoding and HTTP/1.0 responses are delimited by closing
 * the connection.
 * <p>
 * Every method may block while the client reads more slowly than the application writes.  Every method throws
 * {@link ClientDisconnectedException} once the client is gone.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
public interface ResponseWriter {
	/**
	 * Sends the response status line and headers.
	 *
	 * @param statusCode the final HTTP status code, 200-599
	 * @param headers    response headers, keyed by name; each value is written as its own header line
	 */
	void start(@NonNull Integer statusCode,
						 @NonNull Map<@NonNull String, @NonNull List<@NonNull String>> headers);

	/**
	 * Sends a chunk of response body.  Empty chunks are ignored.
	 *
	 * @param chunk the body bytes
	 */
	void write(@NonNull byte[] chunk);

	/**
	 * Completes the response.
	 */
	void end();

	/**
	 * Has {@link #start(Integer, Map)} been called?
	 *
	 * @return {@code true} if the response was started
	 */
	@NonNull
	Boolean isStarted();

	default void start(@NonNull Integer statusCode) {
		start(statusCode, Map.of());
	}

	/**
	 * Sends a complete, fixed-length response in one go, adding {@code Content-Length} if the headers lack it.
	 *
	 * @param statusCode the final HTTP status code
	 * @param headers    response headers
	 * @param body       the full response body
	 */
	default void respond(@NonNull Integer statusCode,
											 @NonNull Map<@NonNull String, @NonNull List<@NonNull String>> headers,
											 @NonNull byte[] body) {
		requireNonNull(statusCode);
		requireNonNull(headers);
		requireNonNull(body);

		Map<String, List<String>> finalHeaders = new LinkedHashMap<>(headers);

		if (finalHeaders.keySet().stream().noneMatch(name -> name.equalsIgnoreCase("Content-Length")))
			finalHeaders.put("Content-Length", List.of(String.valueOf(body.length)));

		start(statusCode, finalHeaders);
		write(body);
		end();
	}
}
