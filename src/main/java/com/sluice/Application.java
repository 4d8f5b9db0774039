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

import org.jspecify.annotations.NonNull;

/**
 * The request-handling application that a {@link Sluice} instance fronts.
 * <p>
 * Invoked once per request on an application thread, never on a socket event loop thread.  The application reads the
 * request body through {@link Request#getBody()} and produces its response through the supplied {@link ResponseWriter}.
 * Both may block: a body read waits for the client to send more data, and a response write waits while the client is
 * reading too slowly for the server to keep buffering.
 * <p>
 * For example:
 * <pre>{@code  Application application = (request, responseWriter) -> {
 *   byte[] body = request.getBody().readAllBytes();
 *   responseWriter.respond(200, Map.of("Content-Type", List.of("text/plain")), body);
 * };}</pre>
 * <p>
 * Exceptions thrown out of {@link #handle(Request, ResponseWriter)} turn into a 500 response if no response bytes have
 * left the server yet; otherwise the connection is closed, since the response framing can no longer be trusted.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@FunctionalInterface
public interface Application {
	/**
	 * Handles a single request/response exchange.
	 *
	 * @param request        the request, including its lazily-read body
	 * @param responseWriter sink for the response status, headers and body
	 * @throws Exception if the application fails to produce a response
	 */
	void handle(@NonNull Request request,
							@NonNull ResponseWriter responseWriter) throws Exception;
}
