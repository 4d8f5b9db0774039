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

/**
 * The single terminal outcome of one request/response exchange.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @see LifecycleObserver#didFinishRequestHandling(Request, CycleOutcome, java.time.Duration, Throwable)
 */
public enum CycleOutcome {
	/**
	 * The response was fully written to the socket.
	 */
	COMPLETED,
	/**
	 * The application threw, or violated the {@link ResponseWriter} contract.  The client received a 500 if no
	 * response bytes had been committed, otherwise the connection was closed abruptly.
	 */
	APPLICATION_FAILED,
	/**
	 * The client went away before the response was fully written.
	 */
	DISCONNECTED,
	/**
	 * The request could not be read: malformed input, an oversized head or a timeout.
	 */
	PROTOCOL_ERROR
}
