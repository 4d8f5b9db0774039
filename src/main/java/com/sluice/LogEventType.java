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
 * Kinds of {@link LogEvent} instances that Sluice can produce.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
public enum LogEventType {
	/**
	 * Indicates that a configuration option was requested but isn't supported in the current runtime/environment; behavior may differ (perhaps ignored or degraded).
	 */
	CONFIGURATION_UNSUPPORTED,
	/**
	 * Indicates that an unexpected exception was thrown by Sluice itself, for example while reading from or writing to a socket.
	 */
	SERVER_INTERNAL_ERROR,
	/**
	 * Indicates that the server received bytes it could not parse as an HTTP/1.1 request.
	 */
	SERVER_UNPARSEABLE_REQUEST,
	/**
	 * Indicates that a client stopped sending bytes while a request head or body was expected.
	 */
	REQUEST_TIMEOUT,
	/**
	 * Indicates that a client disconnected before its response was fully written.
	 */
	CLIENT_DISCONNECTED,
	/**
	 * Indicates that the {@link Application} threw an exception while handling a request.
	 */
	APPLICATION_FAILED,
	/**
	 * Indicates that the {@link Application} misused its {@link ResponseWriter}, for example by writing a body before starting the response.
	 */
	RESPONSE_CONTRACT_VIOLATED,
	/**
	 * Indicates that the server served its configured maximum number of requests and is asking to be shut down.
	 */
	REQUEST_LIMIT_REACHED,
	/**
	 * Indicates that an inbound connection was refused, for example because the configured maximum was reached.
	 */
	CONNECTION_REJECTED,
	/**
	 * Indicates that a {@link LifecycleObserver} method threw an exception.
	 */
	LIFECYCLE_OBSERVER_FAILED,
	/**
	 * Indicates that graceful shutdown did not finish within its grace period and open connections were force-closed.
	 */
	SHUTDOWN_TIMEOUT_EXCEEDED
}
