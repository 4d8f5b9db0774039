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
import org.jspecify.annotations.Nullable;

import java.net.InetSocketAddress;
import java.time.Duration;

/**
 * Read-only hook methods for observing system, connection and request lifecycle events.
 * <p>
 * Exceptions thrown by these methods never escape into Sluice's event loops: they are caught and surfaced separately
 * via {@link #didReceiveLogEvent(LogEvent)}.  An exception thrown by {@link #didReceiveLogEvent(LogEvent)} itself is
 * written to {@code System.err}.
 * <p>
 * Connection and request hooks are invoked on event loop or application threads, so implementations must be threadsafe
 * and should return quickly.
 * <p>
 * A standard threadsafe implementation can be acquired via the {@link #defaultInstance()} factory method.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
public interface LifecycleObserver {
	/**
	 * Called before a {@link Sluice} instance starts.
	 */
	default void willStartSluice(@NonNull Sluice sluice) {
		// No-op by default
	}

	/**
	 * Called after a {@link Sluice} instance starts.
	 */
	default void didStartSluice(@NonNull Sluice sluice) {
		// No-op by default
	}

	/**
	 * Called after a {@link Sluice} instance was asked to start, but failed due to an exception.
	 */
	default void didFailToStartSluice(@NonNull Sluice sluice,
																		@NonNull Throwable throwable) {
		// No-op by default
	}

	/**
	 * Called before a {@link Sluice} instance stops.
	 */
	default void willStopSluice(@NonNull Sluice sluice) {
		// No-op by default
	}

	/**
	 * Called after a {@link Sluice} instance stops.
	 */
	default void didStopSluice(@NonNull Sluice sluice) {
		// No-op by default
	}

	/**
	 * Called after a {@link Sluice} instance was asked to stop, but failed due to an exception.
	 */
	default void didFailToStopSluice(@NonNull Sluice sluice,
																	 @NonNull Throwable throwable) {
		// No-op by default
	}

	/**
	 * Called before the server starts.
	 */
	default void willStartServer(@NonNull Server server) {
		// No-op by default
	}

	/**
	 * Called after the server starts.
	 */
	default void didStartServer(@NonNull Server server) {
		// No-op by default
	}

	/**
	 * Called after the server was asked to start, but failed due to an exception.
	 */
	default void didFailToStartServer(@NonNull Server server,
																		@NonNull Throwable throwable) {
		// No-op by default
	}

	/**
	 * Called before the server stops.
	 */
	default void willStopServer(@NonNull Server server) {
		// No-op by default
	}

	/**
	 * Called after the server stops.
	 */
	default void didStopServer(@NonNull Server server) {
		// No-op by default
	}

	/**
	 * Called after the server was asked to stop, but failed due to an exception.
	 */
	default void didFailToStopServer(@NonNull Server server,
																	 @NonNull Throwable throwable) {
		// No-op by default
	}

	/**
	 * Called after a connection has been accepted and registered with an event loop.
	 */
	default void didAcceptConnection(@Nullable InetSocketAddress remoteAddress) {
		// No-op by default
	}

	/**
	 * Called after an inbound connection was refused.
	 */
	default void didFailToAcceptConnection(@Nullable InetSocketAddress remoteAddress,
																				 @NonNull ConnectionRejectionReason reason) {
		// No-op by default
	}

	/**
	 * Called after a previously-accepted connection has been closed, for whatever reason.
	 */
	default void didCloseConnection(@Nullable InetSocketAddress remoteAddress) {
		// No-op by default
	}

	/**
	 * Called as soon as a request head has been parsed and its exchange is about to be handed to the {@link Application}.
	 */
	default void didStartRequestHandling(@NonNull Request request) {
		// No-op by default
	}

	/**
	 * Called exactly once per exchange, after it reaches its terminal outcome.
	 */
	default void didFinishRequestHandling(@NonNull Request request,
																				@NonNull CycleOutcome cycleOutcome,
																				@NonNull Duration duration,
																				@Nullable Throwable throwable) {
		// No-op by default
	}

	/**
	 * Called when Sluice emits a log event.
	 * <p>
	 * By default, events are forwarded to the SLF4J logger named {@code com.sluice}.
	 */
	default void didReceiveLogEvent(@NonNull LogEvent logEvent) {
		DefaultLifecycleObserver.log(logEvent);
	}

	/**
	 * Acquires a threadsafe {@link LifecycleObserver} instance with sensible defaults.
	 *
	 * @return a {@code LifecycleObserver} with default settings
	 */
	@NonNull
	static LifecycleObserver defaultInstance() {
		return DefaultLifecycleObserver.defaultInstance();
	}
}
