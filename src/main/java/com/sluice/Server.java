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

import javax.annotation.concurrent.NotThreadSafe;
import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.function.Supplier;

import static java.util.Objects.requireNonNull;

/**
 * Contract for HTTP/1.1 server implementations that are designed to be managed by a {@link Sluice} instance.
 * <p>
 * <strong>Most applications will use the standard implementation acquired via {@link #withPort(Integer)} and therefore do not need to implement this interface directly.</strong>
 * <p>
 * For example:
 * <pre>{@code  SluiceConfig config = SluiceConfig.withServer(
 *   Server.withPort(8080).build()
 * ).application((request, responseWriter) -> {
 *   responseWriter.respond(200, Map.of(), "Hello".getBytes(StandardCharsets.UTF_8));
 * }).build();
 *
 * try (Sluice sluice = Sluice.withConfig(config)) {
 *   sluice.start();
 *   System.out.println("Sluice started, press [enter] to exit");
 *   sluice.awaitShutdown(ShutdownTrigger.ENTER_KEY);
 * }}</pre>
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
public interface Server extends AutoCloseable {
	/**
	 * Starts the server, which makes it able to accept connections from clients.
	 * <p>
	 * If the server is already started, no action is taken.
	 * <p>
	 * <strong>This method is designed for internal use by {@link Sluice} only and should not be invoked elsewhere.</strong>
	 */
	void start();

	/**
	 * Gracefully stops the server: no new connections are accepted, in-flight exchanges are allowed to finish within
	 * the shutdown timeout, then any connection still open is closed.
	 * <p>
	 * If the server is already stopped, no action is taken.
	 * <p>
	 * <strong>This method is designed for internal use by {@link Sluice} only and should not be invoked elsewhere.</strong>
	 */
	void stop();

	/**
	 * Is this server started (that is, able to accept connections from clients)?
	 *
	 * @return {@code true} if the server is started, {@code false} otherwise
	 */
	@NonNull
	Boolean isStarted();

	/**
	 * The shared counters and {@code Date} cache of the current (or most recent) serving lifetime.
	 *
	 * @return the server state, or {@link Optional#empty()} if the server has never been started
	 */
	@NonNull
	Optional<ServerState> getServerState();

	/**
	 * The {@link Sluice} instance which manages this {@link Server} will invoke this method exactly once at initialization time.
	 * <p>
	 * <strong>This method is designed for internal use by {@link Sluice} only and should not be invoked elsewhere.</strong>
	 *
	 * @param sluiceConfig           configuration for the Sluice instance that controls this server
	 * @param shutdownRequestHandler invoked (at most once per serving lifetime, on a server thread) when the server
	 *                               wants its controller to shut it down, e.g. because its request limit was reached
	 */
	void initialize(@NonNull SluiceConfig sluiceConfig,
									@NonNull Runnable shutdownRequestHandler);

	/**
	 * {@link AutoCloseable}-enabled synonym for {@link #stop()}.
	 *
	 * @throws Exception if an exception occurs while stopping the server
	 */
	@Override
	default void close() throws Exception {
		stop();
	}

	/**
	 * Acquires a builder for the standard {@link Server} implementation.
	 *
	 * @param port the port to listen on, or {@code 0} for an ephemeral port
	 * @return the builder
	 */
	@NonNull
	static Builder withPort(@NonNull Integer port) {
		requireNonNull(port);
		return new Builder(port);
	}

	/**
	 * Builder used to construct a standard implementation of {@link Server}.
	 * <p>
	 * This class is intended for use by a single thread.
	 *
	 * @author <a href="https://www.revetkn.com">Mark Allen</a>
	 */
	@NotThreadSafe
	final class Builder {
		@NonNull
		Integer port;
		@Nullable
		String host;
		@Nullable
		Integer concurrency;
		@Nullable
		Duration requestTimeout;
		@Nullable
		Duration keepAliveTimeout;
		@Nullable
		Duration shutdownTimeout;
		@Nullable
		Duration disconnectGracePeriod;
		@Nullable
		Duration socketSelectTimeout;
		@Nullable
		Integer maximumRequestHeadSizeInBytes;
		@Nullable
		Integer requestReadBufferSizeInBytes;
		@Nullable
		Integer socketPendingConnectionLimit;
		@Nullable
		Integer maximumConnections;
		@Nullable
		Long maximumRequests;
		@Nullable
		Integer writeHighWatermarkInBytes;
		@Nullable
		Integer writeLowWatermarkInBytes;
		@Nullable
		Integer eventPoolCapacity;
		@Nullable
		String serverHeader;
		boolean serverHeaderSpecified;
		@Nullable
		Boolean dateHeaderEnabled;
		@Nullable
		Supplier<ExecutorService> applicationExecutorServiceSupplier;
		@Nullable
		Clock clock;

		private Builder(@NonNull Integer port) {
			requireNonNull(port);
			this.port = port;
		}

		@NonNull
		public Builder port(@NonNull Integer port) {
			requireNonNull(port);
			this.port = port;
			return this;
		}

		@NonNull
		public Builder host(@Nullable String host) {
			this.host = host;
			return this;
		}

		@NonNull
		public Builder concurrency(@Nullable Integer concurrency) {
			this.concurrency = concurrency;
			return this;
		}

		/**
		 * How long the server waits for more bytes while a request head or body is expected before answering 408.
		 */
		@NonNull
		public Builder requestTimeout(@Nullable Duration requestTimeout) {
			this.requestTimeout = requestTimeout;
			return this;
		}

		/**
		 * How long an idle persistent connection is kept open between requests.
		 */
		@NonNull
		public Builder keepAliveTimeout(@Nullable Duration keepAliveTimeout) {
			this.keepAliveTimeout = keepAliveTimeout;
			return this;
		}

		@NonNull
		public Builder shutdownTimeout(@Nullable Duration shutdownTimeout) {
			this.shutdownTimeout = shutdownTimeout;
			return this;
		}

		/**
		 * How long an application may keep running after its client disconnected before its task is cancelled.
		 */
		@NonNull
		public Builder disconnectGracePeriod(@Nullable Duration disconnectGracePeriod) {
			this.disconnectGracePeriod = disconnectGracePeriod;
			return this;
		}

		@NonNull
		public Builder socketSelectTimeout(@Nullable Duration socketSelectTimeout) {
			this.socketSelectTimeout = socketSelectTimeout;
			return this;
		}

		@NonNull
		public Builder maximumRequestHeadSizeInBytes(@Nullable Integer maximumRequestHeadSizeInBytes) {
			this.maximumRequestHeadSizeInBytes = maximumRequestHeadSizeInBytes;
			return this;
		}

		@NonNull
		public Builder requestReadBufferSizeInBytes(@Nullable Integer requestReadBufferSizeInBytes) {
			this.requestReadBufferSizeInBytes = requestReadBufferSizeInBytes;
			return this;
		}

		@NonNull
		public Builder socketPendingConnectionLimit(@Nullable Integer socketPendingConnectionLimit) {
			this.socketPendingConnectionLimit = socketPendingConnectionLimit;
			return this;
		}

		@NonNull
		public Builder maximumConnections(@Nullable Integer maximumConnections) {
			this.maximumConnections = maximumConnections;
			return this;
		}

		/**
		 * Once this many requests have been served, the server asks its {@link Sluice} to shut down.
		 */
		@NonNull
		public Builder maximumRequests(@Nullable Long maximumRequests) {
			this.maximumRequests = maximumRequests;
			return this;
		}

		@NonNull
		public Builder writeHighWatermarkInBytes(@Nullable Integer writeHighWatermarkInBytes) {
			this.writeHighWatermarkInBytes = writeHighWatermarkInBytes;
			return this;
		}

		@NonNull
		public Builder writeLowWatermarkInBytes(@Nullable Integer writeLowWatermarkInBytes) {
			this.writeLowWatermarkInBytes = writeLowWatermarkInBytes;
			return this;
		}

		@NonNull
		public Builder eventPoolCapacity(@Nullable Integer eventPoolCapacity) {
			this.eventPoolCapacity = eventPoolCapacity;
			return this;
		}

		/**
		 * Value of the {@code Server} response header; {@code null} omits the header.
		 */
		@NonNull
		public Builder serverHeader(@Nullable String serverHeader) {
			this.serverHeader = serverHeader;
			this.serverHeaderSpecified = true;
			return this;
		}

		@NonNull
		public Builder dateHeaderEnabled(@Nullable Boolean dateHeaderEnabled) {
			this.dateHeaderEnabled = dateHeaderEnabled;
			return this;
		}

		@NonNull
		public Builder applicationExecutorServiceSupplier(@Nullable Supplier<ExecutorService> applicationExecutorServiceSupplier) {
			this.applicationExecutorServiceSupplier = applicationExecutorServiceSupplier;
			return this;
		}

		@NonNull
		public Builder clock(@Nullable Clock clock) {
			this.clock = clock;
			return this;
		}

		@NonNull
		public Server build() {
			return new DefaultServer(this);
		}
	}
}
