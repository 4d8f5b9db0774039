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

import com.sluice.internal.http.ConnectionListener;
import com.sluice.internal.http.CycleListener;
import com.sluice.internal.http.EventLoop;
import com.sluice.internal.http.Handler;
import com.sluice.internal.http.Options;
import com.sluice.internal.http.RequestResponseCycle;
import com.sluice.internal.http.ServerContext;
import com.sluice.internal.http.Slf4jLogger;
import com.sluice.internal.util.EventPool;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import javax.annotation.concurrent.ThreadSafe;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.BindException;
import java.net.InetSocketAddress;
import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import java.util.function.Supplier;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Standard {@link Server} implementation: an NIO acceptor thread plus {@code concurrency} connection event loops, with
 * applications running on a separate executor.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
final class DefaultServer implements Server {
	@Nonnull
	private static final String DEFAULT_HOST;
	@Nonnull
	private static final Integer DEFAULT_CONCURRENCY;
	@Nonnull
	private static final Duration DEFAULT_REQUEST_TIMEOUT;
	@Nonnull
	private static final Duration DEFAULT_KEEP_ALIVE_TIMEOUT;
	@Nonnull
	private static final Duration DEFAULT_SHUTDOWN_TIMEOUT;
	@Nonnull
	private static final Duration DEFAULT_DISCONNECT_GRACE_PERIOD;
	@Nonnull
	private static final Duration DEFAULT_SOCKET_SELECT_TIMEOUT;
	@Nonnull
	private static final Integer DEFAULT_MAXIMUM_REQUEST_HEAD_SIZE_IN_BYTES;
	@Nonnull
	private static final Integer DEFAULT_REQUEST_READ_BUFFER_SIZE_IN_BYTES;
	@Nonnull
	private static final Integer DEFAULT_SOCKET_PENDING_CONNECTION_LIMIT;
	@Nonnull
	private static final Integer DEFAULT_MAXIMUM_CONNECTIONS;
	@Nonnull
	private static final Long DEFAULT_MAXIMUM_REQUESTS;
	@Nonnull
	private static final Integer DEFAULT_WRITE_HIGH_WATERMARK_IN_BYTES;
	@Nonnull
	private static final Integer DEFAULT_WRITE_LOW_WATERMARK_IN_BYTES;
	@Nonnull
	private static final String DEFAULT_SERVER_HEADER;

	static {
		DEFAULT_HOST = "0.0.0.0";
		DEFAULT_CONCURRENCY = Runtime.getRuntime().availableProcessors();
		DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(60);
		DEFAULT_KEEP_ALIVE_TIMEOUT = Duration.ofSeconds(5);
		DEFAULT_SHUTDOWN_TIMEOUT = Duration.ofSeconds(5);
		DEFAULT_DISCONNECT_GRACE_PERIOD = Duration.ofSeconds(5);
		DEFAULT_SOCKET_SELECT_TIMEOUT = Duration.ofMillis(100);
		DEFAULT_MAXIMUM_REQUEST_HEAD_SIZE_IN_BYTES = 1_024 * 64;
		DEFAULT_REQUEST_READ_BUFFER_SIZE_IN_BYTES = 1_024 * 64;
		DEFAULT_SOCKET_PENDING_CONNECTION_LIMIT = 0;
		DEFAULT_MAXIMUM_CONNECTIONS = 0;
		DEFAULT_MAXIMUM_REQUESTS = 0L;
		DEFAULT_WRITE_HIGH_WATERMARK_IN_BYTES = 1_024 * 64;
		DEFAULT_WRITE_LOW_WATERMARK_IN_BYTES = 1_024 * 16;
		DEFAULT_SERVER_HEADER = "sluice";
	}

	@Nonnull
	private final Integer port;
	@Nonnull
	private final String host;
	@Nonnull
	private final Integer concurrency;
	@Nonnull
	private final Duration requestTimeout;
	@Nonnull
	private final Duration keepAliveTimeout;
	@Nonnull
	private final Duration shutdownTimeout;
	@Nonnull
	private final Duration disconnectGracePeriod;
	@Nonnull
	private final Duration socketSelectTimeout;
	@Nonnull
	private final Integer maximumRequestHeadSizeInBytes;
	@Nonnull
	private final Integer requestReadBufferSizeInBytes;
	@Nonnull
	private final Integer socketPendingConnectionLimit;
	@Nonnull
	private final Integer maximumConnections;
	@Nonnull
	private final Long maximumRequests;
	@Nonnull
	private final Integer writeHighWatermarkInBytes;
	@Nonnull
	private final Integer writeLowWatermarkInBytes;
	@Nonnull
	private final Integer eventPoolCapacity;
	@Nullable
	private final String serverHeader;
	@Nonnull
	private final Boolean dateHeaderEnabled;
	@Nonnull
	private final Clock clock;
	@Nonnull
	private final Supplier<ExecutorService> applicationExecutorServiceSupplier;
	@Nonnull
	private final ReentrantLock lock;
	@Nonnull
	private final AtomicBoolean requestLimitReached;
	@Nullable
	private volatile SluiceConfig sluiceConfig;
	@Nullable
	private volatile Runnable shutdownRequestHandler;
	@Nullable
	private volatile ExecutorService applicationExecutorService;
	@Nullable
	private volatile ServerState serverState;
	@Nullable
	private volatile EventLoop eventLoop;

	protected DefaultServer(@Nonnull Builder builder) {
		requireNonNull(builder);

		this.lock = new ReentrantLock();
		this.requestLimitReached = new AtomicBoolean(false);

		this.port = builder.port;
		this.host = builder.host != null ? builder.host : DEFAULT_HOST;
		this.concurrency = builder.concurrency != null ? builder.concurrency : DEFAULT_CONCURRENCY;
		this.requestTimeout = builder.requestTimeout != null ? builder.requestTimeout : DEFAULT_REQUEST_TIMEOUT;
		this.keepAliveTimeout = builder.keepAliveTimeout != null ? builder.keepAliveTimeout : DEFAULT_KEEP_ALIVE_TIMEOUT;
		this.shutdownTimeout = builder.shutdownTimeout != null ? builder.shutdownTimeout : DEFAULT_SHUTDOWN_TIMEOUT;
		this.disconnectGracePeriod = builder.disconnectGracePeriod != null ? builder.disconnectGracePeriod : DEFAULT_DISCONNECT_GRACE_PERIOD;
		this.socketSelectTimeout = builder.socketSelectTimeout != null ? builder.socketSelectTimeout : DEFAULT_SOCKET_SELECT_TIMEOUT;
		this.maximumRequestHeadSizeInBytes = builder.maximumRequestHeadSizeInBytes != null ? builder.maximumRequestHeadSizeInBytes : DEFAULT_MAXIMUM_REQUEST_HEAD_SIZE_IN_BYTES;
		this.requestReadBufferSizeInBytes = builder.requestReadBufferSizeInBytes != null ? builder.requestReadBufferSizeInBytes : DEFAULT_REQUEST_READ_BUFFER_SIZE_IN_BYTES;
		this.socketPendingConnectionLimit = builder.socketPendingConnectionLimit != null ? builder.socketPendingConnectionLimit : DEFAULT_SOCKET_PENDING_CONNECTION_LIMIT;
		this.maximumConnections = builder.maximumConnections != null ? builder.maximumConnections : DEFAULT_MAXIMUM_CONNECTIONS;
		this.maximumRequests = builder.maximumRequests != null ? builder.maximumRequests : DEFAULT_MAXIMUM_REQUESTS;
		this.writeHighWatermarkInBytes = builder.writeHighWatermarkInBytes != null ? builder.writeHighWatermarkInBytes : DEFAULT_WRITE_HIGH_WATERMARK_IN_BYTES;
		this.writeLowWatermarkInBytes = builder.writeLowWatermarkInBytes != null ? builder.writeLowWatermarkInBytes : DEFAULT_WRITE_LOW_WATERMARK_IN_BYTES;
		this.eventPoolCapacity = builder.eventPoolCapacity != null ? builder.eventPoolCapacity : EventPool.DEFAULT_CAPACITY;
		this.serverHeader = builder.serverHeaderSpecified ? builder.serverHeader : DEFAULT_SERVER_HEADER;
		this.dateHeaderEnabled = builder.dateHeaderEnabled != null ? builder.dateHeaderEnabled : true;
		this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
		this.applicationExecutorServiceSupplier = builder.applicationExecutorServiceSupplier != null ? builder.applicationExecutorServiceSupplier
				: () -> Executors.newCachedThreadPool(new NonvirtualThreadFactory("sluice-application"));

		if (this.port < 0 || this.port > 65_535)
			throw new IllegalArgumentException(format("Port must be in the range 0-65535, got %d", this.port));

		if (this.concurrency < 1)
			throw new IllegalArgumentException("Concurrency must be > 0");

		requirePositive(this.requestTimeout, "Request timeout");
		requirePositive(this.keepAliveTimeout, "Keep-alive timeout");
		requirePositive(this.socketSelectTimeout, "Socket select timeout");

		if (this.shutdownTimeout.isNegative())
			throw new IllegalArgumentException("Shutdown timeout must be >= 0");

		if (this.disconnectGracePeriod.isNegative())
			throw new IllegalArgumentException("Disconnect grace period must be >= 0");

		if (this.maximumConnections < 0)
			throw new IllegalArgumentException("Maximum connections must be >= 0");

		if (this.maximumRequests < 0)
			throw new IllegalArgumentException("Maximum requests must be >= 0");

		if (this.maximumRequestHeadSizeInBytes < 1)
			throw new IllegalArgumentException("Maximum request head size must be > 0");

		if (this.requestReadBufferSizeInBytes < 1)
			throw new IllegalArgumentException("Request read buffer size must be > 0");

		if (this.writeLowWatermarkInBytes < 0 || this.writeLowWatermarkInBytes >= this.writeHighWatermarkInBytes)
			throw new IllegalArgumentException(format("Write watermarks must satisfy 0 <= low < high, got low=%d, high=%d",
					this.writeLowWatermarkInBytes, this.writeHighWatermarkInBytes));

		if (this.eventPoolCapacity < 0)
			throw new IllegalArgumentException("Event pool capacity must be >= 0");
	}

	private static void requirePositive(@Nonnull Duration duration,
																			@Nonnull String name) {
		if (duration.isNegative() || duration.isZero())
			throw new IllegalArgumentException(format("%s must be > 0", name));
	}

	@Override
	public void start() {
		getLock().lock();

		try {
			if (isStarted())
				return;

			SluiceConfig sluiceConfig = getSluiceConfig().orElse(null);

			if (sluiceConfig == null)
				throw new IllegalStateException(format("%s was not initialized; it must be managed by a %s", getClass().getSimpleName(), Sluice.class.getSimpleName()));

			Options options = new Options()
					.withHost(getHost())
					.withPort(getPort())
					.withConcurrency(getConcurrency())
					.withRequestTimeout(getRequestTimeout())
					.withKeepAliveTimeout(getKeepAliveTimeout())
					.withDisconnectGracePeriod(getDisconnectGracePeriod())
					.withResolution(getSocketSelectTimeout())
					.withReadBufferSize(getRequestReadBufferSizeInBytes())
					.withMaxRequestHeadSize(getMaximumRequestHeadSizeInBytes())
					.withAcceptLength(getSocketPendingConnectionLimit())
					.withMaxConnections(getMaximumConnections())
					.withWriteWatermarks(getWriteHighWatermarkInBytes(), getWriteLowWatermarkInBytes())
					.withServerHeader(getServerHeader().orElse(null))
					.withDateHeaderEnabled(getDateHeaderEnabled());

			Application application = sluiceConfig.getApplication();
			ServerState serverState = new ServerState(getClock());
			EventPool eventPool = new EventPool(getEventPoolCapacity());

			Handler handler = (cycle) -> dispatch(cycle, application);

			ServerContext context = new ServerContext(options, serverState, eventPool, handler,
					new ObservingConnectionListener(), new ObservingCycleListener(), new Slf4jLogger());

			this.requestLimitReached.set(false);
			this.serverState = serverState;
			this.applicationExecutorService = getApplicationExecutorServiceSupplier().get();

			EventLoop eventLoop = null;

			try {
				eventLoop = new EventLoop(context);
				eventLoop.start();
				this.eventLoop = eventLoop;
			} catch (BindException e) {
				cleanupFailedStart(eventLoop);
				throw new UncheckedIOException(format("Sluice was unable to start the HTTP server - port %d is already in use.", options.port()), e);
			} catch (IOException e) {
				cleanupFailedStart(eventLoop);
				throw new UncheckedIOException(e);
			} catch (RuntimeException e) {
				cleanupFailedStart(eventLoop);
				throw e;
			}
		} finally {
			getLock().unlock();
		}
	}

	private void dispatch(@Nonnull RequestResponseCycle cycle,
												@Nonnull Application application) {
		ExecutorService applicationExecutorServiceReference = this.applicationExecutorService;

		if (applicationExecutorServiceReference == null) {
			cycle.reject(new IllegalStateException("Application executor service is unavailable"));
			return;
		}

		try {
			Future<?> future = applicationExecutorServiceReference.submit(() -> cycle.run(application));
			cycle.applicationFuture(future);
		} catch (RejectedExecutionException e) {
			safelyLog(LogEvent.with(LogEventType.SERVER_INTERNAL_ERROR, "Application executor rejected task")
					.throwable(e)
					.build());
			cycle.reject(e);
		}
	}

	private void cleanupFailedStart(@Nullable EventLoop eventLoop) {
		if (eventLoop != null) {
			eventLoop.stop();

			try {
				eventLoop.join();
			} catch (InterruptedException e) {
				Thread.currentThread().interrupt();
			}
		}

		ExecutorService applicationExecutorService = this.applicationExecutorService;

		if (applicationExecutorService != null)
			applicationExecutorService.shutdownNow();

		this.eventLoop = null;
		this.applicationExecutorService = null;
	}

	@Override
	public void stop() {
		getLock().lock();

		try {
			if (!isStarted())
				return;

			EventLoop eventLoop = getEventLoop().get();
			ServerState serverState = getServerState().get();
			boolean interrupted = false;

			// Single wall-clock budget for the whole server shutdown
			final long deadlineNanos = System.nanoTime() + getShutdownTimeout().toNanos();

			try {
				// 1. No new connections
				eventLoop.stopAccepting();

				// 2. Let dispatched exchanges finish, refuse to parse further requests
				eventLoop.shutdownConnections();

				// 3. Wait for the last connection to close
				Duration remaining = Duration.ofNanos(Math.max(0L, deadlineNanos - System.nanoTime()));

				if (!serverState.awaitConnectionsDrained(remaining)) {
					safelyLog(LogEvent.with(LogEventType.SHUTDOWN_TIMEOUT_EXCEEDED,
									format("%d connection[s] still open after shutdown timeout of %s; closing them", serverState.getActiveConnections(), getShutdownTimeout()))
							.build());

					eventLoop.forceCloseConnections();
				}
			} catch (InterruptedException e) {
				interrupted = true;
				eventLoop.forceCloseConnections();
			}

			try {
				eventLoop.stop();
				eventLoop.join();
			} catch (InterruptedException e) {
				interrupted = true;
			}

			try {
				ExecutorService applicationExecutorService = getApplicationExecutorService().orElse(null);

				if (applicationExecutorService != null) {
					applicationExecutorService.shutdown();

					long remMillis = Math.max(0L, TimeUnit.NANOSECONDS.toMillis(deadlineNanos - System.nanoTime()));
					boolean done = remMillis > 0L && applicationExecutorService.awaitTermination(remMillis, TimeUnit.MILLISECONDS);

					if (!done) {
						// Escalate: interrupt running applications
						applicationExecutorService.shutdownNow();
						applicationExecutorService.awaitTermination(100L, TimeUnit.MILLISECONDS);
					}
				}
			} catch (InterruptedException e) {
				interrupted = true;
			} finally {
				if (interrupted)
					Thread.currentThread().interrupt();
			}
		} finally {
			this.eventLoop = null;
			this.applicationExecutorService = null;

			getLock().unlock();
		}
	}

	@Nonnull
	@Override
	public Boolean isStarted() {
		getLock().lock();

		try {
			return getEventLoop().isPresent();
		} finally {
			getLock().unlock();
		}
	}

	@Nonnull
	@Override
	public Optional<ServerState> getServerState() {
		return Optional.ofNullable(this.serverState);
	}

	@Override
	public void initialize(@Nonnull SluiceConfig sluiceConfig,
												 @Nonnull Runnable shutdownRequestHandler) {
		requireNonNull(sluiceConfig);
		requireNonNull(shutdownRequestHandler);

		this.sluiceConfig = sluiceConfig;
		this.shutdownRequestHandler = shutdownRequestHandler;
	}

	/**
	 * Bridges event-loop connection notifications to the configured {@link LifecycleObserver}.
	 */
	private final class ObservingConnectionListener implements ConnectionListener {
		@Override
		public void didAcceptConnection(@Nullable InetSocketAddress remoteAddress) {
			safelyObserve("didAcceptConnection", lifecycleObserver -> lifecycleObserver.didAcceptConnection(remoteAddress));
		}

		@Override
		public void didFailToAcceptConnection(@Nullable InetSocketAddress remoteAddress,
																					@Nonnull ConnectionRejectionReason reason) {
			safelyLog(LogEvent.with(LogEventType.CONNECTION_REJECTED, format("Refused connection from %s (%s)", remoteAddress, reason.name()))
					.remoteAddress(remoteAddress)
					.build());
			safelyObserve("didFailToAcceptConnection", lifecycleObserver -> lifecycleObserver.didFailToAcceptConnection(remoteAddress, reason));
		}

		@Override
		public void didCloseConnection(@Nullable InetSocketAddress remoteAddress) {
			safelyObserve("didCloseConnection", lifecycleObserver -> lifecycleObserver.didCloseConnection(remoteAddress));
		}

		@Override
		public void didServeRequest(long requestsServed) {
			Long maximumRequests = getMaximumRequests();

			if (maximumRequests == 0 || requestsServed < maximumRequests)
				return;

			if (!requestLimitReached.compareAndSet(false, true))
				return;

			safelyLog(LogEvent.with(LogEventType.REQUEST_LIMIT_REACHED,
					format("Served %d request[s], reaching the limit of %d; shutting down", requestsServed, maximumRequests)).build());

			Runnable shutdownRequestHandler = DefaultServer.this.shutdownRequestHandler;

			if (shutdownRequestHandler != null)
				shutdownRequestHandler.run();
		}
	}

	/**
	 * Bridges per-exchange notifications to the configured {@link LifecycleObserver}.
	 */
	private final class ObservingCycleListener implements CycleListener {
		@Override
		public void didStartCycle(@Nonnull Request request) {
			safelyObserve("didStartRequestHandling", lifecycleObserver -> lifecycleObserver.didStartRequestHandling(request));
		}

		@Override
		public void didFinishCycle(@Nonnull Request request,
															 @Nonnull CycleOutcome outcome,
															 @Nonnull Duration duration,
															 @Nullable Throwable throwable) {
			safelyObserve("didFinishRequestHandling", lifecycleObserver -> lifecycleObserver.didFinishRequestHandling(request, outcome, duration, throwable));
		}

		@Override
		public void didReceiveLogEvent(@Nonnull LogEvent logEvent) {
			safelyLog(logEvent);
		}
	}

	private void safelyObserve(@Nonnull String callbackName,
														 @Nonnull Consumer<LifecycleObserver> callback) {
		LifecycleObserver lifecycleObserver = getLifecycleObserver().orElse(null);

		if (lifecycleObserver == null)
			return;

		try {
			callback.accept(lifecycleObserver);
		} catch (Throwable throwable) {
			safelyLog(LogEvent.with(LogEventType.LIFECYCLE_OBSERVER_FAILED,
							format("An exception occurred while invoking %s#%s", LifecycleObserver.class.getSimpleName(), callbackName))
					.throwable(throwable)
					.build());
		}
	}

	protected void safelyLog(@Nonnull LogEvent logEvent) {
		requireNonNull(logEvent);

		try {
			getLifecycleObserver().ifPresent(lifecycleObserver -> lifecycleObserver.didReceiveLogEvent(logEvent));
		} catch (Throwable throwable) {
			// The LifecycleObserver implementation errored out, but we can't let that affect us.
			// Not much else we can do here but dump to stderr
			throwable.printStackTrace(System.err);
		}
	}

	@Nonnull
	protected Optional<LifecycleObserver> getLifecycleObserver() {
		SluiceConfig sluiceConfig = this.sluiceConfig;
		return sluiceConfig == null ? Optional.empty() : Optional.of(sluiceConfig.getLifecycleObserver());
	}

	@Nonnull
	protected Optional<SluiceConfig> getSluiceConfig() {
		return Optional.ofNullable(this.sluiceConfig);
	}

	@Nonnull
	protected Optional<EventLoop> getEventLoop() {
		return Optional.ofNullable(this.eventLoop);
	}

	@Nonnull
	protected Optional<ExecutorService> getApplicationExecutorService() {
		return Optional.ofNullable(this.applicationExecutorService);
	}

	@Nonnull
	protected Supplier<ExecutorService> getApplicationExecutorServiceSupplier() {
		return this.applicationExecutorServiceSupplier;
	}

	@Nonnull
	protected Integer getPort() {
		return this.port;
	}

	@Nonnull
	protected String getHost() {
		return this.host;
	}

	@Nonnull
	protected Integer getConcurrency() {
		return this.concurrency;
	}

	@Nonnull
	protected Duration getRequestTimeout() {
		return this.requestTimeout;
	}

	@Nonnull
	protected Duration getKeepAliveTimeout() {
		return this.keepAliveTimeout;
	}

	@Nonnull
	protected Duration getShutdownTimeout() {
		return this.shutdownTimeout;
	}

	@Nonnull
	protected Duration getDisconnectGracePeriod() {
		return this.disconnectGracePeriod;
	}

	@Nonnull
	protected Duration getSocketSelectTimeout() {
		return this.socketSelectTimeout;
	}

	@Nonnull
	protected Integer getMaximumRequestHeadSizeInBytes() {
		return this.maximumRequestHeadSizeInBytes;
	}

	@Nonnull
	protected Integer getRequestReadBufferSizeInBytes() {
		return this.requestReadBufferSizeInBytes;
	}

	@Nonnull
	protected Integer getSocketPendingConnectionLimit() {
		return this.socketPendingConnectionLimit;
	}

	@Nonnull
	protected Integer getMaximumConnections() {
		return this.maximumConnections;
	}

	@Nonnull
	protected Long getMaximumRequests() {
		return this.maximumRequests;
	}

	@Nonnull
	protected Integer getWriteHighWatermarkInBytes() {
		return this.writeHighWatermarkInBytes;
	}

	@Nonnull
	protected Integer getWriteLowWatermarkInBytes() {
		return this.writeLowWatermarkInBytes;
	}

	@Nonnull
	protected Integer getEventPoolCapacity() {
		return this.eventPoolCapacity;
	}

	@Nonnull
	protected Optional<String> getServerHeader() {
		return Optional.ofNullable(this.serverHeader);
	}

	@Nonnull
	protected Boolean getDateHeaderEnabled() {
		return this.dateHeaderEnabled;
	}

	@Nonnull
	protected Clock getClock() {
		return this.clock;
	}

	@Nonnull
	protected ReentrantLock getLock() {
		return this.lock;
	}

	@ThreadSafe
	protected static class NonvirtualThreadFactory implements ThreadFactory {
		@Nonnull
		private final String namePrefix;
		@Nonnull
		private final AtomicInteger idGenerator;

		public NonvirtualThreadFactory(@Nonnull String namePrefix) {
			requireNonNull(namePrefix);

			this.namePrefix = namePrefix;
			this.idGenerator = new AtomicInteger(0);
		}

		@Override
		@Nonnull
		public Thread newThread(@Nonnull Runnable runnable) {
			String name = format("%s-%s", getNamePrefix(), getIdGenerator().incrementAndGet());
			return new Thread(runnable, name);
		}

		@Nonnull
		protected String getNamePrefix() {
			return this.namePrefix;
		}

		@Nonnull
		protected AtomicInteger getIdGenerator() {
			return this.idGenerator;
		}
	}
}
