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

import com.sluice.exception.LifespanException;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.ThreadSafe;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArraySet;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Sluice's main class - the lifecycle controller for a {@link Server} and the {@link Application} it fronts.
 * <p>
 * <pre>{@code SluiceConfig config = SluiceConfig.withServer(
 *   Server.withPort(8080).build()
 * ).application((request, responseWriter) -> {
 *   responseWriter.respond(200, Map.of("Content-Type", List.of("text/plain")), "Hello".getBytes(StandardCharsets.UTF_8));
 * }).build();
 *
 * try (Sluice sluice = Sluice.withConfig(config)) {
 *   sluice.start();
 *   System.out.println("Sluice started, press [enter] to exit");
 *   sluice.awaitShutdown(ShutdownTrigger.ENTER_KEY, ShutdownTrigger.JVM_SHUTDOWN);
 * }}</pre>
 * <p>
 * {@link #start()} runs the application's {@link Lifespan#startup()} hook before the server accepts a single
 * connection; {@link #stop()} drains the server and then runs {@link Lifespan#shutdown()}. The current position in
 * that lifecycle is exposed as a {@link LifecycleState}.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public final class Sluice implements AutoCloseable {
	/**
	 * Acquires a Sluice instance with the given configuration.
	 *
	 * @param sluiceConfig configuration that drives the Sluice system
	 * @return a Sluice instance
	 */
	@NonNull
	public static Sluice withConfig(@NonNull SluiceConfig sluiceConfig) {
		requireNonNull(sluiceConfig);
		return new Sluice(sluiceConfig);
	}

	@NonNull
	private final SluiceConfig sluiceConfig;
	@NonNull
	private final ReentrantLock lock;
	@NonNull
	private final AtomicReference<LifecycleState> lifecycleState;
	@NonNull
	private final CountDownLatch awaitShutdownLatch;
	@NonNull
	private final AtomicBoolean shutdownRequested;

	private Sluice(@NonNull SluiceConfig sluiceConfig) {
		requireNonNull(sluiceConfig);

		this.sluiceConfig = sluiceConfig;
		this.lock = new ReentrantLock();
		this.lifecycleState = new AtomicReference<>(LifecycleState.NOT_STARTED);
		this.awaitShutdownLatch = new CountDownLatch(1);
		this.shutdownRequested = new AtomicBoolean(false);

		sluiceConfig.getServer().initialize(sluiceConfig, this::handleShutdownRequest);
	}

	/**
	 * Runs the application's startup hook, then starts the managed server.
	 * <p>
	 * If this instance is already starting or serving, this is a no-op.
	 *
	 * @throws LifespanException     if the application's startup hook failed; the server was never started
	 * @throws IllegalStateException if this instance was already stopped
	 */
	public void start() {
		getLock().lock();

		try {
			LifecycleState currentState = getLifecycleState();

			if (currentState == LifecycleState.STARTING || currentState == LifecycleState.SERVING)
				return;

			if (currentState != LifecycleState.NOT_STARTED)
				throw new IllegalStateException(format("%s cannot be started from state %s", Sluice.class.getSimpleName(), currentState.name()));

			this.lifecycleState.set(LifecycleState.STARTING);

			SluiceConfig sluiceConfig = getSluiceConfig();
			LifecycleObserver lifecycleObserver = sluiceConfig.getLifecycleObserver();
			Lifespan lifespan = sluiceConfig.getLifespan();
			Server server = sluiceConfig.getServer();

			// 1. Notify global intent to start
			safelyObserve("willStartSluice", () -> lifecycleObserver.willStartSluice(this));

			try {
				// 2. Application startup must acknowledge readiness before any connection is accepted
				try {
					lifespan.startup();
				} catch (Throwable t) {
					throw new LifespanException(format("%s startup failed", Lifespan.class.getSimpleName()), t);
				}

				// 3. Attempt to start server
				safelyObserve("willStartServer", () -> lifecycleObserver.willStartServer(server));

				try {
					server.start();
					safelyObserve("didStartServer", () -> lifecycleObserver.didStartServer(server));
				} catch (Throwable t) {
					safelyObserve("didFailToStartServer", () -> lifecycleObserver.didFailToStartServer(server, t));
					safelyShutdownLifespan(lifespan);
					throw t;
				}

				// 4. Global success
				this.lifecycleState.set(LifecycleState.SERVING);
				safelyObserve("didStartSluice", () -> lifecycleObserver.didStartSluice(this));
			} catch (Throwable t) {
				// 5. Global failure
				this.lifecycleState.set(LifecycleState.STOPPED);
				getAwaitShutdownLatch().countDown();
				safelyObserve("didFailToStartSluice", () -> lifecycleObserver.didFailToStartSluice(this, t));

				// Ensure the exception bubbles up so the application knows startup failed
				if (t instanceof RuntimeException)
					throw (RuntimeException) t;

				throw new RuntimeException(t);
			}
		} finally {
			getLock().unlock();
		}
	}

	/**
	 * Gracefully stops the managed server, then runs the application's shutdown hook.
	 * <p>
	 * Blocks until every connection has drained or the server's shutdown timeout has elapsed. If this instance is not
	 * serving, this is a no-op.
	 */
	public void stop() {
		getLock().lock();

		try {
			if (getLifecycleState() != LifecycleState.SERVING)
				return;

			this.lifecycleState.set(LifecycleState.STOPPING);

			SluiceConfig sluiceConfig = getSluiceConfig();
			LifecycleObserver lifecycleObserver = sluiceConfig.getLifecycleObserver();
			Server server = sluiceConfig.getServer();

			// 1. Notify global intent to stop
			safelyObserve("willStopSluice", () -> lifecycleObserver.willStopSluice(this));

			Throwable firstEncounteredException = null;

			// 2. Drain and stop the server
			if (server.isStarted()) {
				safelyObserve("willStopServer", () -> lifecycleObserver.willStopServer(server));

				try {
					server.stop();
					safelyObserve("didStopServer", () -> lifecycleObserver.didStopServer(server));
				} catch (Throwable t) {
					firstEncounteredException = t;
					safelyObserve("didFailToStopServer", () -> lifecycleObserver.didFailToStopServer(server, t));
				}
			}

			// 3. Application cleanup
			try {
				sluiceConfig.getLifespan().shutdown();
			} catch (Throwable t) {
				if (firstEncounteredException == null)
					firstEncounteredException = t;
			}

			this.lifecycleState.set(LifecycleState.STOPPED);

			// 4. Global completion (Success or Failure)
			if (firstEncounteredException == null) {
				safelyObserve("didStopSluice", () -> lifecycleObserver.didStopSluice(this));
			} else {
				Throwable failure = firstEncounteredException;
				safelyObserve("didFailToStopSluice", () -> lifecycleObserver.didFailToStopSluice(this, failure));
			}
		} finally {
			try {
				if (getLifecycleState() == LifecycleState.STOPPED)
					getAwaitShutdownLatch().countDown();
			} finally {
				getLock().unlock();
			}
		}
	}

	/**
	 * Blocks the current thread until this instance has stopped - because {@link #stop()} was called, because the
	 * server asked to be shut down (for example on reaching its request limit), or because one of the provided
	 * {@code shutdownTriggers} occurred.
	 * <p>
	 * This method will automatically invoke this instance's {@link #stop()} method when a trigger occurs.
	 * <p>
	 * <strong>Notes regarding {@link ShutdownTrigger#ENTER_KEY}:</strong>
	 * <ul>
	 *   <li>It will invoke {@link #stop()} on <i>all</i> Sluice instances, as stdin is process-wide</li>
	 *   <li>It is ignored if stdin is unusable, in which case {@link LifecycleObserver#didReceiveLogEvent(LogEvent)} is fired with an event of type {@link LogEventType#CONFIGURATION_UNSUPPORTED}</li>
	 * </ul>
	 *
	 * @param shutdownTriggers trigger[s] which signal that shutdown should occur
	 * @throws InterruptedException if the current thread is interrupted while waiting
	 */
	public void awaitShutdown(@Nullable ShutdownTrigger... shutdownTriggers) throws InterruptedException {
		Thread shutdownHook = null;
		boolean registeredEnterKeyShutdownTrigger = false;
		Set<ShutdownTrigger> shutdownTriggersAsSet = shutdownTriggers == null || shutdownTriggers.length == 0 ? Set.of() : EnumSet.copyOf(Arrays.asList(shutdownTriggers));

		try {
			if (shutdownTriggersAsSet.contains(ShutdownTrigger.ENTER_KEY)) {
				registeredEnterKeyShutdownTrigger = KeypressManager.register(this); // returns false if stdin unusable

				if (!registeredEnterKeyShutdownTrigger)
					safelyLog(LogEvent.with(LogEventType.CONFIGURATION_UNSUPPORTED,
							format("Ignoring request for %s.%s - it is unsupported in this environment (stdin is unavailable)", ShutdownTrigger.class.getSimpleName(), ShutdownTrigger.ENTER_KEY.name())
					).build());
			}

			if (shutdownTriggersAsSet.contains(ShutdownTrigger.JVM_SHUTDOWN)) {
				shutdownHook = new Thread(this::stopSafely, "sluice-shutdown-hook");
				Runtime.getRuntime().addShutdownHook(shutdownHook);
			}

			// Wait until "stop" finishes
			getAwaitShutdownLatch().await();
		} finally {
			if (registeredEnterKeyShutdownTrigger)
				KeypressManager.unregister(this);

			if (shutdownHook != null) {
				try {
					Runtime.getRuntime().removeShutdownHook(shutdownHook);
				} catch (IllegalStateException e) {
					// Expected when the JVM is already shutting down; the hook is running or has run
					safelyLog(LogEvent.with(LogEventType.CONFIGURATION_UNSUPPORTED, "JVM is shutting down; shutdown hook left in place")
							.throwable(e)
							.build());
				}
			}
		}
	}

	/**
	 * {@link AutoCloseable}-enabled synonym for {@link #stop()}.
	 */
	@Override
	public void close() {
		stop();
	}

	/**
	 * Is the managed server currently serving?
	 *
	 * @return {@code true} if this instance is in state {@link LifecycleState#SERVING}
	 */
	@NonNull
	public Boolean isStarted() {
		return getLifecycleState() == LifecycleState.SERVING;
	}

	@NonNull
	public LifecycleState getLifecycleState() {
		return this.lifecycleState.get();
	}

	@NonNull
	public SluiceConfig getSluiceConfig() {
		return this.sluiceConfig;
	}

	/**
	 * Invoked on a server thread when the server wants to be shut down. {@link #stop()} blocks until connections
	 * drain, so it must run elsewhere.
	 */
	private void handleShutdownRequest() {
		if (!shutdownRequested.compareAndSet(false, true))
			return;

		Thread thread = new Thread(this::stopSafely, "sluice-requested-shutdown");
		thread.start();
	}

	private void stopSafely() {
		try {
			stop();
		} catch (Throwable t) {
			safelyLog(LogEvent.with(LogEventType.SERVER_INTERNAL_ERROR, "Unable to stop Sluice")
					.throwable(t)
					.build());
		}
	}

	private void safelyShutdownLifespan(@NonNull Lifespan lifespan) {
		try {
			lifespan.shutdown();
		} catch (Throwable t) {
			safelyLog(LogEvent.with(LogEventType.SERVER_INTERNAL_ERROR, format("%s shutdown failed after the server failed to start", Lifespan.class.getSimpleName()))
					.throwable(t)
					.build());
		}
	}

	private void safelyObserve(@NonNull String callbackName,
														 @NonNull Runnable callback) {
		try {
			callback.run();
		} catch (Throwable throwable) {
			safelyLog(LogEvent.with(LogEventType.LIFECYCLE_OBSERVER_FAILED,
							format("An exception occurred while invoking %s#%s", LifecycleObserver.class.getSimpleName(), callbackName))
					.throwable(throwable)
					.build());
		}
	}

	private void safelyLog(@NonNull LogEvent logEvent) {
		try {
			getSluiceConfig().getLifecycleObserver().didReceiveLogEvent(logEvent);
		} catch (Throwable throwable) {
			// Not much else we can do here but dump to stderr
			throwable.printStackTrace(System.err);
		}
	}

	@NonNull
	private ReentrantLock getLock() {
		return this.lock;
	}

	@NonNull
	private CountDownLatch getAwaitShutdownLatch() {
		return this.awaitShutdownLatch;
	}

	/**
	 * Handles "awaitShutdown" for {@link ShutdownTrigger#ENTER_KEY} by listening to stdin - all Sluice instances are stopped on keypress.
	 */
	@ThreadSafe
	private static final class KeypressManager {
		@NonNull
		private static final Set<@NonNull Sluice> SLUICE_REGISTRY;
		@NonNull
		private static final AtomicBoolean LISTENER_STARTED;

		static {
			SLUICE_REGISTRY = new CopyOnWriteArraySet<>();
			LISTENER_STARTED = new AtomicBoolean(false);
		}

		/**
		 * Registers a Sluice for Enter-to-stop support. Returns true iff a listener is (or was already) active.
		 */
		@NonNull
		synchronized static Boolean register(@NonNull Sluice sluice) {
			requireNonNull(sluice);

			if (!canReadFromStdin())
				return false;

			SLUICE_REGISTRY.add(sluice);

			// A single process-wide listener
			if (LISTENER_STARTED.compareAndSet(false, true)) {
				Thread thread = new Thread(KeypressManager::runLoop, "sluice-keypress-shutdown-listener");
				thread.setDaemon(true);
				thread.start();
			}

			return true;
		}

		synchronized static void unregister(@NonNull Sluice sluice) {
			SLUICE_REGISTRY.remove(sluice);
		}

		@NonNull
		private static Boolean canReadFromStdin() {
			if (System.in == null)
				return false;

			try {
				return System.in.available() >= 0;
			} catch (IOException e) {
				return false;
			}
		}

		/**
		 * Single blocking read on stdin. On any line (or EOF), stop all registered instances.
		 */
		private static void runLoop() {
			try (BufferedReader bufferedReader = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8))) {
				bufferedReader.readLine();
			} catch (IOException e) {
				for (Sluice sluice : SLUICE_REGISTRY)
					sluice.safelyLog(LogEvent.with(LogEventType.SERVER_INTERNAL_ERROR, "Unable to read stdin; treating it as a shutdown request")
							.throwable(e)
							.build());
			}

			stopAll();
		}

		synchronized private static void stopAll() {
			for (Sluice sluice : SLUICE_REGISTRY)
				sluice.stopSafely();
		}

		private KeypressManager() {}
	}
}
