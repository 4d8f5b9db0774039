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

import com.sluice.TestSupport.RawResponse;
import com.sluice.exception.LifespanException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static com.sluice.TestSupport.connectWithRetry;
import static com.sluice.TestSupport.findFreePort;
import static com.sluice.TestSupport.readResponse;
import static com.sluice.TestSupport.send;

/**
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@Timeout(value = 30, unit = TimeUnit.SECONDS)
public class SluiceLifecycleTests {
	private static final Application OK = (request, responseWriter) ->
			responseWriter.respond(200, Map.of(), "ok".getBytes(StandardCharsets.UTF_8));

	@Test
	public void start_and_stop_walk_through_states() throws Exception {
		int port = findFreePort();
		Sluice sluice = Sluice.withConfig(SluiceConfig.withServer(TestSupport.quietServer(port))
				.application(OK)
				.lifecycleObserver(new TestSupport.QuietLifecycleObserver())
				.build());

		Assertions.assertEquals(LifecycleState.NOT_STARTED, sluice.getLifecycleState());
		Assertions.assertFalse(sluice.isStarted());

		sluice.start();
		Assertions.assertEquals(LifecycleState.SERVING, sluice.getLifecycleState());
		Assertions.assertTrue(sluice.isStarted());

		// Starting again is a no-op
		sluice.start();

		try (Socket socket = connectWithRetry("127.0.0.1", port, 2_000)) {
			send(socket, "GET / HTTP/1.1\r\nHost: localhost\r\n\r\n");
			Assertions.assertEquals("ok", readResponse(socket.getInputStream()).body());
		}

		sluice.stop();
		Assertions.assertEquals(LifecycleState.STOPPED, sluice.getLifecycleState());
		Assertions.assertFalse(sluice.getSluiceConfig().getServer().isStarted());

		// Stopping again is a no-op, restarting is not allowed
		sluice.stop();
		Assertions.assertThrows(IllegalStateException.class, sluice::start);

		// Port is free again
		try (ServerSocket serverSocket = new ServerSocket()) {
			serverSocket.setReuseAddress(true);
			serverSocket.bind(new InetSocketAddress("127.0.0.1", port));
		}
	}

	@Test
	public void observer_sees_callbacks_in_order() {
		int port = findFreePortUnchecked();
		RecordingLifecycleObserver observer = new RecordingLifecycleObserver();

		try (Sluice sluice = Sluice.withConfig(SluiceConfig.withServer(TestSupport.quietServer(port))
				.application(OK)
				.lifecycleObserver(observer)
				.build())) {
			sluice.start();
		}

		Assertions.assertEquals(List.of(
				"willStartSluice", "willStartServer", "didStartServer", "didStartSluice",
				"willStopSluice", "willStopServer", "didStopServer", "didStopSluice"), observer.callbacks);
	}

	@Test
	public void lifespan_startup_failure_prevents_serving() throws Exception {
		int port = findFreePort();
		RecordingLifecycleObserver observer = new RecordingLifecycleObserver();
		IllegalStateException failure = new IllegalStateException("database unavailable");

		Sluice sluice = Sluice.withConfig(SluiceConfig.withServer(TestSupport.quietServer(port))
				.application(OK)
				.lifespan(new Lifespan() {
					@Override
					public void startup() {
						throw failure;
					}
				})
				.lifecycleObserver(observer)
				.build());

		LifespanException e = Assertions.assertThrows(LifespanException.class, sluice::start);

		Assertions.assertSame(failure, e.getCause());
		Assertions.assertEquals(LifecycleState.STOPPED, sluice.getLifecycleState());
		Assertions.assertFalse(sluice.getSluiceConfig().getServer().isStarted());
		Assertions.assertFalse(observer.callbacks.contains("willStartServer"));
		Assertions.assertTrue(observer.callbacks.contains("didFailToStartSluice"));

		// awaitShutdown must not hang once startup failed
		sluice.awaitShutdown();
	}

	@Test
	public void lifespan_shutdown_runs_after_server_stops() {
		int port = findFreePortUnchecked();
		List<String> events = new CopyOnWriteArrayList<>();
		Server server = TestSupport.quietServer(port);

		Sluice sluice = Sluice.withConfig(SluiceConfig.withServer(server)
				.application(OK)
				.lifespan(new Lifespan() {
					@Override
					public void startup() {
						events.add("startup, server started=" + server.isStarted());
					}

					@Override
					public void shutdown() {
						events.add("shutdown, server started=" + server.isStarted());
					}
				})
				.lifecycleObserver(new TestSupport.QuietLifecycleObserver())
				.build());

		sluice.start();
		sluice.stop();

		Assertions.assertEquals(List.of("startup, server started=false", "shutdown, server started=false"), events);
	}

	@Test
	public void port_in_use_fails_start_and_shuts_lifespan_down() throws Exception {
		try (ServerSocket occupied = new ServerSocket()) {
			occupied.setReuseAddress(false);
			occupied.bind(new InetSocketAddress("127.0.0.1", 0));
			int port = occupied.getLocalPort();

			CountDownLatch lifespanShutdown = new CountDownLatch(1);
			DefaultServer server = (DefaultServer) TestSupport.quietServer(port);

			Sluice sluice = Sluice.withConfig(SluiceConfig.withServer(server)
					.application(OK)
					.lifespan(new Lifespan() {
						@Override
						public void shutdown() {
							lifespanShutdown.countDown();
						}
					})
					.lifecycleObserver(new TestSupport.QuietLifecycleObserver())
					.build());

			Assertions.assertThrows(UncheckedIOException.class, sluice::start);
			Assertions.assertEquals(LifecycleState.STOPPED, sluice.getLifecycleState());
			Assertions.assertEquals(0L, lifespanShutdown.getCount());
			Assertions.assertTrue(server.getEventLoop().isEmpty());
			Assertions.assertTrue(server.getApplicationExecutorService().isEmpty());
		}
	}

	@Test
	public void graceful_shutdown_finishes_in_flight_exchanges() throws Exception {
		int port = findFreePort();
		int clients = 3;
		CountDownLatch allStarted = new CountDownLatch(clients);
		CountDownLatch release = new CountDownLatch(1);

		LifecycleObserver observer = new TestSupport.QuietLifecycleObserver() {
			@Override
			public void didStartRequestHandling(Request request) {
				allStarted.countDown();
			}
		};

		Application application = (request, responseWriter) -> {
			release.await();
			responseWriter.respond(200, Map.of(), request.getPath().getBytes(StandardCharsets.UTF_8));
		};

		Sluice sluice = Sluice.withConfig(SluiceConfig.withServer(Server.withPort(port)
						.host("127.0.0.1")
						.concurrency(2)
						.shutdownTimeout(Duration.ofSeconds(10))
						.build())
				.application(application)
				.lifecycleObserver(observer)
				.build());

		sluice.start();

		List<Socket> sockets = new ArrayList<>();

		try {
			for (int i = 0; i < clients; i++) {
				Socket socket = connectWithRetry("127.0.0.1", port, 2_000);
				sockets.add(socket);
				send(socket, "GET /client-" + i + " HTTP/1.1\r\nHost: localhost\r\n\r\n");
			}

			Assertions.assertTrue(allStarted.await(5, TimeUnit.SECONDS));

			Thread stopper = new Thread(sluice::stop);
			stopper.start();

			// Shutdown is waiting on the exchanges, not finishing without them
			stopper.join(300);
			Assertions.assertTrue(stopper.isAlive());
			Assertions.assertEquals(LifecycleState.STOPPING, sluice.getLifecycleState());

			// New connections are refused while draining
			Assertions.assertThrows(IOException.class, () -> {
				try (Socket late = new Socket()) {
					late.connect(new InetSocketAddress("127.0.0.1", port), 500);
					late.setSoTimeout(2_000);
					send(late, "GET / HTTP/1.1\r\nHost: localhost\r\n\r\n");
					readResponse(late.getInputStream());
				}
			});

			release.countDown();

			for (int i = 0; i < clients; i++) {
				RawResponse response = readResponse(sockets.get(i).getInputStream());
				Assertions.assertEquals(200, response.statusCode());
				Assertions.assertEquals("/client-" + i, response.body());
				Assertions.assertEquals("close", response.header("Connection").orElse(null));
			}

			stopper.join(10_000);
			Assertions.assertFalse(stopper.isAlive());
			Assertions.assertEquals(LifecycleState.STOPPED, sluice.getLifecycleState());
		} finally {
			release.countDown();

			for (Socket socket : sockets)
				socket.close();

			sluice.stop();
		}
	}

	@Test
	public void shutdown_timeout_forces_connections_closed() throws Exception {
		int port = findFreePort();
		CountDownLatch started = new CountDownLatch(1);
		CountDownLatch interrupted = new CountDownLatch(1);
		List<LogEventType> logEventTypes = new CopyOnWriteArrayList<>();

		LifecycleObserver observer = new LifecycleObserver() {
			@Override
			public void didStartRequestHandling(Request request) {
				started.countDown();
			}

			@Override
			public void didReceiveLogEvent(LogEvent logEvent) {
				logEventTypes.add(logEvent.getLogEventType());
			}
		};

		Application application = (request, responseWriter) -> {
			try {
				new CountDownLatch(1).await();
			} catch (InterruptedException e) {
				interrupted.countDown();
				throw e;
			}
		};

		Sluice sluice = Sluice.withConfig(SluiceConfig.withServer(Server.withPort(port)
						.host("127.0.0.1")
						.concurrency(1)
						.shutdownTimeout(Duration.ofMillis(300))
						.disconnectGracePeriod(Duration.ofMillis(100))
						.build())
				.application(application)
				.lifecycleObserver(observer)
				.build());

		sluice.start();

		try (Socket socket = connectWithRetry("127.0.0.1", port, 2_000)) {
			send(socket, "GET /stuck HTTP/1.1\r\nHost: localhost\r\n\r\n");
			Assertions.assertTrue(started.await(5, TimeUnit.SECONDS));

			long startedAt = System.nanoTime();
			sluice.stop();
			long elapsedMillis = Duration.ofNanos(System.nanoTime() - startedAt).toMillis();

			Assertions.assertTrue(elapsedMillis < 5_000, "stop took " + elapsedMillis + "ms");
			Assertions.assertTrue(TestSupport.isClosedByPeer(socket));
			Assertions.assertTrue(interrupted.await(5, TimeUnit.SECONDS), "stuck application should be interrupted");
			Assertions.assertTrue(logEventTypes.contains(LogEventType.SHUTDOWN_TIMEOUT_EXCEEDED));
		}
	}

	@Test
	public void request_limit_triggers_shutdown() throws Exception {
		int port = findFreePort();
		List<LogEventType> logEventTypes = new CopyOnWriteArrayList<>();

		Sluice sluice = Sluice.withConfig(SluiceConfig.withServer(Server.withPort(port)
						.host("127.0.0.1")
						.concurrency(1)
						.maximumRequests(2L)
						.build())
				.application(OK)
				.lifecycleObserver(new LifecycleObserver() {
					@Override
					public void didReceiveLogEvent(LogEvent logEvent) {
						logEventTypes.add(logEvent.getLogEventType());
					}
				})
				.build());

		sluice.start();

		try (Socket socket = connectWithRetry("127.0.0.1", port, 2_000)) {
			send(socket, "GET /1 HTTP/1.1\r\nHost: localhost\r\n\r\n");
			Assertions.assertEquals(200, readResponse(socket.getInputStream()).statusCode());
			send(socket, "GET /2 HTTP/1.1\r\nHost: localhost\r\n\r\n");
			Assertions.assertEquals(200, readResponse(socket.getInputStream()).statusCode());
		}

		Thread waiter = new Thread(() -> {
			try {
				sluice.awaitShutdown();
			} catch (InterruptedException e) {
				Thread.currentThread().interrupt();
			}
		});
		waiter.start();
		waiter.join(10_000);

		Assertions.assertFalse(waiter.isAlive(), "awaitShutdown should return once the limit stops the server");
		Assertions.assertEquals(LifecycleState.STOPPED, sluice.getLifecycleState());
		Assertions.assertTrue(logEventTypes.contains(LogEventType.REQUEST_LIMIT_REACHED));
	}

	@Test
	public void failing_observer_does_not_break_lifecycle() {
		int port = findFreePortUnchecked();
		AtomicReference<LogEvent> observerFailure = new AtomicReference<>();

		LifecycleObserver observer = new LifecycleObserver() {
			@Override
			public void willStartSluice(Sluice sluice) {
				throw new IllegalStateException("observer bug");
			}

			@Override
			public void didReceiveLogEvent(LogEvent logEvent) {
				if (logEvent.getLogEventType() == LogEventType.LIFECYCLE_OBSERVER_FAILED)
					observerFailure.set(logEvent);
			}
		};

		try (Sluice sluice = Sluice.withConfig(SluiceConfig.withServer(TestSupport.quietServer(port))
				.application(OK)
				.lifecycleObserver(observer)
				.build())) {
			sluice.start();
			Assertions.assertTrue(sluice.isStarted());
		}

		Assertions.assertNotNull(observerFailure.get());
		Assertions.assertTrue(observerFailure.get().getThrowable().isPresent());
	}

	@Test
	public void unmanaged_server_refuses_to_start() {
		Server server = TestSupport.quietServer(findFreePortUnchecked());

		Assertions.assertThrows(IllegalStateException.class, server::start);
		Assertions.assertFalse(server.isStarted());
	}

	@Test
	public void config_requires_application() {
		Assertions.assertThrows(IllegalStateException.class, () -> SluiceConfig.withServer(TestSupport.quietServer(8080)).build());
	}

	@Test
	public void builder_rejects_invalid_settings() {
		Assertions.assertThrows(IllegalArgumentException.class, () -> Server.withPort(-1).build());
		Assertions.assertThrows(IllegalArgumentException.class, () -> Server.withPort(8080).concurrency(0).build());
		Assertions.assertThrows(IllegalArgumentException.class, () -> Server.withPort(8080).requestTimeout(Duration.ZERO).build());
		Assertions.assertThrows(IllegalArgumentException.class, () -> Server.withPort(8080)
				.writeHighWatermarkInBytes(100)
				.writeLowWatermarkInBytes(100)
				.build());
	}

	private static int findFreePortUnchecked() {
		try {
			return findFreePort();
		} catch (IOException e) {
			throw new UncheckedIOException(e);
		}
	}

	private static final class RecordingLifecycleObserver implements LifecycleObserver {
		final List<String> callbacks = new CopyOnWriteArrayList<>();

		@Override
		public void willStartSluice(Sluice sluice) {
			callbacks.add("willStartSluice");
		}

		@Override
		public void didStartSluice(Sluice sluice) {
			callbacks.add("didStartSluice");
		}

		@Override
		public void didFailToStartSluice(Sluice sluice, Throwable throwable) {
			callbacks.add("didFailToStartSluice");
		}

		@Override
		public void willStopSluice(Sluice sluice) {
			callbacks.add("willStopSluice");
		}

		@Override
		public void didStopSluice(Sluice sluice) {
			callbacks.add("didStopSluice");
		}

		@Override
		public void willStartServer(Server server) {
			callbacks.add("willStartServer");
		}

		@Override
		public void didStartServer(Server server) {
			callbacks.add("didStartServer");
		}

		@Override
		public void willStopServer(Server server) {
			callbacks.add("willStopServer");
		}

		@Override
		public void didStopServer(Server server) {
			callbacks.add("didStopServer");
		}

		@Override
		public void didReceiveLogEvent(LogEvent logEvent) {
			// quiet
		}
	}
}
