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

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.concurrent.atomic.AtomicReference;

/**
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
public class ServerStateTests {
	@Test
	public void date_header_uses_imf_fixdate() {
		MutableClock clock = new MutableClock(Instant.parse("1994-11-06T08:49:37Z"));
		ServerState serverState = new ServerState(clock);

		Assertions.assertEquals("Sun, 06 Nov 1994 08:49:37 GMT", serverState.getDateHeaderValue());
	}

	@Test
	public void date_header_is_cached_within_a_second() {
		MutableClock clock = new MutableClock(Instant.parse("2024-02-29T23:59:58.100Z"));
		ServerState serverState = new ServerState(clock);

		String first = serverState.getDateHeaderValue();
		clock.set(Instant.parse("2024-02-29T23:59:58.900Z"));
		String second = serverState.getDateHeaderValue();

		Assertions.assertSame(first, second, "Callers within one second should share the formatted value");

		clock.set(Instant.parse("2024-02-29T23:59:59.000Z"));
		String third = serverState.getDateHeaderValue();

		Assertions.assertNotSame(first, third);
		Assertions.assertEquals("Thu, 29 Feb 2024 23:59:59 GMT", third);
	}

	@Test
	public void date_header_never_moves_backwards() {
		MutableClock clock = new MutableClock(Instant.parse("2024-01-01T00:00:10Z"));
		ServerState serverState = new ServerState(clock);

		String later = serverState.getDateHeaderValue();
		clock.set(Instant.parse("2024-01-01T00:00:09Z"));

		Assertions.assertSame(later, serverState.getDateHeaderValue());
	}

	@Test
	public void connection_and_request_counters() {
		ServerState serverState = new ServerState();

		serverState.didOpenConnection();
		serverState.didOpenConnection();
		Assertions.assertEquals(2, serverState.getActiveConnections());

		serverState.didCloseConnection();
		Assertions.assertEquals(1, serverState.getActiveConnections());

		Assertions.assertEquals(1L, serverState.didServeRequest());
		Assertions.assertEquals(2L, serverState.didServeRequest());
		Assertions.assertEquals(2L, serverState.getRequestsServed());
	}

	@Test
	public void closing_more_connections_than_opened_fails() {
		ServerState serverState = new ServerState();

		Assertions.assertThrows(IllegalStateException.class, serverState::didCloseConnection);
	}

	@Test
	public void drain_returns_immediately_when_idle() throws Exception {
		ServerState serverState = new ServerState();

		Assertions.assertTrue(serverState.awaitConnectionsDrained(Duration.ZERO));
	}

	@Test
	public void drain_times_out_while_connections_remain() throws Exception {
		ServerState serverState = new ServerState();
		serverState.didOpenConnection();

		Assertions.assertFalse(serverState.awaitConnectionsDrained(Duration.ofMillis(50)));
	}

	@Test
	public void drain_wakes_on_last_close() throws Exception {
		ServerState serverState = new ServerState();
		serverState.didOpenConnection();
		serverState.didOpenConnection();

		Thread closer = new Thread(() -> {
			try {
				Thread.sleep(100);
			} catch (InterruptedException e) {
				Thread.currentThread().interrupt();
			}
			serverState.didCloseConnection();
			serverState.didCloseConnection();
		});
		closer.start();

		long startedAt = System.nanoTime();
		Assertions.assertTrue(serverState.awaitConnectionsDrained(Duration.ofSeconds(5)));
		Assertions.assertTrue(Duration.ofNanos(System.nanoTime() - startedAt).compareTo(Duration.ofSeconds(4)) < 0);

		closer.join();
	}

	private static final class MutableClock extends Clock {
		private final AtomicReference<Instant> instant;

		private MutableClock(Instant instant) {
			this.instant = new AtomicReference<>(instant);
		}

		void set(Instant instant) {
			this.instant.set(instant);
		}

		@Override
		public ZoneId getZone() {
			return ZoneOffset.UTC;
		}

		@Override
		public Clock withZone(ZoneId zone) {
			return this;
		}

		@Override
		public Instant instant() {
			return this.instant.get();
		}
	}
}
