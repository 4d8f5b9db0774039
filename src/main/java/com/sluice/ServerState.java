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

import com.sluice.internal.util.Signal;
import org.jspecify.annotations.NonNull;

import javax.annotation.concurrent.ThreadSafe;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * State shared by every connection of one server: active connection and served request counters, plus the cached
 * value of the {@code Date} response header.
 * <p>
 * One instance is created per server start and handed explicitly to each event loop.
 * <p>
 * The {@code Date} value is formatted at most once per wall-clock second: the first caller observing a new second
 * formats and stores it, and every caller within that second receives the identical {@link String} instance.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public final class ServerState {
	@NonNull
	private static final DateTimeFormatter DATE_HEADER_FORMATTER;

	static {
		DATE_HEADER_FORMATTER = DateTimeFormatter.ofPattern("EEE, dd MMM yyyy HH:mm:ss 'GMT'", Locale.US).withZone(ZoneOffset.UTC);
	}

	@NonNull
	private final Clock clock;
	@NonNull
	private final AtomicInteger activeConnectionCount;
	@NonNull
	private final AtomicLong requestsServedCount;
	@NonNull
	private final AtomicReference<CachedDate> cachedDate;
	@NonNull
	private final ReentrantLock dateLock;
	@NonNull
	private final AtomicReference<Signal> drainSignal;

	public ServerState() {
		this(Clock.systemUTC());
	}

	public ServerState(@NonNull Clock clock) {
		requireNonNull(clock);

		this.clock = clock;
		this.activeConnectionCount = new AtomicInteger(0);
		this.requestsServedCount = new AtomicLong(0);
		this.cachedDate = new AtomicReference<>(new CachedDate(Long.MIN_VALUE, ""));
		this.dateLock = new ReentrantLock();
		this.drainSignal = new AtomicReference<>();
	}

	/**
	 * The current value for the {@code Date} response header, e.g. {@code Tue, 15 Nov 1994 08:12:31 GMT}.
	 *
	 * @return the formatted date for the current wall-clock second
	 */
	@NonNull
	public String getDateHeaderValue() {
		long epochSecond = getClock().instant().getEpochSecond();
		CachedDate cachedDate = getCachedDate().get();

		if (epochSecond <= cachedDate.epochSecond())
			return cachedDate.value();

		getDateLock().lock();

		try {
			// Another thread may have formatted this second while we waited
			cachedDate = getCachedDate().get();

			if (epochSecond <= cachedDate.epochSecond())
				return cachedDate.value();

			CachedDate updatedCachedDate = new CachedDate(epochSecond, DATE_HEADER_FORMATTER.format(Instant.ofEpochSecond(epochSecond)));
			getCachedDate().set(updatedCachedDate);
			return updatedCachedDate.value();
		} finally {
			getDateLock().unlock();
		}
	}

	public void didOpenConnection() {
		getActiveConnectionCount().incrementAndGet();
	}

	public void didCloseConnection() {
		int activeConnections = getActiveConnectionCount().decrementAndGet();

		if (activeConnections < 0)
			throw new IllegalStateException("Active connection count went negative");

		if (activeConnections == 0) {
			Signal drainSignal = getDrainSignal().get();

			if (drainSignal != null)
				drainSignal.set();
		}
	}

	/**
	 * Records one fully-served request.
	 *
	 * @return the total number of requests served, including this one
	 */
	@NonNull
	public Long didServeRequest() {
		return getRequestsServedCount().incrementAndGet();
	}

	/**
	 * Blocks until no connections remain open or the timeout elapses.
	 * <p>
	 * The wake-up comes from the {@link #didCloseConnection()} call that brings the count to zero; nothing polls.
	 *
	 * @param timeout how long to wait
	 * @return {@code true} if every connection closed, {@code false} if the timeout elapsed first
	 * @throws InterruptedException if the calling thread is interrupted while waiting
	 */
	@NonNull
	public Boolean awaitConnectionsDrained(@NonNull Duration timeout) throws InterruptedException {
		requireNonNull(timeout);

		Signal drainSignal = new Signal();
		getDrainSignal().set(drainSignal);

		try {
			// Publish first, then check, so a close that lands in between still wakes us
			if (getActiveConnectionCount().get() == 0)
				return true;

			return drainSignal.await(timeout);
		} finally {
			getDrainSignal().compareAndSet(drainSignal, null);
		}
	}

	@NonNull
	public Integer getActiveConnections() {
		return getActiveConnectionCount().get();
	}

	@NonNull
	public Long getRequestsServed() {
		return getRequestsServedCount().get();
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{activeConnections=%d, requestsServed=%d}", getClass().getSimpleName(),
				getActiveConnections(), getRequestsServed());
	}

	private record CachedDate(long epochSecond, @NonNull String value) {}

	@NonNull
	private Clock getClock() {
		return this.clock;
	}

	@NonNull
	private AtomicInteger getActiveConnectionCount() {
		return this.activeConnectionCount;
	}

	@NonNull
	private AtomicLong getRequestsServedCount() {
		return this.requestsServedCount;
	}

	@NonNull
	private AtomicReference<CachedDate> getCachedDate() {
		return this.cachedDate;
	}

	@NonNull
	private ReentrantLock getDateLock() {
		return this.dateLock;
	}

	@NonNull
	private AtomicReference<Signal> getDrainSignal() {
		return this.drainSignal;
	}
}
