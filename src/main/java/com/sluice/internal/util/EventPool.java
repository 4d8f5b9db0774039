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

package com.sluice.internal.util;

import javax.annotation.Nonnull;
import javax.annotation.concurrent.ThreadSafe;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * A capped free-list of {@link Signal} instances, shared by every connection of a server.
 * <p>
 * {@link #acquire()} hands out an unset signal, reusing an idle one when available and allocating otherwise.
 * {@link #release(Signal)} resets a signal and keeps it for reuse, unless the pool is already at capacity or the
 * signal still has reserved waiters, in which case it is dropped and left to the garbage collector.
 * <p>
 * The idle set is lock-free, so acquire/release may be called from event loop threads and application threads alike.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public final class EventPool {
	@Nonnull
	public static final Integer DEFAULT_CAPACITY;

	static {
		DEFAULT_CAPACITY = 1_000;
	}

	@Nonnull
	private final Integer capacity;
	@Nonnull
	private final ConcurrentLinkedDeque<Signal> idleSignals;
	@Nonnull
	private final AtomicInteger idleCount;
	@Nonnull
	private final AtomicLong allocationCount;
	@Nonnull
	private final AtomicLong reuseCount;
	@Nonnull
	private final AtomicLong discardCount;

	public EventPool() {
		this(DEFAULT_CAPACITY);
	}

	public EventPool(@Nonnull Integer capacity) {
		requireNonNull(capacity);

		if (capacity < 0)
			throw new IllegalArgumentException("Event pool capacity must be >= 0");

		this.capacity = capacity;
		this.idleSignals = new ConcurrentLinkedDeque<>();
		this.idleCount = new AtomicInteger(0);
		this.allocationCount = new AtomicLong(0);
		this.reuseCount = new AtomicLong(0);
		this.discardCount = new AtomicLong(0);
	}

	/**
	 * Vends an unset signal that no other party holds.
	 *
	 * @return a signal ready for use
	 */
	@Nonnull
	public Signal acquire() {
		Signal signal = getIdleSignals().pollFirst();

		if (signal != null) {
			getIdleCount().decrementAndGet();
			signal.markInUse();
			getReuseCount().incrementAndGet();
			return signal;
		}

		getAllocationCount().incrementAndGet();
		return new Signal();
	}

	/**
	 * Hands a signal back for reuse.
	 *
	 * @param signal the signal to release
	 * @return {@code true} if the signal was retained for reuse, {@code false} if it was discarded
	 */
	@Nonnull
	public Boolean release(@Nonnull Signal signal) {
		requireNonNull(signal);

		// Someone is still parked on it (or about to be)
		if (signal.getWaiterCount() > 0) {
			getDiscardCount().incrementAndGet();
			return false;
		}

		// Double release
		if (!signal.markPooled())
			return false;

		signal.reset();

		if (getIdleCount().incrementAndGet() > getCapacity()) {
			getIdleCount().decrementAndGet();
			getDiscardCount().incrementAndGet();
			return false;
		}

		getIdleSignals().offerFirst(signal);
		return true;
	}

	@Nonnull
	public Integer getCapacity() {
		return this.capacity;
	}

	@Nonnull
	public Integer getIdleSignalCount() {
		return getIdleCount().get();
	}

	@Nonnull
	public Long getAllocationTotal() {
		return getAllocationCount().get();
	}

	@Nonnull
	public Long getReuseTotal() {
		return getReuseCount().get();
	}

	@Nonnull
	public Long getDiscardTotal() {
		return getDiscardCount().get();
	}

	@Override
	@Nonnull
	public String toString() {
		return format("%s{capacity=%d, idle=%d, allocations=%d, reuses=%d, discards=%d}", getClass().getSimpleName(),
				getCapacity(), getIdleSignalCount(), getAllocationTotal(), getReuseTotal(), getDiscardTotal());
	}

	@Nonnull
	private ConcurrentLinkedDeque<Signal> getIdleSignals() {
		return this.idleSignals;
	}

	@Nonnull
	private AtomicInteger getIdleCount() {
		return this.idleCount;
	}

	@Nonnull
	private AtomicLong getAllocationCount() {
		return this.allocationCount;
	}

	@Nonnull
	private AtomicLong getReuseCount() {
		return this.reuseCount;
	}

	@Nonnull
	private AtomicLong getDiscardCount() {
		return this.discardCount;
	}
}
