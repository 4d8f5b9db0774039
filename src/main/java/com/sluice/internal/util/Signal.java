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
import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * A single-shot wake-up primitive: one party calls {@link #set()}, any number of parties block in {@link #await()}
 * until that happens.
 * <p>
 * Instances are normally vended by an {@link EventPool} and handed back to it once the wait is over.
 * A waiter that learns about a signal while holding its owner's lock must {@link #reserve()} it before releasing that
 * lock, and {@link #leave()} it after waking.  The reservation keeps the pool from recycling the signal
 * underneath a waiter that has not started blocking yet.
 * <p>
 * Release protocol, shared by every owner in this codebase:
 * <ul>
 *   <li>the setter unpublishes the signal, calls {@link #set()} and hands it back to the pool iff the returned waiter count is zero</li>
 *   <li>a reserved waiter calls {@link #leave()} after waking and hands it back to the pool iff that returns {@code true}</li>
 * </ul>
 * This guarantees exactly one party releases a given signal.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public final class Signal {
	@Nonnull
	private final ReentrantLock lock;
	@Nonnull
	private final Condition condition;
	@Nonnull
	private final AtomicBoolean pooled;
	private boolean set;
	private int waiterCount;

	public Signal() {
		this.lock = new ReentrantLock();
		this.condition = this.lock.newCondition();
		this.pooled = new AtomicBoolean(false);
	}

	/**
	 * Marks this signal as set and wakes every blocked waiter.  Setting an already-set signal is a no-op.
	 *
	 * @return the number of reserved waiters at the moment the signal was set
	 */
	@Nonnull
	public Integer set() {
		getLock().lock();

		try {
			if (!this.set) {
				this.set = true;
				getCondition().signalAll();
			}

			return this.waiterCount;
		} finally {
			getLock().unlock();
		}
	}

	@Nonnull
	public Boolean isSet() {
		getLock().lock();

		try {
			return this.set;
		} finally {
			getLock().unlock();
		}
	}

	/**
	 * Registers the calling party as a waiter.  Must be paired with exactly one {@link #leave()}.
	 */
	public void reserve() {
		getLock().lock();

		try {
			++this.waiterCount;
		} finally {
			getLock().unlock();
		}
	}

	/**
	 * Deregisters a waiter previously registered via {@link #reserve()}.
	 *
	 * @return {@code true} if the caller was the last waiter out of a set signal and is therefore responsible for releasing it
	 */
	@Nonnull
	public Boolean leave() {
		getLock().lock();

		try {
			if (this.waiterCount == 0)
				throw new IllegalStateException(format("%s was left more times than it was reserved", getClass().getSimpleName()));

			--this.waiterCount;
			return this.waiterCount == 0 && this.set;
		} finally {
			getLock().unlock();
		}
	}

	/**
	 * Blocks until this signal is set.
	 *
	 * @throws InterruptedException if the calling thread is interrupted while waiting
	 */
	public void await() throws InterruptedException {
		getLock().lock();

		try {
			while (!this.set)
				getCondition().await();
		} finally {
			getLock().unlock();
		}
	}

	/**
	 * Blocks until this signal is set or the timeout elapses.
	 *
	 * @param timeout how long to wait
	 * @return {@code true} if the signal was set, {@code false} if the timeout elapsed first
	 * @throws InterruptedException if the calling thread is interrupted while waiting
	 */
	@Nonnull
	public Boolean await(@Nonnull Duration timeout) throws InterruptedException {
		requireNonNull(timeout);

		long remainingNanos = timeout.toNanos();

		getLock().lock();

		try {
			while (!this.set) {
				if (remainingNanos <= 0L)
					return false;

				remainingNanos = getCondition().awaitNanos(remainingNanos);
			}

			return true;
		} finally {
			getLock().unlock();
		}
	}

	@Nonnull
	public Integer getWaiterCount() {
		getLock().lock();

		try {
			return this.waiterCount;
		} finally {
			getLock().unlock();
		}
	}

	@Override
	@Nonnull
	public String toString() {
		getLock().lock();

		try {
			return format("%s{set=%s, waiterCount=%d, pooled=%s}", getClass().getSimpleName(), this.set, this.waiterCount, this.pooled.get());
		} finally {
			getLock().unlock();
		}
	}

	// Pool bookkeeping, only touched by EventPool

	void reset() {
		getLock().lock();

		try {
			this.set = false;
		} finally {
			getLock().unlock();
		}
	}

	@Nonnull
	Boolean markPooled() {
		return this.pooled.compareAndSet(false, true);
	}

	void markInUse() {
		this.pooled.set(false);
	}

	@Nonnull
	private ReentrantLock getLock() {
		return this.lock;
	}

	@Nonnull
	private Condition getCondition() {
		return this.condition;
	}
}
