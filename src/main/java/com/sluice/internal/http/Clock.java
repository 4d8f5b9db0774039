package com.sluice.internal.http;

/**
 * Monotonic time source for {@link Scheduler}, swappable in tests.
 */
interface Clock {

    long nanoTime();

}
