package com.sluice.internal.http;

import com.sluice.internal.util.EventPool;
import com.sluice.internal.util.Signal;

import java.util.concurrent.locks.ReentrantLock;

/**
 * Per-connection backpressure between the socket and the application.
 * <p>
 * Write side: the event loop reports bytes handed to the connection's write queue ({@link #didQueueBytes(long)})
 * and bytes the socket accepted ({@link #didDrainBytes(long)}). Rising above the high watermark pauses the
 * connection; falling to the low watermark resumes it. While paused, application threads block in
 * {@link #awaitResumed()} before pulling request body data or pushing more response data. Each pause episode ends
 * with exactly one resume, which wakes every thread blocked during that episode.
 * <p>
 * Read side: {@link #pauseReading()} and {@link #resumeReading()} record whether the event loop has stopped reading
 * the socket because the application is not consuming request body data fast enough.
 * <p>
 * All pause/resume calls are idempotent.
 */
class FlowControl {

    private final long highWatermark;
    private final long lowWatermark;
    private final EventPool eventPool;
    private final ReentrantLock lock;

    private long queuedBytes;
    private boolean writingPaused;
    private boolean readingPaused;
    private boolean closed;
    private Signal resumeSignal;
    private long pauseCount;
    private long resumeCount;

    FlowControl(long highWatermark, long lowWatermark, EventPool eventPool) {
        if (lowWatermark < 0 || lowWatermark >= highWatermark) {
            throw new IllegalArgumentException("Watermarks must satisfy 0 <= low < high, got low=" + lowWatermark + ", high=" + highWatermark);
        }
        this.highWatermark = highWatermark;
        this.lowWatermark = lowWatermark;
        this.eventPool = eventPool;
        this.lock = new ReentrantLock();
    }

    void didQueueBytes(long bytes) {
        lock.lock();
        try {
            queuedBytes += bytes;
            if (!writingPaused && !closed && queuedBytes > highWatermark) {
                writingPaused = true;
                resumeSignal = eventPool.acquire();
                pauseCount++;
            }
        } finally {
            lock.unlock();
        }
    }

    void didDrainBytes(long bytes) {
        Signal signal = null;
        lock.lock();
        try {
            queuedBytes = Math.max(0, queuedBytes - bytes);
            if (writingPaused && queuedBytes <= lowWatermark) {
                signal = endPauseEpisode();
            }
        } finally {
            lock.unlock();
        }
        wake(signal);
    }

    /**
     * Blocks the calling application thread while writing is paused.
     *
     * @return {@code true} once writing may proceed, {@code false} if the connection closed
     * @throws InterruptedException if the calling thread is interrupted while waiting
     */
    boolean awaitResumed() throws InterruptedException {
        while (true) {
            Signal signal;
            lock.lock();
            try {
                if (closed) {
                    return false;
                }
                if (!writingPaused) {
                    return true;
                }
                signal = resumeSignal;
                signal.reserve();
            } finally {
                lock.unlock();
            }
            try {
                signal.await();
            } finally {
                if (signal.leave()) {
                    eventPool.release(signal);
                }
            }
        }
    }

    /**
     * @return {@code true} if this call paused reading, {@code false} if it was already paused
     */
    boolean pauseReading() {
        lock.lock();
        try {
            if (readingPaused) {
                return false;
            }
            readingPaused = true;
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return {@code true} if this call resumed reading, {@code false} if it was not paused
     */
    boolean resumeReading() {
        lock.lock();
        try {
            if (!readingPaused) {
                return false;
            }
            readingPaused = false;
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Wakes every blocked thread; later calls to {@link #awaitResumed()} return {@code false} immediately.
     */
    void close() {
        Signal signal = null;
        lock.lock();
        try {
            if (closed) {
                return;
            }
            closed = true;
            if (writingPaused) {
                signal = endPauseEpisode();
            }
        } finally {
            lock.unlock();
        }
        wake(signal);
    }

    boolean isWritingPaused() {
        lock.lock();
        try {
            return writingPaused;
        } finally {
            lock.unlock();
        }
    }

    boolean isReadingPaused() {
        lock.lock();
        try {
            return readingPaused;
        } finally {
            lock.unlock();
        }
    }

    long queuedBytes() {
        lock.lock();
        try {
            return queuedBytes;
        } finally {
            lock.unlock();
        }
    }

    long pauseCount() {
        lock.lock();
        try {
            return pauseCount;
        } finally {
            lock.unlock();
        }
    }

    long resumeCount() {
        lock.lock();
        try {
            return resumeCount;
        } finally {
            lock.unlock();
        }
    }

    long highWatermark() {
        return highWatermark;
    }

    long lowWatermark() {
        return lowWatermark;
    }

    // Caller holds the lock
    private Signal endPauseEpisode() {
        Signal signal = resumeSignal;
        resumeSignal = null;
        writingPaused = false;
        resumeCount++;
        return signal;
    }

    private void wake(Signal signal) {
        if (signal != null && signal.set() == 0) {
            eventPool.release(signal);
        }
    }
}
