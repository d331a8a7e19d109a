package com.fintech.bars.stream;

import java.time.Duration;

/**
 * Doubling reconnect delay bounded by a floor and a ceiling.
 * {@link #pause()} sleeps for the current delay and then doubles it;
 * {@link #reset()} returns to the floor after a successful connect.
 */
public class ReconnectBackoff {

    /** Sleep strategy; replaced in tests to avoid real waiting. */
    @FunctionalInterface
    public interface Sleeper {
        void sleep(long millis) throws InterruptedException;
    }

    private final long floorMs;
    private final long ceilingMs;
    private final Sleeper sleeper;

    private long currentMs;

    public ReconnectBackoff(Duration floor, Duration ceiling) {
        this(floor, ceiling, Thread::sleep);
    }

    public ReconnectBackoff(Duration floor, Duration ceiling, Sleeper sleeper) {
        if (floor.isNegative() || floor.isZero()) {
            throw new IllegalArgumentException("Backoff floor must be positive");
        }
        if (ceiling.compareTo(floor) < 0) {
            throw new IllegalArgumentException("Backoff ceiling must be >= floor");
        }
        this.floorMs = floor.toMillis();
        this.ceilingMs = ceiling.toMillis();
        this.sleeper = sleeper;
        this.currentMs = floorMs;
    }

    /**
     * Sleeps for the current delay, then doubles it up to the ceiling.
     *
     * @return the delay that was slept
     * @throws InterruptedException if the sleep was interrupted (stop requested)
     */
    public long pause() throws InterruptedException {
        long delay = currentDelayMs();
        sleeper.sleep(delay);
        advance();
        return delay;
    }

    public synchronized long currentDelayMs() {
        return currentMs;
    }

    public synchronized void reset() {
        currentMs = floorMs;
    }

    private synchronized void advance() {
        currentMs = Math.min(currentMs * 2, ceilingMs);
    }
}
