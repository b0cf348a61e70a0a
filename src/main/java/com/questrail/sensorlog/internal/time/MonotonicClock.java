package com.questrail.sensorlog.internal.time;

/**
 * MonotonicClock
 * =============================================================================
 * Time source for run timing.
 *
 * <p>Elapsed-time measurement MUST use a monotonic source. Wall-clock time
 * (e.g. {@code Instant.now()}) is permitted only for observability timestamps.</p>
 */
public interface MonotonicClock
{
    /**
     * Returns a monotonically increasing tick value in nanoseconds.
     * Values are only meaningful for elapsed time computations.
     */
    long nowNanos();
}
