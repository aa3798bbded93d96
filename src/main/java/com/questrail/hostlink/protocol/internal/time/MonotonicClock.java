package com.questrail.hostlink.protocol.internal.time;

/**
 * Monotonic time source for reply deadlines.
 *
 * <p>Values are only meaningful as differences. Wall-clock time is used for
 * observability timestamps, never for deadlines.</p>
 */
@FunctionalInterface
public interface MonotonicClock
{
    /**
     * @return a monotonically non-decreasing tick in nanoseconds
     */
    long nowNanos();
}
