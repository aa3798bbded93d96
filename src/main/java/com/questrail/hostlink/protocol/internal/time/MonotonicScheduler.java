package com.questrail.hostlink.protocol.internal.time;

import java.time.Duration;
import java.util.Objects;

/**
 * MonotonicScheduler
 * =============================================================================
 * Schedules reply deadlines.
 *
 * <p>Deadlines are absolute monotonic nanoseconds from the same
 * {@link MonotonicClock} the caller reads. Implementations may run tasks late
 * but never early.</p>
 */
public interface MonotonicScheduler
{
    /**
     * Run {@code task} at or after {@code deadlineNanos}.
     */
    Cancellable scheduleAtNanos(long deadlineNanos, Runnable task);

    /**
     * Run {@code task} once {@code delay} has elapsed on {@code clock}.
     *
     * @throws IllegalArgumentException if {@code delay} is negative
     */
    default Cancellable scheduleAfter(Duration delay, MonotonicClock clock, Runnable task)
    {
        Objects.requireNonNull(delay, "delay");
        Objects.requireNonNull(clock, "clock");
        Objects.requireNonNull(task, "task");

        if (delay.isNegative()) {
            throw new IllegalArgumentException("delay must be >= 0");
        }
        return scheduleAtNanos(clock.nowNanos() + delay.toNanos(), task);
    }
}
