package com.questrail.hostlink.protocol.internal.time;

/**
 * {@link MonotonicClock} backed by {@link System#nanoTime()}.
 *
 * <p>Unaffected by wall-clock adjustments. Tests substitute a manual clock.</p>
 */
public enum SystemMonotonicClock implements MonotonicClock
{
    INSTANCE;

    @Override
    public long nowNanos() {
        return System.nanoTime();
    }
}
