package com.questrail.hostlink.protocol.internal.time;

/**
 * Handle for a scheduled reply deadline.
 */
@FunctionalInterface
public interface Cancellable
{
    /**
     * @return {@code true} if the task will no longer run because of this call;
     *         {@code false} if it already ran or was already cancelled
     */
    boolean cancel();
}
