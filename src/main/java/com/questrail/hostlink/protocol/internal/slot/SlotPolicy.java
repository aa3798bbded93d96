package com.questrail.hostlink.protocol.internal.slot;

/**
 * How a {@link CallbackSlot} treats its callback once a reply arrives.
 */
public enum SlotPolicy
{
    /**
     * The callback stays installed and runs for every matching reply.
     * Used for status replies the host may push unsolicited.
     */
    STATUS,

    /**
     * The callback is taken out of the slot before it runs, so it runs at most
     * once per request. Later replies of the same kind find the slot empty.
     */
    ONE_SHOT
}
