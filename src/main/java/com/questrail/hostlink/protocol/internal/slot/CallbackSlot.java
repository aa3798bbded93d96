package com.questrail.hostlink.protocol.internal.slot;

import java.util.Objects;
import java.util.function.Consumer;

/**
 * CallbackSlot
 * =============================================================================
 * Holds at most one pending callback for one operation kind.
 *
 * <h2>Concurrency</h2>
 * Requests arm the slot from any thread while replies fire it from the
 * transport's dispatch thread. State transitions happen under the slot's
 * monitor; the callback itself always runs outside it, so a callback may
 * re-arm the slot (issue the next request) without deadlocking.
 *
 * <h2>Generations</h2>
 * Every {@link #arm} bumps a generation counter and returns it. A timer armed
 * for one request expires the slot only if that same request is still
 * pending; a newer request is never released by an older timer.
 */
public final class CallbackSlot<T>
{
    private final String name;
    private final SlotPolicy policy;

    private SlotState<T> state = new SlotState.Empty<>();
    private long generations;

    public CallbackSlot(String name, SlotPolicy policy) {
        this.name = Objects.requireNonNull(name, "name");
        this.policy = Objects.requireNonNull(policy, "policy");
    }

    public String name() {
        return name;
    }

    public SlotPolicy policy() {
        return policy;
    }

    /**
     * Install {@code callback}, replacing any pending one.
     *
     * @return the generation of this request
     */
    public synchronized long arm(Consumer<T> callback) {
        Objects.requireNonNull(callback, "callback");
        long generation = ++generations;
        state = new SlotState.Pending<>(callback, generation);
        return generation;
    }

    /**
     * Deliver a reply value to the pending callback, if any.
     *
     * <p>For {@link SlotPolicy#ONE_SHOT} the slot is emptied before the callback
     * runs. Exceptions thrown by the callback propagate to the caller; the slot
     * state has already been updated.</p>
     *
     * @return {@code true} if a callback was invoked
     */
    public boolean fire(T value) {
        Consumer<T> callback;
        synchronized (this) {
            if (!(state instanceof SlotState.Pending<T> pending)) {
                return false;
            }
            callback = pending.callback();
            if (policy == SlotPolicy.ONE_SHOT) {
                state = new SlotState.Empty<>();
            }
        }
        callback.accept(value);
        return true;
    }

    /**
     * Release the callback of request {@code generation} without invoking it.
     *
     * @return {@code true} if that request was still pending and is now dropped
     */
    public synchronized boolean expire(long generation) {
        if (state instanceof SlotState.Pending<T> pending && pending.generation() == generation) {
            state = new SlotState.Empty<>();
            return true;
        }
        return false;
    }

    /**
     * Drop any pending callback without invoking it.
     */
    public synchronized void clear() {
        state = new SlotState.Empty<>();
    }

    public synchronized boolean isPending() {
        return state instanceof SlotState.Pending;
    }

    public synchronized SlotState<T> state() {
        return state;
    }

    @Override
    public String toString() {
        return "CallbackSlot[" + name + ", " + policy + "]";
    }
}
