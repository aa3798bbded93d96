package com.questrail.hostlink.protocol.internal.slot;

import java.util.Objects;
import java.util.function.Consumer;

/**
 * Explicit state of a {@link CallbackSlot}.
 *
 * <pre>
 *   Empty --arm--> Pending(g) --arm--> Pending(g+1)      (last write wins)
 *                  Pending(g) --fire (ONE_SHOT)--> Empty
 *                  Pending(g) --fire (STATUS)----> Pending(g)
 *                  Pending(g) --expire(g)-------> Empty
 *                  Pending(g) --clear-----------> Empty
 * </pre>
 */
public sealed interface SlotState<T>
{
    record Empty<T>() implements SlotState<T> {
    }

    /**
     * @param callback   the consumer waiting for the reply value
     * @param generation monotonically increasing arm counter of the owning slot
     */
    record Pending<T>(Consumer<T> callback, long generation) implements SlotState<T> {
        public Pending {
            Objects.requireNonNull(callback, "callback");
        }
    }
}
