package com.questrail.hostlink.protocol.internal.bus;

import com.questrail.hostlink.api.ErrorRecord;
import com.questrail.hostlink.protocol.internal.slot.CallbackSlot;
import com.questrail.hostlink.protocol.internal.slot.SlotPolicy;
import com.questrail.hostlink.protocol.model.OperationKind;

import java.util.List;

/**
 * The four callback slots of one bus, keyed by {@link OperationKind}.
 *
 * <p>Acknowledgement-only replies use {@code CallbackSlot<Void>} and are fired
 * with {@code null}.</p>
 */
public final class ReplySlots
{
    private final CallbackSlot<Boolean> activation =
            new CallbackSlot<>(OperationKind.ACTIVATION_CHECK.label(), SlotPolicy.STATUS);
    private final CallbackSlot<List<ErrorRecord>> fetchList =
            new CallbackSlot<>(OperationKind.FETCH_LIST.label(), SlotPolicy.ONE_SHOT);
    private final CallbackSlot<Void> removeOne =
            new CallbackSlot<>(OperationKind.REMOVE_ONE.label(), SlotPolicy.ONE_SHOT);
    private final CallbackSlot<Void> clearAll =
            new CallbackSlot<>(OperationKind.CLEAR_ALL.label(), SlotPolicy.ONE_SHOT);

    public CallbackSlot<Boolean> activation() {
        return activation;
    }

    public CallbackSlot<List<ErrorRecord>> fetchList() {
        return fetchList;
    }

    public CallbackSlot<Void> removeOne() {
        return removeOne;
    }

    public CallbackSlot<Void> clearAll() {
        return clearAll;
    }

    public CallbackSlot<?> slot(OperationKind kind) {
        return switch (kind) {
            case ACTIVATION_CHECK -> activation;
            case FETCH_LIST -> fetchList;
            case REMOVE_ONE -> removeOne;
            case CLEAR_ALL -> clearAll;
        };
    }

    /**
     * Drop every pending callback, status slot included.
     */
    public void clearAllSlots() {
        activation.clear();
        fetchList.clear();
        removeOne.clear();
        clearAll.clear();
    }
}
