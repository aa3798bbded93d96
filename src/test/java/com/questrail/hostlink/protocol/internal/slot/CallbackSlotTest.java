package com.questrail.hostlink.protocol.internal.slot;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CallbackSlotTest {

    @Test
    void oneShotSlotFiresOnceThenEmpties() {
        CallbackSlot<String> slot = new CallbackSlot<>("fetch-list", SlotPolicy.ONE_SHOT);
        List<String> received = new ArrayList<>();

        slot.arm(received::add);
        assertTrue(slot.fire("first"));
        assertFalse(slot.fire("second"));

        assertEquals(List.of("first"), received);
        assertInstanceOf(SlotState.Empty.class, slot.state());
    }

    @Test
    void statusSlotFiresForEveryValue() {
        CallbackSlot<Boolean> slot = new CallbackSlot<>("activation-check", SlotPolicy.STATUS);
        List<Boolean> received = new ArrayList<>();

        slot.arm(received::add);
        slot.fire(true);
        slot.fire(false);
        slot.fire(true);

        assertEquals(List.of(true, false, true), received);
        assertTrue(slot.isPending());
    }

    @Test
    void lastArmWins() {
        CallbackSlot<String> slot = new CallbackSlot<>("remove-one", SlotPolicy.ONE_SHOT);
        List<String> first = new ArrayList<>();
        List<String> second = new ArrayList<>();

        slot.arm(first::add);
        slot.arm(second::add);
        slot.fire("ack");

        assertTrue(first.isEmpty());
        assertEquals(List.of("ack"), second);
    }

    @Test
    void expireReleasesOnlyItsOwnGeneration() {
        CallbackSlot<String> slot = new CallbackSlot<>("clear-all", SlotPolicy.ONE_SHOT);
        List<String> received = new ArrayList<>();

        long older = slot.arm(received::add);
        long newer = slot.arm(received::add);

        assertNotEquals(older, newer);
        assertFalse(slot.expire(older));
        assertTrue(slot.isPending());

        assertTrue(slot.expire(newer));
        assertFalse(slot.isPending());
        assertFalse(slot.fire("late"));
        assertTrue(received.isEmpty());
    }

    @Test
    void callbackMayRearmTheSlot() {
        CallbackSlot<Integer> slot = new CallbackSlot<>("fetch-list", SlotPolicy.ONE_SHOT);
        List<Integer> received = new ArrayList<>();

        slot.arm(value -> {
            received.add(value);
            slot.arm(received::add);
        });

        slot.fire(1);
        slot.fire(2);
        slot.fire(3);

        assertEquals(List.of(1, 2), received);
    }

    @Test
    void throwingCallbackStillConsumesOneShotSlot() {
        CallbackSlot<String> slot = new CallbackSlot<>("fetch-list", SlotPolicy.ONE_SHOT);
        slot.arm(value -> {
            throw new IllegalStateException("callback failure");
        });

        assertThrows(IllegalStateException.class, () -> slot.fire("x"));
        assertFalse(slot.isPending());
    }

    @Test
    void clearDropsWithoutInvoking() {
        CallbackSlot<String> slot = new CallbackSlot<>("activation-check", SlotPolicy.STATUS);
        List<String> received = new ArrayList<>();

        slot.arm(received::add);
        slot.clear();

        assertFalse(slot.fire("x"));
        assertTrue(received.isEmpty());
    }
}
