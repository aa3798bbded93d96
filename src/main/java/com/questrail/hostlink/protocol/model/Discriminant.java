package com.questrail.hostlink.protocol.model;

import java.util.Optional;

/**
 * Closed set of envelope discriminants shared by both ends of the link.
 *
 * <p>The wire strings are part of the protocol contract. Adding, renaming or
 * removing one is a breaking change; there is no negotiation.</p>
 */
public enum Discriminant
{
    VERIFY_ACTIVATION("activation-request"),
    ACTIVATION_REPLY("activation-reply"),

    FETCH_LIST("fetch-list-request"),
    FETCH_LIST_REPLY("fetch-list-reply"),

    REMOVE_ONE("remove-one-request"),
    REMOVE_ONE_REPLY("remove-one-reply"),

    CLEAR_ALL("clear-all-request"),
    CLEAR_ALL_REPLY("clear-all-reply");

    private final String wire;

    Discriminant(String wire) {
        this.wire = wire;
    }

    /**
     * @return the string carried in the envelope's discriminant field
     */
    public String wire() {
        return wire;
    }

    /**
     * Resolve a wire string by exact match.
     *
     * @return the discriminant, or empty for null, blank or unknown strings
     */
    public static Optional<Discriminant> fromWire(String wire) {
        if (wire == null || wire.isBlank()) {
            return Optional.empty();
        }
        for (Discriminant d : values()) {
            if (d.wire.equals(wire)) {
                return Optional.of(d);
            }
        }
        return Optional.empty();
    }
}
