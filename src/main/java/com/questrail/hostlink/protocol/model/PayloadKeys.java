package com.questrail.hostlink.protocol.model;

/**
 * Payload slot names. Each discriminant that carries a payload always uses the same key.
 */
public final class PayloadKeys
{
    /** Text token in an {@link Discriminant#ACTIVATION_REPLY}. */
    public static final String ACTIVATION_TOKEN = "activation-token";

    /** Record sequence in a {@link Discriminant#FETCH_LIST_REPLY}. */
    public static final String RECORDS = "records";

    /** Single record in a {@link Discriminant#REMOVE_ONE} request. */
    public static final String RECORD = "record";

    private PayloadKeys() {
    }
}
