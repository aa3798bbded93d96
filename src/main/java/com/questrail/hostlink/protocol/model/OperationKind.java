package com.questrail.hostlink.protocol.model;

/**
 * The four logical operations of the link, one callback slot each.
 */
public enum OperationKind
{
    ACTIVATION_CHECK("activation-check", Discriminant.VERIFY_ACTIVATION, Discriminant.ACTIVATION_REPLY),
    FETCH_LIST("fetch-list", Discriminant.FETCH_LIST, Discriminant.FETCH_LIST_REPLY),
    REMOVE_ONE("remove-one", Discriminant.REMOVE_ONE, Discriminant.REMOVE_ONE_REPLY),
    CLEAR_ALL("clear-all", Discriminant.CLEAR_ALL, Discriminant.CLEAR_ALL_REPLY);

    private final String label;
    private final Discriminant request;
    private final Discriminant reply;

    OperationKind(String label, Discriminant request, Discriminant reply) {
        this.label = label;
        this.request = request;
        this.reply = reply;
    }

    public String label() {
        return label;
    }

    public Discriminant request() {
        return request;
    }

    public Discriminant reply() {
        return reply;
    }
}
