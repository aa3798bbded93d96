package com.questrail.hostlink.protocol.config;

import java.util.Objects;

/**
 * The two well-known channel names of a link.
 *
 * @param requests channel the management application publishes requests on
 *                 and the host module listens to
 * @param replies  channel the host module publishes replies on and the
 *                 management application listens to
 */
public record LinkChannels(String requests, String replies) {

    public static final String DEFAULT_REQUESTS = "com.questrail.hostlink.action.HOST_HANDLER";
    public static final String DEFAULT_REPLIES = "com.questrail.hostlink.action.MODULE_HANDLER";

    public LinkChannels {
        Objects.requireNonNull(requests, "requests");
        Objects.requireNonNull(replies, "replies");
        if (requests.isBlank() || replies.isBlank()) {
            throw new IllegalArgumentException("Channel names must not be blank");
        }
        if (requests.equals(replies)) {
            throw new IllegalArgumentException("Request and reply channels must differ");
        }
    }

    public static LinkChannels defaults() {
        return new LinkChannels(DEFAULT_REQUESTS, DEFAULT_REPLIES);
    }
}
