package com.questrail.hostlink.protocol.config;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Configuration shared by both ends of the link.
 *
 * @param channels        request and reply channel names
 * @param activationToken token the host answers activation checks with; a
 *                        reply is "activated" only if it carries exactly this
 * @param replyTimeout    how long fetch, remove and clear callbacks wait for a
 *                        reply before being released, or null to wait forever
 */
public record MessageBusConfig(
    LinkChannels channels,
    String activationToken,
    Duration replyTimeout
) {
    public static final String DEFAULT_ACTIVATION_TOKEN = "hostlink-module-v1";

    public MessageBusConfig {
        Objects.requireNonNull(channels, "channels");
        Objects.requireNonNull(activationToken, "activationToken");
        if (replyTimeout != null && (replyTimeout.isNegative() || replyTimeout.isZero())) {
            throw new IllegalArgumentException("replyTimeout must be positive");
        }
    }

    public Optional<Duration> replyTimeoutValue() {
        return Optional.ofNullable(replyTimeout);
    }

    public static MessageBusConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private LinkChannels channels = LinkChannels.defaults();
        private String activationToken = DEFAULT_ACTIVATION_TOKEN;
        private Duration replyTimeout;

        public Builder withChannels(LinkChannels channels) {
            this.channels = channels;
            return this;
        }

        public Builder withActivationToken(String activationToken) {
            this.activationToken = activationToken;
            return this;
        }

        public Builder withReplyTimeout(Duration replyTimeout) {
            this.replyTimeout = replyTimeout;
            return this;
        }

        public MessageBusConfig build() {
            return new MessageBusConfig(channels, activationToken, replyTimeout);
        }
    }
}
