package com.questrail.hostlink.protocol.model;

import java.util.Optional;

/**
 * Activation status from the host.
 *
 * <p>The host answers with a token; the receiving side compares it against the
 * token it expects. A missing or wrongly typed token decodes to an empty token,
 * which never matches. The host may also push this reply unsolicited.</p>
 *
 * @param token the token the host sent, or null if none could be read
 */
public record ActivationReply(String token) implements BusReply
{
    public Optional<String> tokenValue() {
        return Optional.ofNullable(token);
    }

    /**
     * @return {@code true} if the host sent exactly {@code expectedToken}
     */
    public boolean matches(String expectedToken) {
        return token != null && token.equals(expectedToken);
    }

    @Override
    public Discriminant discriminant() {
        return Discriminant.ACTIVATION_REPLY;
    }
}
