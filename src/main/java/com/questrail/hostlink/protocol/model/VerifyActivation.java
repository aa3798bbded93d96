package com.questrail.hostlink.protocol.model;

/**
 * Asks the host whether the module is loaded and active.
 *
 * <p>Valid reply: {@link ActivationReply}.</p>
 */
public record VerifyActivation() implements BusRequest
{
    @Override
    public Discriminant discriminant() {
        return Discriminant.VERIFY_ACTIVATION;
    }
}
