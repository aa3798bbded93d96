package com.questrail.hostlink.protocol.model;

/**
 * Semantic form of an envelope: one variant per discriminant.
 *
 * <p>The bus, the reply demultiplexer and the remote responder reason only about
 * {@code BusMessage} values. Discriminant strings, payload keys and payload
 * shapes stay below this line, in the envelope encoder and decoder.</p>
 *
 * <p>The link is directional:</p>
 * <ul>
 *   <li>{@link BusRequest} travels from the management application to the host</li>
 *   <li>{@link BusReply} travels from the host back to the management application</li>
 * </ul>
 */
public sealed interface BusMessage permits BusRequest, BusReply
{
    /**
     * @return the discriminant this message is published under
     */
    Discriminant discriminant();
}
