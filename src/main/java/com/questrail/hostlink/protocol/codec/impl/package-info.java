/**
 * Envelope codec implementation.
 * =============================================================================
 *
 * <pre>
 *   byte[] body
 *        → EnvelopeFraming.extractFields   (magic, version, CRC32)
 *        → field parsing                   (discriminant, key, type tag)
 *        → RecordSerialization.read        (filtered object streams)
 *        → Envelope
 * </pre>
 *
 * <p>This layer is transport-agnostic and semantics-free. Any structural
 * failure results in the body being dropped.</p>
 */
package com.questrail.hostlink.protocol.codec.impl;
