package com.questrail.hostlink.protocol.codec.impl;

/**
 * One-byte wire tags for payload value types.
 */
final class PayloadTags
{
    static final byte TEXT = 'S';
    static final byte INT = 'I';
    static final byte BOOL = 'Z';
    static final byte RECORD = 'R';
    static final byte RECORD_SEQUENCE = 'L';

    private PayloadTags() {}
}
