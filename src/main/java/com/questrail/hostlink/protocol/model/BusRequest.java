package com.questrail.hostlink.protocol.model;

/**
 * Management application to host module.
 */
public sealed interface BusRequest extends BusMessage
        permits VerifyActivation, FetchRecords, RemoveRecord, ClearRecords
{
}
