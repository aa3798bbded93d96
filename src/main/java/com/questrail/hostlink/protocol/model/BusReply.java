package com.questrail.hostlink.protocol.model;

/**
 * Host module to management application.
 */
public sealed interface BusReply extends BusMessage
        permits ActivationReply, RecordsReply, RemoveAck, ClearAck
{
}
