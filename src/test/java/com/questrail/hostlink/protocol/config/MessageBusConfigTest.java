package com.questrail.hostlink.protocol.config;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class MessageBusConfigTest {

    @Test
    void defaultsUseWellKnownChannelsAndNoTimeout() {
        MessageBusConfig config = MessageBusConfig.defaults();

        assertEquals("com.questrail.hostlink.action.HOST_HANDLER", config.channels().requests());
        assertEquals("com.questrail.hostlink.action.MODULE_HANDLER", config.channels().replies());
        assertEquals(MessageBusConfig.DEFAULT_ACTIVATION_TOKEN, config.activationToken());
        assertTrue(config.replyTimeoutValue().isEmpty());
    }

    @Test
    void builderOverridesEachField() {
        MessageBusConfig config = MessageBusConfig.builder()
                .withChannels(new LinkChannels("req", "rep"))
                .withActivationToken("v2")
                .withReplyTimeout(Duration.ofMillis(250))
                .build();

        assertEquals("req", config.channels().requests());
        assertEquals("v2", config.activationToken());
        assertEquals(Duration.ofMillis(250), config.replyTimeoutValue().orElseThrow());
    }

    @Test
    void rejectsInvalidValues() {
        assertThrows(IllegalArgumentException.class, () -> new LinkChannels("same", "same"));
        assertThrows(IllegalArgumentException.class, () -> new LinkChannels(" ", "rep"));
        assertThrows(IllegalArgumentException.class,
                () -> MessageBusConfig.builder().withReplyTimeout(Duration.ZERO).build());
        assertThrows(NullPointerException.class,
                () -> MessageBusConfig.builder().withActivationToken(null).build());
    }
}
