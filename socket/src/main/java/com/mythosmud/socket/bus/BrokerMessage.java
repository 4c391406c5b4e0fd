package com.mythosmud.socket.bus;

/**
 * Raw message as carried by a {@link MessageBroker}: the subject and the serialized
 * {@link com.mythosmud.core.msg.RelayMessage}.
 */
public record BrokerMessage(String subject, String payload) {
}
