package com.mythosmud.socket.connection;

/**
 * Client transports a player can be connected through. A player holds at most one live
 * handle per transport.
 */
public enum TransportType {
    WEBSOCKET("websocket"),
    STREAM("stream");

    private final String label;

    TransportType(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
