package com.mythosmud.socket.connection;

import com.mythosmud.socket.config.SocketConfig;

import java.time.Clock;
import java.util.UUID;

/**
 * Creates connection handles with a bounded outbound buffer per connection.
 */
public class ConnectionHandleFactory {
    private final int bufferSize;
    private final Clock clock;

    public ConnectionHandleFactory(SocketConfig config, Clock clock) {
        this.bufferSize = config.getPerConnBufferSize();
        this.clock = clock;
    }

    public ConnectionHandle create(String playerId, TransportType transport) {
        return new ConnectionHandle(
            UUID.randomUUID().toString(),
            playerId,
            transport,
            clock.instant(),
            new ReactorFrameSink(bufferSize)
        );
    }
}
