package com.mythosmud.socket.broadcast;

import com.mythosmud.core.msg.BroadcastRoute;
import com.mythosmud.core.msg.Envelope;
import com.mythosmud.core.msg.RelayMessage;
import com.mythosmud.socket.bus.IEventBus;
import com.mythosmud.socket.connection.IConnectionRegistry;
import com.mythosmud.socket.metrics.MetricsService;
import com.mythosmud.socket.mute.MuteListLookup;
import lombok.Builder;
import lombok.Value;

import java.time.Clock;

/**
 * Collaborators handed to every strategy call. Strategies hold no state of their own.
 */
@Value
@Builder
public class BroadcastContext {
    String nodeId;
    IConnectionRegistry registry;
    MuteListLookup muteLookup;
    IEventBus bus;
    MetricsService metrics;
    Clock clock;

    /**
     * Republishes the envelope for other nodes.
     *
     * @return whether the bus accepted the message
     */
    public boolean relay(String subject, String channel, Envelope envelope, BroadcastRoute route) {
        RelayMessage message = RelayMessage.builder()
            .subject(subject)
            .originNodeId(nodeId)
            .channel(channel)
            .route(route)
            .envelope(envelope)
            .publishedAt(clock.millis())
            .build();
        return bus.publish(subject, message);
    }
}
