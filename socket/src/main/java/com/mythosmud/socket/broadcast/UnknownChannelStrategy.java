package com.mythosmud.socket.broadcast;

import com.mythosmud.core.msg.BroadcastRoute;
import com.mythosmud.core.msg.Envelope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

/**
 * Stand-in for channel names nobody registered. Logs and drops.
 */
public class UnknownChannelStrategy implements ChannelBroadcastingStrategy {
    private static final Logger log = LoggerFactory.getLogger(UnknownChannelStrategy.class);

    private final String channelType;

    public UnknownChannelStrategy(String channelType) {
        this.channelType = channelType;
    }

    @Override
    public String getChannelType() {
        return channelType;
    }

    @Override
    public Mono<BroadcastResult> broadcast(Envelope envelope, BroadcastRoute route, BroadcastContext context) {
        return Mono.fromSupplier(() -> {
            log.warn("Unknown channel '{}' for {} from {}, dropping", channelType, envelope.getEventType(),
                route.getSenderId());
            context.getMetrics().recordDrop("unknown_channel");
            return BroadcastResult.of(channelType, BroadcastResult.Status.DROPPED);
        });
    }

    @Override
    public Mono<BroadcastResult> deliverRemote(Envelope envelope, BroadcastRoute route, BroadcastContext context) {
        return broadcast(envelope, route, context);
    }
}
