package com.mythosmud.socket.broadcast;

import com.mythosmud.core.channel.ChannelType;
import com.mythosmud.core.msg.BroadcastRoute;
import com.mythosmud.core.msg.Envelope;
import com.mythosmud.core.msg.Subjects;
import com.mythosmud.socket.connection.DeliveryReport;
import reactor.core.publisher.Mono;

/**
 * Global chat: every connected player except the sender, on every node.
 */
public class GlobalChannelStrategy implements ChannelBroadcastingStrategy {

    @Override
    public String getChannelType() {
        return ChannelType.GLOBAL.getWireName();
    }

    @Override
    public Mono<BroadcastResult> broadcast(Envelope envelope, BroadcastRoute route, BroadcastContext context) {
        return Mono.fromSupplier(() -> {
            DeliveryReport report = context.getRegistry().broadcastLocal(envelope, route.getSenderId());
            boolean published = context.relay(Subjects.GLOBAL, getChannelType(), envelope, route);
            return BroadcastResult.delivered(getChannelType(), report, published);
        });
    }

    @Override
    public Mono<BroadcastResult> deliverRemote(Envelope envelope, BroadcastRoute route, BroadcastContext context) {
        return Mono.fromSupplier(() -> BroadcastResult.delivered(
            getChannelType(),
            context.getRegistry().broadcastLocal(envelope, route.getSenderId()),
            false
        ));
    }
}
