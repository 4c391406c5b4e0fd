package com.mythosmud.socket.broadcast;

import com.google.common.base.Strings;
import com.mythosmud.core.channel.ChannelType;
import com.mythosmud.core.msg.BroadcastRoute;
import com.mythosmud.core.msg.Envelope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

/**
 * Party chat. Party membership is not tracked by this node yet, so messages are logged
 * and reported as not implemented.
 */
public class PartyChannelStrategy implements ChannelBroadcastingStrategy {
    private static final Logger log = LoggerFactory.getLogger(PartyChannelStrategy.class);

    @Override
    public String getChannelType() {
        return ChannelType.PARTY.getWireName();
    }

    @Override
    public Mono<BroadcastResult> broadcast(Envelope envelope, BroadcastRoute route, BroadcastContext context) {
        return Mono.fromSupplier(() -> {
            if (Strings.isNullOrEmpty(route.getPartyId())) {
                log.warn("Party message from {} has no party id", route.getSenderId());
            } else {
                log.info("Party message from {} to party {} not delivered: party delivery not implemented",
                    route.getSenderId(), route.getPartyId());
            }
            context.getMetrics().recordDrop("not_implemented");
            return BroadcastResult.of(getChannelType(), BroadcastResult.Status.NOT_IMPLEMENTED);
        });
    }

    @Override
    public Mono<BroadcastResult> deliverRemote(Envelope envelope, BroadcastRoute route, BroadcastContext context) {
        return broadcast(envelope, route, context);
    }
}
