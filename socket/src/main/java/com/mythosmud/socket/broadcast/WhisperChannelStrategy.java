package com.mythosmud.socket.broadcast;

import com.google.common.base.Strings;
import com.mythosmud.core.channel.ChannelType;
import com.mythosmud.core.msg.BroadcastRoute;
import com.mythosmud.core.msg.Envelope;
import com.mythosmud.socket.connection.DeliveryReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

/**
 * Private message to exactly one player. Never fans out to other nodes.
 */
public class WhisperChannelStrategy implements ChannelBroadcastingStrategy {
    private static final Logger log = LoggerFactory.getLogger(WhisperChannelStrategy.class);

    @Override
    public String getChannelType() {
        return ChannelType.WHISPER.getWireName();
    }

    @Override
    public Mono<BroadcastResult> broadcast(Envelope envelope, BroadcastRoute route, BroadcastContext context) {
        return Mono.fromSupplier(() -> {
            String target = route.getTargetPlayerId();
            if (Strings.isNullOrEmpty(target) || target.isBlank()) {
                log.warn("Whisper from {} has no target, skipping", route.getSenderId());
                return BroadcastResult.of(getChannelType(), BroadcastResult.Status.SKIPPED);
            }
            if (context.getRegistry().handlesOf(target).isEmpty()) {
                // TODO: relay to the target's node once player locations are shared between nodes
                log.info("Whisper target {} is not connected to this node; cross-process whisper relay not implemented",
                    target);
                context.getMetrics().recordDrop("not_implemented");
                return BroadcastResult.of(getChannelType(), BroadcastResult.Status.NOT_IMPLEMENTED);
            }
            boolean sent = context.getRegistry().sendLocal(target, envelope);
            return BroadcastResult.delivered(getChannelType(), new DeliveryReport(1, sent ? 1 : 0, sent ? 0 : 1), false);
        });
    }

    @Override
    public Mono<BroadcastResult> deliverRemote(Envelope envelope, BroadcastRoute route, BroadcastContext context) {
        return broadcast(envelope, route, context);
    }
}
