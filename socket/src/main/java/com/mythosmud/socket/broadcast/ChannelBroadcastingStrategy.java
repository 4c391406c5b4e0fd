package com.mythosmud.socket.broadcast;

import com.mythosmud.core.msg.BroadcastRoute;
import com.mythosmud.core.msg.Envelope;
import reactor.core.publisher.Mono;

/**
 * Delivery rules for one channel or channel family.
 * <p>
 * Implementations are stateless and never signal errors for routing problems; those end up
 * as a {@link BroadcastResult.Status#SKIPPED} or {@link BroadcastResult.Status#NOT_IMPLEMENTED}
 * result.
 * </p>
 */
public interface ChannelBroadcastingStrategy {

    /**
     * Channel name this instance serves, as passed to the factory.
     */
    String getChannelType();

    /**
     * Delivers to local recipients and republishes for other nodes where the channel fans out.
     */
    Mono<BroadcastResult> broadcast(Envelope envelope, BroadcastRoute route, BroadcastContext context);

    /**
     * Delivers a message relayed from another node to local recipients only.
     */
    Mono<BroadcastResult> deliverRemote(Envelope envelope, BroadcastRoute route, BroadcastContext context);
}
