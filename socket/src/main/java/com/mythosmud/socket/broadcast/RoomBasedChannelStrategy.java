package com.mythosmud.socket.broadcast;

import com.google.common.base.Strings;
import com.mythosmud.core.channel.ChannelType;
import com.mythosmud.core.msg.BroadcastRoute;
import com.mythosmud.core.msg.Envelope;
import com.mythosmud.core.msg.Subjects;
import com.mythosmud.socket.connection.DeliveryReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Set;

/**
 * Say, local, emote and pose: everyone in the sender's room except the sender, minus
 * listeners who muted the sender or the channel. Fans out on the room's sub-zone subject.
 */
public class RoomBasedChannelStrategy implements ChannelBroadcastingStrategy {
    private static final Logger log = LoggerFactory.getLogger(RoomBasedChannelStrategy.class);

    private final ChannelType channelType;

    public RoomBasedChannelStrategy(ChannelType channelType) {
        if (channelType.getFamily() != ChannelType.Family.ROOM_LOCAL) {
            throw new IllegalArgumentException(channelType + " is not a room-local channel");
        }
        this.channelType = channelType;
    }

    @Override
    public String getChannelType() {
        return channelType.getWireName();
    }

    @Override
    public Mono<BroadcastResult> broadcast(Envelope envelope, BroadcastRoute route, BroadcastContext context) {
        if (Strings.isNullOrEmpty(route.getRoomId()) || route.getRoomId().isBlank()) {
            log.warn("{} message from {} has no room id, skipping", getChannelType(), route.getSenderId());
            return Mono.just(BroadcastResult.of(getChannelType(), BroadcastResult.Status.SKIPPED));
        }
        return deliverToRoom(envelope, route, context)
            .map(report -> {
                boolean published = context.relay(
                    Subjects.forRoom(route.getRoomId()), getChannelType(), envelope, route
                );
                return BroadcastResult.delivered(getChannelType(), report, published);
            });
    }

    @Override
    public Mono<BroadcastResult> deliverRemote(Envelope envelope, BroadcastRoute route, BroadcastContext context) {
        if (Strings.isNullOrEmpty(route.getRoomId()) || route.getRoomId().isBlank()) {
            log.warn("Relayed {} message has no room id, skipping", getChannelType());
            return Mono.just(BroadcastResult.of(getChannelType(), BroadcastResult.Status.SKIPPED));
        }
        return deliverToRoom(envelope, route, context)
            .map(report -> BroadcastResult.delivered(getChannelType(), report, false));
    }

    private Mono<DeliveryReport> deliverToRoom(Envelope envelope, BroadcastRoute route, BroadcastContext context) {
        String senderId = route.getSenderId();
        Set<String> occupants = context.getRegistry().roomOccupants(route.getRoomId());

        return Flux.fromIterable(occupants)
            .filter(playerId -> !playerId.equals(senderId))
            .concatMap(playerId -> context.getMuteLookup().isMuted(playerId, senderId, channelType)
                .defaultIfEmpty(false)
                .flatMap(muted -> {
                    if (muted) {
                        log.debug("Player {} muted {} on {}, not delivering", playerId, senderId, getChannelType());
                        context.getMetrics().recordDrop("muted");
                        return Mono.empty();
                    }
                    return Mono.just(playerId);
                }))
            .collectList()
            .map((List<String> audible) -> context.getRegistry().deliverTo(audible, envelope));
    }
}
