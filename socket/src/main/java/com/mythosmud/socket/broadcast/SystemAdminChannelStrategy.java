package com.mythosmud.socket.broadcast;

import com.mythosmud.core.channel.ChannelType;
import com.mythosmud.core.msg.BroadcastRoute;
import com.mythosmud.core.msg.Envelope;
import com.mythosmud.core.msg.Subjects;
import com.mythosmud.socket.connection.DeliveryReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.Marker;
import org.slf4j.MarkerFactory;
import reactor.core.publisher.Mono;

/**
 * System and admin announcements. Delivered like global chat, published on the
 * {@code system} subject and written to the audit log.
 */
public class SystemAdminChannelStrategy implements ChannelBroadcastingStrategy {
    private static final Logger log = LoggerFactory.getLogger(SystemAdminChannelStrategy.class);
    private static final Marker AUDIT = MarkerFactory.getMarker("AUDIT");

    private final ChannelType channelType;

    public SystemAdminChannelStrategy(ChannelType channelType) {
        if (channelType.getFamily() != ChannelType.Family.SYSTEM_ADMIN) {
            throw new IllegalArgumentException(channelType + " is not a system or admin channel");
        }
        this.channelType = channelType;
    }

    @Override
    public String getChannelType() {
        return channelType.getWireName();
    }

    @Override
    public Mono<BroadcastResult> broadcast(Envelope envelope, BroadcastRoute route, BroadcastContext context) {
        return Mono.fromSupplier(() -> {
            log.info(AUDIT, "{} broadcast from {}: event={} data={}",
                getChannelType(), route.getSenderId(), envelope.getEventType(), envelope.getData());
            context.getMetrics().recordAuditBroadcast(getChannelType());

            DeliveryReport report = context.getRegistry().broadcastLocal(envelope, route.getSenderId());
            boolean published = context.relay(Subjects.SYSTEM, getChannelType(), envelope, route);
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
