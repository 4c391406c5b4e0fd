package com.mythosmud.socket.broadcast;

import com.mythosmud.core.msg.BroadcastRoute;
import com.mythosmud.core.msg.Envelope;
import com.mythosmud.core.msg.RelayMessage;
import com.mythosmud.core.msg.Subjects;
import com.mythosmud.core.util.SequenceGenerator;
import com.mythosmud.socket.bus.BusSubscription;
import com.mythosmud.socket.connection.OccupancyListener;
import com.mythosmud.socket.payload.PayloadOptimizer;
import com.mythosmud.socket.payload.PayloadTooLargeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Entry point for game logic that wants an event delivered.
 * <p>
 * <b>Outbound:</b> {@link #publish} checks the payload size, picks the channel strategy and
 * lets it deliver locally and republish. <b>Inbound:</b> relayed messages from other nodes go
 * through {@link #deliverRemote}; messages this node published itself are ignored.
 * </p>
 * <p>
 * Strategy failures never reach the producer; they are logged and reported as
 * {@link BroadcastResult.Status#DROPPED}. An oversized payload is the one error a producer sees.
 * </p>
 */
public class BroadcastCoordinator implements OccupancyListener {
    private static final Logger log = LoggerFactory.getLogger(BroadcastCoordinator.class);

    private final ChannelBroadcastingStrategyFactory strategyFactory;
    private final BroadcastContext context;
    private final PayloadOptimizer payloadOptimizer;
    private final SequenceGenerator sequenceGenerator;
    private final RoomSubscriptionManager roomSubscriptions;

    private final List<BusSubscription> fixedSubscriptions = new ArrayList<>();
    private final Map<String, Map<String, Map<String, Object>>> stateSnapshots = new ConcurrentHashMap<>();

    public BroadcastCoordinator(ChannelBroadcastingStrategyFactory strategyFactory,
                                BroadcastContext context,
                                PayloadOptimizer payloadOptimizer,
                                SequenceGenerator sequenceGenerator) {
        this.strategyFactory = strategyFactory;
        this.context = context;
        this.payloadOptimizer = payloadOptimizer;
        this.sequenceGenerator = sequenceGenerator;
        this.roomSubscriptions = new RoomSubscriptionManager(context.getRegistry(), context.getBus(), this::onRelay);
    }

    /**
     * Starts the bus, subscribes to the reserved subjects and to the rooms that already have
     * occupants.
     */
    public Mono<Void> start() {
        return context.getBus().start()
            .then(Mono.fromRunnable(() -> {
                synchronized (fixedSubscriptions) {
                    fixedSubscriptions.add(context.getBus().subscribe(Subjects.GLOBAL, this::onRelay));
                    fixedSubscriptions.add(context.getBus().subscribe(Subjects.SYSTEM, this::onRelay));
                }
                context.getRegistry().addOccupancyListener(this);
                roomSubscriptions.start();
                log.info("Broadcast coordinator started on node {}", context.getNodeId());
            }));
    }

    public void stop() {
        roomSubscriptions.stop();
        synchronized (fixedSubscriptions) {
            fixedSubscriptions.forEach(BusSubscription::dispose);
            fixedSubscriptions.clear();
        }
        log.info("Broadcast coordinator stopped on node {}", context.getNodeId());
    }

    /**
     * Builds an envelope stamped with the current time and the sender's next sequence number.
     */
    public Envelope newEnvelope(String eventType, Map<String, Object> data, String senderId, String channel) {
        return Envelope.builder()
            .eventType(eventType)
            .timestamp(context.getClock().instant())
            .sequenceNumber(sequenceGenerator.next(senderId))
            .data(data)
            .senderId(senderId)
            .channel(channel)
            .build();
    }

    /**
     * Routes one envelope through the strategy for its channel.
     * <p>
     * Errors with {@link PayloadTooLargeException} when the envelope cannot be delivered at any
     * size; every other failure becomes a {@code DROPPED} result.
     * </p>
     */
    public Mono<BroadcastResult> publish(Envelope envelope, BroadcastRoute route) {
        return Mono.defer(() -> {
            try {
                payloadOptimizer.requireDeliverable(envelope);
            } catch (PayloadTooLargeException e) {
                log.warn("Rejecting {} on {} from {}: {}", envelope.getEventType(), envelope.getChannel(),
                    route.getSenderId(), e.getMessage());
                context.getMetrics().recordPayloadRejected();
                return Mono.error(e);
            }

            ChannelBroadcastingStrategy strategy = strategyFactory.getStrategy(envelope.getChannel());
            return strategy.broadcast(envelope, route, context)
                .onErrorResume(err -> {
                    log.error("Broadcast on {} failed for {} from {}", strategy.getChannelType(),
                        envelope.getEventType(), route.getSenderId(), err);
                    return Mono.just(BroadcastResult.of(strategy.getChannelType(), BroadcastResult.Status.DROPPED));
                })
                .doOnNext(result -> {
                    context.getMetrics().recordBroadcast(result.getChannelType(), result.getStatus().name());
                    context.getMetrics().recordDeliverLocal(result.getDelivered());
                    log.debug("Broadcast {} on {}: {}", envelope.getEventType(), result.getChannelType(), result);
                });
        });
    }

    /**
     * Delivers a relayed message to this node's recipients. Messages from this node are ignored.
     *
     * @return the local result, or empty when ignored
     */
    public Mono<BroadcastResult> deliverRemote(RelayMessage message) {
        return Mono.defer(() -> {
            if (context.getNodeId().equals(message.getOriginNodeId())) {
                return Mono.empty();
            }
            if (message.getEnvelope() == null) {
                log.warn("Relayed message on {} from {} has no envelope", message.getSubject(), message.getOriginNodeId());
                return Mono.empty();
            }
            context.getMetrics().recordRelayLag(message.getPublishedAt());

            ChannelBroadcastingStrategy strategy = strategyFactory.getStrategy(message.getChannel());
            return strategy.deliverRemote(message.getEnvelope(), message.getRoute(), context)
                .onErrorResume(err -> {
                    log.error("Remote delivery on {} from node {} failed", strategy.getChannelType(),
                        message.getOriginNodeId(), err);
                    return Mono.just(BroadcastResult.of(strategy.getChannelType(), BroadcastResult.Status.DROPPED));
                })
                .doOnNext(result -> context.getMetrics().recordDeliverRemote(result.getDelivered()));
        });
    }

    /**
     * Pushes a state snapshot to one player as a delta against the last snapshot sent for the
     * same key. Nothing is written when the snapshot did not change.
     *
     * @return whether a frame was written
     */
    public Mono<Boolean> publishState(String playerId, String stateKey, Map<String, Object> snapshot) {
        return Mono.fromSupplier(() -> {
            Map<String, Map<String, Object>> playerStates =
                stateSnapshots.computeIfAbsent(playerId, id -> new ConcurrentHashMap<>());
            Map<String, Object> previous = playerStates.get(stateKey);
            Map<String, Object> delta = payloadOptimizer.incremental(snapshot, previous);

            if (previous != null && isEmptyDelta(delta)) {
                log.debug("State {} for {} unchanged, skipping", stateKey, playerId);
                return false;
            }

            Map<String, Object> data = new LinkedHashMap<>();
            data.put("state_key", stateKey);
            data.put("state", delta);
            Envelope envelope = newEnvelope("state_update", data, null, null).toBuilder()
                .playerId(playerId)
                .build();

            boolean sent = context.getRegistry().sendLocal(playerId, envelope);
            if (sent) {
                playerStates.put(stateKey, new LinkedHashMap<>(snapshot));
            }
            return sent;
        });
    }

    public RoomSubscriptionManager getRoomSubscriptions() {
        return roomSubscriptions;
    }

    @Override
    public void onPlayerOffline(String playerId) {
        stateSnapshots.remove(playerId);
    }

    private void onRelay(RelayMessage message) {
        deliverRemote(message).subscribe(
            result -> {
            },
            err -> log.error("Unexpected error delivering relayed message on {}", message.getSubject(), err)
        );
    }

    private static boolean isEmptyDelta(Map<String, Object> delta) {
        Object changes = delta.get("changes");
        return changes instanceof Map<?, ?> map && map.isEmpty() && !delta.containsKey("removed");
    }
}
