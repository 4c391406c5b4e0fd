package com.mythosmud.core.metrics;

/**
 * Micrometer metric names used across the relay.
 * <p>
 * <b>Naming convention:</b> {@code mythos.<component>.<metric>}
 * <ul>
 *   <li>Counters: {@code .total} suffix</li>
 *   <li>Gauges: current value (no suffix)</li>
 *   <li>Timers: {@code .latency} suffix</li>
 * </ul>
 * </p>
 */
public final class MetricsNames {
    private MetricsNames() {
    }

    /**
     * Counter: Frames written to local connections.
     * <p>
     * Tags: nodeId, type (local/remote)
     * </p>
     */
    public static final String DELIVER_TOTAL = "mythos.relay.deliver.total";

    /**
     * Counter: Frames or broadcasts dropped.
     * <p>
     * Tags: nodeId, reason (buffer_full/connection_closed/muted/routing_misuse/unknown_channel/
     * not_implemented/callback_queue_full)
     * </p>
     */
    public static final String DROPS_TOTAL = "mythos.relay.drops.total";

    /**
     * Counter: Broadcasts accepted by the coordinator.
     * <p>
     * Tags: nodeId, channel, status
     * </p>
     */
    public static final String BROADCASTS_TOTAL = "mythos.relay.broadcasts.total";

    /**
     * Counter: System and admin broadcasts, kept apart for audit dashboards.
     * <p>
     * Tags: nodeId, channel
     * </p>
     */
    public static final String AUDIT_BROADCASTS_TOTAL = "mythos.relay.audit.broadcasts.total";

    /**
     * Counter: Bus publish outcomes.
     * <p>
     * Tags: nodeId, outcome (delivered/retried/dead_lettered)
     * </p>
     */
    public static final String BUS_PUBLISH_TOTAL = "mythos.bus.publish.total";

    /**
     * Timer: Broker publish latency of successful attempts.
     * <p>
     * Tags: nodeId
     * </p>
     */
    public static final String BUS_PUBLISH_LATENCY = "mythos.bus.publish.latency";

    /**
     * Timer: Lag between origin publish and remote delivery.
     * <p>
     * Tags: nodeId
     * </p>
     */
    public static final String BUS_RELAY_LAG_LATENCY = "mythos.bus.relay.lag.latency";

    /**
     * Gauge: Entries currently held in the dead-letter store.
     * <p>
     * Tags: nodeId
     * </p>
     */
    public static final String BUS_DEAD_LETTERS = "mythos.bus.dead.letters";

    /**
     * Gauge: Active bus subscriptions.
     * <p>
     * Tags: nodeId
     * </p>
     */
    public static final String BUS_SUBSCRIPTIONS = "mythos.bus.subscriptions";

    /**
     * Gauge: Live transport handles.
     * <p>
     * Tags: nodeId
     * </p>
     */
    public static final String ACTIVE_CONNECTIONS = "mythos.relay.connections.active";

    /**
     * Counter: Payloads sent compressed.
     * <p>
     * Tags: nodeId
     * </p>
     */
    public static final String PAYLOAD_COMPRESSED_TOTAL = "mythos.payload.compressed.total";

    /**
     * Counter: Payloads rejected for exceeding the compressed size ceiling.
     * <p>
     * Tags: nodeId
     * </p>
     */
    public static final String PAYLOAD_REJECTED_TOTAL = "mythos.payload.rejected.total";

    /**
     * Counter: Inbound client frames rejected with an error response.
     * <p>
     * Tags: nodeId, reason (error type)
     * </p>
     */
    public static final String INBOUND_REJECTED_TOTAL = "mythos.inbound.rejected.total";

    /**
     * Counter: Network traffic inbound from clients (bytes).
     * <p>
     * Tags: nodeId, transport (websocket/stream)
     * </p>
     */
    public static final String NETWORK_INBOUND_CLIENT_BYTES = "mythos.network.inbound.client.bytes";

    /**
     * Counter: Network traffic outbound to clients (bytes).
     * <p>
     * Tags: nodeId
     * </p>
     */
    public static final String NETWORK_OUTBOUND_CLIENT_BYTES = "mythos.network.outbound.client.bytes";

    /**
     * Counter: Network traffic to and from the broker (bytes).
     * <p>
     * Tags: nodeId, direction (inbound/outbound)
     * </p>
     */
    public static final String NETWORK_BROKER_BYTES = "mythos.network.broker.bytes";

    /**
     * Distribution Summary: Outbound frame size distribution (bytes).
     * <p>
     * Tags: nodeId
     * </p>
     */
    public static final String MESSAGE_SIZE_OUTBOUND = "mythos.message.size.outbound";
}
