package com.mythosmud.socket.metrics;

import com.mythosmud.core.metrics.MetricsNames;
import com.mythosmud.core.metrics.MetricsTags;
import com.mythosmud.core.msg.ErrorType;
import com.mythosmud.socket.config.SocketConfig;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.system.ProcessorMetrics;

import java.time.Duration;
import java.util.Locale;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Centralized metrics service for a socket node.
 * <p>
 * Fixed meters are created up front. Meters keyed by a runtime value (drop reason, channel,
 * broadcast status) are looked up through the registry, which returns the same meter for the
 * same name and tags.
 * </p>
 */
public class MetricsService {

    private final MeterRegistry registry;
    private final String nodeId;

    // Counters
    private final Counter deliverLocal;
    private final Counter deliverRemote;
    private final Counter payloadCompressed;
    private final Counter payloadRejected;

    // Network traffic counters (bytes)
    private final Counter networkOutboundClient;
    private final Counter networkBrokerInbound;
    private final Counter networkBrokerOutbound;

    private final DistributionSummary messageSizeOutbound;

    // Timers
    private final Timer busPublishLatency;
    private final Timer relayLagLatency;

    public MetricsService(MeterRegistry registry, SocketConfig config) {
        this.registry = registry;
        this.nodeId = config.getNodeId();

        new ProcessorMetrics().bindTo(registry);
        new JvmMemoryMetrics().bindTo(registry);

        deliverLocal = Counter.builder(MetricsNames.DELIVER_TOTAL)
            .tag(MetricsTags.NODE_ID, nodeId)
            .tag(MetricsTags.TYPE, "local")
            .description("Frames delivered for broadcasts that originated on this node")
            .register(registry);

        deliverRemote = Counter.builder(MetricsNames.DELIVER_TOTAL)
            .tag(MetricsTags.NODE_ID, nodeId)
            .tag(MetricsTags.TYPE, "remote")
            .description("Frames delivered for broadcasts relayed from other nodes")
            .register(registry);

        payloadCompressed = Counter.builder(MetricsNames.PAYLOAD_COMPRESSED_TOTAL)
            .tag(MetricsTags.NODE_ID, nodeId)
            .description("Payloads sent in compressed form")
            .register(registry);

        payloadRejected = Counter.builder(MetricsNames.PAYLOAD_REJECTED_TOTAL)
            .tag(MetricsTags.NODE_ID, nodeId)
            .description("Payloads rejected for exceeding the compressed size ceiling")
            .register(registry);

        networkOutboundClient = Counter.builder(MetricsNames.NETWORK_OUTBOUND_CLIENT_BYTES)
            .tag(MetricsTags.NODE_ID, nodeId)
            .description("Total bytes sent to clients")
            .baseUnit("bytes")
            .register(registry);

        networkBrokerInbound = Counter.builder(MetricsNames.NETWORK_BROKER_BYTES)
            .tag(MetricsTags.NODE_ID, nodeId)
            .tag(MetricsTags.DIRECTION, "inbound")
            .description("Total bytes received from the broker")
            .baseUnit("bytes")
            .register(registry);

        networkBrokerOutbound = Counter.builder(MetricsNames.NETWORK_BROKER_BYTES)
            .tag(MetricsTags.NODE_ID, nodeId)
            .tag(MetricsTags.DIRECTION, "outbound")
            .description("Total bytes sent to the broker")
            .baseUnit("bytes")
            .register(registry);

        messageSizeOutbound = DistributionSummary.builder(MetricsNames.MESSAGE_SIZE_OUTBOUND)
            .tag(MetricsTags.NODE_ID, nodeId)
            .description("Outbound frame size distribution")
            .baseUnit("bytes")
            .register(registry);

        busPublishLatency = Timer.builder(MetricsNames.BUS_PUBLISH_LATENCY)
            .tag(MetricsTags.NODE_ID, nodeId)
            .description("Broker publish latency of successful attempts")
            .publishPercentileHistogram()
            .serviceLevelObjectives(
                Duration.ofMillis(10),
                Duration.ofMillis(50),
                Duration.ofMillis(100),
                Duration.ofMillis(250),
                Duration.ofMillis(500)
            )
            .register(registry);

        relayLagLatency = Timer.builder(MetricsNames.BUS_RELAY_LAG_LATENCY)
            .tag(MetricsTags.NODE_ID, nodeId)
            .description("Lag between origin publish and remote delivery")
            .publishPercentileHistogram()
            .serviceLevelObjectives(
                Duration.ofMillis(10),
                Duration.ofMillis(50),
                Duration.ofMillis(100),
                Duration.ofMillis(250),
                Duration.ofMillis(500)
            )
            .register(registry);
    }

    public MeterRegistry getRegistry() {
        return registry;
    }

    public void recordDeliverLocal(int frames) {
        deliverLocal.increment(frames);
    }

    public void recordDeliverRemote(int frames) {
        deliverRemote.increment(frames);
    }

    /**
     * Records a dropped frame or broadcast.
     *
     * @param reason drop reason, e.g. {@code buffer_full} or {@code unknown_channel}
     */
    public void recordDrop(String reason) {
        Counter.builder(MetricsNames.DROPS_TOTAL)
            .tag(MetricsTags.NODE_ID, nodeId)
            .tag(MetricsTags.REASON, reason)
            .register(registry)
            .increment();
    }

    public void recordBroadcast(String channel, String status) {
        Counter.builder(MetricsNames.BROADCASTS_TOTAL)
            .tag(MetricsTags.NODE_ID, nodeId)
            .tag(MetricsTags.CHANNEL, channel)
            .tag(MetricsTags.STATUS, status)
            .register(registry)
            .increment();
    }

    public void recordAuditBroadcast(String channel) {
        Counter.builder(MetricsNames.AUDIT_BROADCASTS_TOTAL)
            .tag(MetricsTags.NODE_ID, nodeId)
            .tag(MetricsTags.CHANNEL, channel)
            .register(registry)
            .increment();
    }

    /**
     * Records a bus publish outcome: {@code delivered}, {@code retried} or {@code dead_lettered}.
     */
    public void recordBusPublish(String outcome) {
        Counter.builder(MetricsNames.BUS_PUBLISH_TOTAL)
            .tag(MetricsTags.NODE_ID, nodeId)
            .tag(MetricsTags.OUTCOME, outcome)
            .register(registry)
            .increment();
    }

    public void recordBusPublishLatency(long startNanos) {
        busPublishLatency.record(Duration.ofNanos(System.nanoTime() - startNanos));
    }

    /**
     * Records the lag of a relayed message.
     *
     * @param publishedAtMillis epoch millis stamped by the origin node
     */
    public void recordRelayLag(long publishedAtMillis) {
        long lag = System.currentTimeMillis() - publishedAtMillis;
        relayLagLatency.record(Math.max(lag, 0), TimeUnit.MILLISECONDS);
    }

    public void recordPayloadCompressed() {
        payloadCompressed.increment();
    }

    public void recordPayloadRejected() {
        payloadRejected.increment();
    }

    public void recordInboundRejected(ErrorType errorType) {
        Counter.builder(MetricsNames.INBOUND_REJECTED_TOTAL)
            .tag(MetricsTags.NODE_ID, nodeId)
            .tag(MetricsTags.REASON, errorType.getWireName())
            .register(registry)
            .increment();
    }

    /**
     * Records bytes received from a client.
     *
     * @param transport transport name, {@code websocket} or {@code stream}
     * @param bytes     number of bytes received
     */
    public void recordNetworkInboundClient(String transport, long bytes) {
        Counter.builder(MetricsNames.NETWORK_INBOUND_CLIENT_BYTES)
            .tag(MetricsTags.NODE_ID, nodeId)
            .tag(MetricsTags.TRANSPORT, transport.toLowerCase(Locale.ROOT))
            .baseUnit("bytes")
            .register(registry)
            .increment(bytes);
    }

    public void recordNetworkOutboundClient(long bytes) {
        networkOutboundClient.increment(bytes);
        messageSizeOutbound.record(bytes);
    }

    public void recordNetworkBrokerInbound(long bytes) {
        networkBrokerInbound.increment(bytes);
    }

    public void recordNetworkBrokerOutbound(long bytes) {
        networkBrokerOutbound.increment(bytes);
    }

    /**
     * Registers a gauge that samples {@code value} on every scrape.
     */
    public void registerGauge(String name, String description, Supplier<Number> value) {
        Gauge.builder(name, value)
            .tag(MetricsTags.NODE_ID, nodeId)
            .description(description)
            .register(registry);
    }
}
