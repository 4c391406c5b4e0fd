package com.mythosmud.socket.support;

import com.mythosmud.core.util.SequenceGenerator;
import com.mythosmud.socket.broadcast.BroadcastContext;
import com.mythosmud.socket.broadcast.BroadcastCoordinator;
import com.mythosmud.socket.broadcast.ChannelBroadcastingStrategyFactory;
import com.mythosmud.socket.bus.IEventBus;
import com.mythosmud.socket.config.SocketConfig;
import com.mythosmud.socket.connection.ConnectionHandle;
import com.mythosmud.socket.connection.ConnectionRegistry;
import com.mythosmud.socket.connection.TransportType;
import com.mythosmud.socket.metrics.MetricsService;
import com.mythosmud.socket.mute.MuteListLookup;
import com.mythosmud.socket.payload.PayloadOptimizer;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Wiring shortcuts shared by the socket tests.
 */
public final class TestSupport {
    public static final Instant START = Instant.parse("2024-03-01T12:00:00Z");

    private static final AtomicInteger CONNECTION_IDS = new AtomicInteger();

    private TestSupport() {
    }

    public static MetricsService metrics(SocketConfig config) {
        return new MetricsService(new SimpleMeterRegistry(), config);
    }

    public static ConnectionRegistry registry(SocketConfig config, MetricsService metrics, Clock clock) {
        return new ConnectionRegistry(new PayloadOptimizer(config), metrics, clock);
    }

    public static BroadcastContext context(SocketConfig config, ConnectionRegistry registry, MuteListLookup muteLookup,
                                           IEventBus bus, MetricsService metrics, Clock clock) {
        return BroadcastContext.builder()
            .nodeId(config.getNodeId())
            .registry(registry)
            .muteLookup(muteLookup)
            .bus(bus)
            .metrics(metrics)
            .clock(clock)
            .build();
    }

    public static BroadcastCoordinator coordinator(SocketConfig config, BroadcastContext context) {
        return new BroadcastCoordinator(
            new ChannelBroadcastingStrategyFactory(),
            context,
            new PayloadOptimizer(config),
            new SequenceGenerator()
        );
    }

    /**
     * Registers a websocket handle for {@code playerId} and returns its sink.
     */
    public static RecordingFrameSink connect(ConnectionRegistry registry, String playerId) {
        return connect(registry, playerId, TransportType.WEBSOCKET);
    }

    public static RecordingFrameSink connect(ConnectionRegistry registry, String playerId, TransportType transport) {
        RecordingFrameSink sink = new RecordingFrameSink();
        registry.register(new ConnectionHandle(
            "conn-" + CONNECTION_IDS.incrementAndGet(), playerId, transport, START, sink));
        return sink;
    }

    /**
     * Value of a counter with the given tag, zero when it was never created.
     */
    public static double count(MetricsService metrics, String name, String tagKey, String tagValue) {
        return count(metrics.getRegistry(), name, tagKey, tagValue);
    }

    public static double count(MeterRegistry registry, String name, String tagKey, String tagValue) {
        Counter counter = registry.find(name).tag(tagKey, tagValue).counter();
        return counter == null ? 0 : counter.count();
    }
}
