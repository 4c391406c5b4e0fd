package com.mythosmud.socket.inbound;

import com.mythosmud.core.metrics.MetricsNames;
import com.mythosmud.socket.broadcast.BroadcastCoordinator;
import com.mythosmud.socket.bus.RecordingEventBus;
import com.mythosmud.socket.config.SocketConfig;
import com.mythosmud.socket.connection.ConnectionHandle;
import com.mythosmud.socket.connection.ConnectionRegistry;
import com.mythosmud.socket.connection.TransportType;
import com.mythosmud.socket.metrics.MetricsService;
import com.mythosmud.socket.mute.MuteListLookup;
import com.mythosmud.socket.payload.PayloadTooLargeException;
import com.mythosmud.socket.support.MutableClock;
import com.mythosmud.socket.support.RecordingFrameSink;
import com.mythosmud.socket.support.TestSupport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class InboundMessageHandlerFactoryTest {

    private static final String ROOM = "earth_arkhamcity_northside_intersection_derby_high";

    private MetricsService metrics;
    private MutableClock clock;
    private ConnectionRegistry registry;
    private RecordingEventBus bus;
    private RecordingCommandProcessor commands;
    private InboundMessageHandlerFactory factory;
    private RecordingFrameSink aliceSink;
    private ConnectionHandle alice;

    @BeforeEach
    void setUp() {
        SocketConfig config = SocketConfig.defaults("node-a");
        metrics = TestSupport.metrics(config);
        clock = new MutableClock(TestSupport.START);
        registry = TestSupport.registry(config, metrics, clock);
        bus = new RecordingEventBus();
        BroadcastCoordinator coordinator = TestSupport.coordinator(config,
            TestSupport.context(config, registry, MuteListLookup.NONE, bus, metrics, clock));
        commands = new RecordingCommandProcessor();
        factory = new InboundMessageHandlerFactory(coordinator, registry, commands, metrics);

        aliceSink = new RecordingFrameSink();
        alice = new ConnectionHandle("c-alice", "alice", TransportType.WEBSOCKET, TestSupport.START, aliceSink);
        registry.register(alice);
    }

    @Test
    void testUnknownType_ExactlyOneInvalidCommandAndNoHandlerRuns() {
        AtomicInteger otherHandlerCalls = new AtomicInteger();
        factory.registerHandler("bar", (context, data) -> Mono.fromRunnable(otherHandlerCalls::incrementAndGet));

        factory.handle(alice, "{\"type\":\"foo\"}").block();

        List<Map<String, Object>> frames = aliceSink.writtenJson();
        assertEquals(1, frames.size());
        assertEquals("error", frames.get(0).get("type"));
        assertEquals("invalid_command", frames.get(0).get("error_type"));
        assertEquals("Unknown message type: foo", frames.get(0).get("message"));
        assertEquals(Map.of("player_id", "alice", "message_type", "foo"), frames.get(0).get("details"));
        assertEquals(0, otherHandlerCalls.get());
        assertTrue(commands.calls.isEmpty());
        assertEquals(1, TestSupport.count(metrics, MetricsNames.INBOUND_REJECTED_TOTAL, "reason", "invalid_command"));
    }

    @Test
    void testMissingType_InvalidCommand() {
        factory.handle(alice, "{\"data\":{}}").block();

        assertEquals("Missing message type", single().get("message"));
    }

    @Test
    void testMalformedJson_InvalidFormat() {
        factory.handle(alice, "{\"type\":").block();
        factory.handle(alice, "null").block();

        List<Map<String, Object>> frames = aliceSink.writtenJson();
        assertEquals(2, frames.size());
        assertEquals("invalid_format", frames.get(0).get("error_type"));
        assertEquals("Invalid JSON format", frames.get(0).get("message"));
        assertEquals("invalid_format", frames.get(1).get("error_type"));
    }

    @Test
    void testNonObjectData_InvalidFormat() {
        factory.handle(alice, "{\"type\":\"ping\",\"data\":[1,2]}").block();

        assertEquals("invalid_format", single().get("error_type"));
    }

    @Test
    void testPing_RepliesPongAndTouchesConnection() {
        clock.advance(Duration.ofSeconds(30));

        factory.handle(alice, "{\"type\":\"ping\"}").block();

        Map<String, Object> frame = single();
        assertEquals("pong", frame.get("event_type"));
        assertEquals("alice", frame.get("player_id"));
        assertEquals(TestSupport.START.plusSeconds(30), alice.getLastSeen());
    }

    @Test
    void testCommand_SplitsCommandLine() {
        factory.handle(alice, "{\"type\":\"command\",\"data\":{\"command\":\"LOOK  north \"}}").block();

        assertEquals(List.of("look", List.of("north")), commands.calls.get(0));
        Map<String, Object> frame = single();
        assertEquals("command_response", frame.get("event_type"));
        assertEquals(Map.of("result", "ok:look"), frame.get("data"));
    }

    @Test
    void testGameCommand_ExplicitArgs() {
        factory.handle(alice, "{\"type\":\"game_command\",\"data\":{\"command\":\"Go\",\"args\":[\"east\",2]}}").block();

        assertEquals(List.of("go", List.of("east", "2")), commands.calls.get(0));
    }

    @Test
    void testCommand_EmptyIsRejected() {
        factory.handle(alice, "{\"type\":\"command\",\"data\":{\"command\":\"  \"}}").block();

        Map<String, Object> frame = single();
        assertEquals("invalid_command", frame.get("error_type"));
        assertEquals("Empty command", frame.get("message"));
        assertTrue(commands.calls.isEmpty());
    }

    @Test
    void testFailingHandler_MessageProcessingError() {
        factory.registerHandler("explode", (context, data) -> Mono.error(new IllegalStateException("kaboom")));

        factory.handle(alice, "{\"type\":\"explode\"}").block();

        Map<String, Object> frame = single();
        assertEquals("message_processing_error", frame.get("error_type"));
        assertEquals("Error processing message: kaboom", frame.get("message"));
    }

    @Test
    void testOversizedOutput_PayloadTooLarge() {
        factory.registerHandler("huge", (context, data) -> Mono.error(new PayloadTooLargeException(200_000, 60_000, 51_200)));

        factory.handle(alice, "{\"type\":\"huge\"}").block();

        Map<String, Object> frame = single();
        assertEquals("payload_too_large", frame.get("error_type"));
        assertEquals(Map.of("limit", 51_200), frame.get("details"));
    }

    @Test
    void testChat_SaysInRoomAndConfirms() {
        registry.moveToRoom("alice", ROOM);
        RecordingFrameSink bob = TestSupport.connect(registry, "bob");
        registry.moveToRoom("bob", ROOM);

        factory.handle(alice, "{\"type\":\"chat\",\"data\":{\"message\":\"The stars are right\"}}").block();

        Map<String, Object> heard = bob.writtenJson().get(0);
        assertEquals("chat", heard.get("event_type"));
        assertEquals(Map.of("player_id", "alice", "message", "The stars are right"), heard.get("data"));
        assertEquals("chat_sent", single().get("event_type"));
        assertEquals("room.arkhamcity.northside", bus.published().get(0).subject());
    }

    @Test
    void testChat_EmptyMessageRejected() {
        registry.moveToRoom("alice", ROOM);

        factory.handle(alice, "{\"type\":\"chat\",\"data\":{\"message\":\"\"}}").block();

        assertEquals("invalid_command", single().get("error_type"));
        assertTrue(bus.published().isEmpty());
    }

    private Map<String, Object> single() {
        List<Map<String, Object>> frames = aliceSink.writtenJson();
        assertEquals(1, frames.size(), "frames: " + frames);
        return frames.get(0);
    }

    private static final class RecordingCommandProcessor implements GameCommandProcessor {
        final List<List<Object>> calls = new CopyOnWriteArrayList<>();

        @Override
        public Mono<Map<String, Object>> process(String playerId, String command, List<String> args) {
            calls.add(List.of(command, List.copyOf(args)));
            return Mono.just(Map.of("result", "ok:" + command));
        }
    }
}
