package com.mythosmud.socket.ws;

import com.mythosmud.socket.broadcast.BroadcastCoordinator;
import com.mythosmud.socket.bus.RecordingEventBus;
import com.mythosmud.socket.config.SocketConfig;
import com.mythosmud.socket.connection.ConnectionHandle;
import com.mythosmud.socket.connection.ConnectionHandleFactory;
import com.mythosmud.socket.connection.ConnectionRegistry;
import com.mythosmud.socket.connection.TransportType;
import com.mythosmud.socket.inbound.GameCommandProcessor;
import com.mythosmud.socket.inbound.InboundMessageHandlerFactory;
import com.mythosmud.socket.metrics.MetricsService;
import com.mythosmud.socket.mute.MuteListLookup;
import com.mythosmud.socket.support.MutableClock;
import com.mythosmud.socket.support.RecordingFrameSink;
import com.mythosmud.socket.support.TestSupport;
import io.netty.handler.codec.http.websocketx.CloseWebSocketFrame;
import io.netty.handler.codec.http.websocketx.PongWebSocketFrame;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketFrame;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class WebSocketHandlerTest {

    private MutableClock clock;
    private ConnectionRegistry registry;
    private WebSocketHandler handler;
    private RecordingFrameSink aliceSink;
    private ConnectionHandle alice;

    @BeforeEach
    void setUp() {
        SocketConfig config = SocketConfig.defaults("node-a");
        MetricsService metrics = TestSupport.metrics(config);
        clock = new MutableClock(TestSupport.START);
        registry = TestSupport.registry(config, metrics, clock);
        BroadcastCoordinator coordinator = TestSupport.coordinator(config,
            TestSupport.context(config, registry, MuteListLookup.NONE, new RecordingEventBus(), metrics, clock));
        InboundMessageHandlerFactory inboundFactory = new InboundMessageHandlerFactory(
            coordinator, registry, GameCommandProcessor.unavailable(), metrics);
        handler = new WebSocketHandler(config, registry, new ConnectionHandleFactory(config, clock),
            inboundFactory, metrics);

        aliceSink = new RecordingFrameSink();
        alice = new ConnectionHandle("c-alice", "alice", TransportType.WEBSOCKET, TestSupport.START, aliceSink);
        registry.register(alice);
    }

    @Test
    void testPong_RefreshesLivenessWithoutReply() {
        clock.advance(Duration.ofSeconds(30));

        handler.handleInboundFrames(Flux.just(new PongWebSocketFrame()), alice).block();

        assertTrue(aliceSink.written().isEmpty());
        assertEquals(TestSupport.START.plusSeconds(30), alice.getLastSeen());
    }

    @Test
    void testTextFrames_AreDispatchedAndControlFramesIgnored() {
        Flux<WebSocketFrame> frames = Flux.just(
            new PongWebSocketFrame(),
            new TextWebSocketFrame("{\"type\":\"ping\",\"data\":{}}"),
            new CloseWebSocketFrame()
        );

        handler.handleInboundFrames(frames, alice).block();

        assertEquals(1, aliceSink.writtenJson().size());
        assertEquals("pong", aliceSink.writtenJson().get(0).get("event_type"));
    }
}
