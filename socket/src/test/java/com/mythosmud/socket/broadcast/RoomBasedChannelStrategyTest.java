package com.mythosmud.socket.broadcast;

import com.mythosmud.core.channel.ChannelType;
import com.mythosmud.core.metrics.MetricsNames;
import com.mythosmud.core.msg.BroadcastRoute;
import com.mythosmud.core.msg.Envelope;
import com.mythosmud.socket.bus.RecordingEventBus;
import com.mythosmud.socket.config.SocketConfig;
import com.mythosmud.socket.connection.ConnectionRegistry;
import com.mythosmud.socket.metrics.MetricsService;
import com.mythosmud.socket.mute.InMemoryMuteListLookup;
import com.mythosmud.socket.support.RecordingFrameSink;
import com.mythosmud.socket.support.TestSupport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.ZoneOffset;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RoomBasedChannelStrategyTest {

    private static final String ROOM = "earth_arkhamcity_northside_intersection_derby_high";

    private MetricsService metrics;
    private ConnectionRegistry registry;
    private InMemoryMuteListLookup mutes;
    private RecordingEventBus bus;
    private BroadcastContext context;
    private final RoomBasedChannelStrategy strategy = new RoomBasedChannelStrategy(ChannelType.SAY);

    @BeforeEach
    void setUp() {
        SocketConfig config = SocketConfig.defaults("node-a");
        Clock clock = Clock.fixed(TestSupport.START, ZoneOffset.UTC);
        metrics = TestSupport.metrics(config);
        registry = TestSupport.registry(config, metrics, clock);
        mutes = new InMemoryMuteListLookup();
        bus = new RecordingEventBus();
        context = TestSupport.context(config, registry, mutes, bus, metrics, clock);
    }

    @Test
    void testBlankRoom_SkippedWithoutSideEffects() {
        RecordingFrameSink bob = TestSupport.connect(registry, "bob");
        registry.moveToRoom("bob", ROOM);

        BroadcastResult result = strategy.broadcast(envelope(), BroadcastRoute.toRoom("  ", "alice"), context).block();

        assertEquals(BroadcastResult.Status.SKIPPED, result.getStatus());
        assertTrue(bob.written().isEmpty());
        assertTrue(bus.published().isEmpty());
    }

    @Test
    void testDeliversToRoomExceptSenderAndPublishesOnSubZone() {
        RecordingFrameSink alice = join("alice");
        RecordingFrameSink bob = join("bob");
        RecordingFrameSink carol = join("carol");
        RecordingFrameSink dave = TestSupport.connect(registry, "dave");
        registry.moveToRoom("dave", "elsewhere");

        BroadcastResult result = strategy.broadcast(envelope(), BroadcastRoute.toRoom(ROOM, "alice"), context).block();

        assertEquals(BroadcastResult.Status.DELIVERED, result.getStatus());
        assertEquals(2, result.getDelivered());
        assertTrue(result.isPublished());
        assertTrue(alice.written().isEmpty());
        assertEquals(1, bob.written().size());
        assertEquals(1, carol.written().size());
        assertTrue(dave.written().isEmpty());

        assertEquals(1, bus.published().size());
        RecordingEventBus.Published published = bus.published().get(0);
        assertEquals("room.arkhamcity.northside", published.subject());
        assertEquals("node-a", published.message().getOriginNodeId());
        assertEquals(ROOM, published.message().getRoute().getRoomId());
    }

    @Test
    void testMutedListenersAreSkipped() {
        join("alice");
        RecordingFrameSink bob = join("bob");
        RecordingFrameSink carol = join("carol");
        RecordingFrameSink erin = join("erin");
        mutes.mutePlayer("carol", "alice");
        mutes.muteChannel("erin", ChannelType.SAY);

        BroadcastResult result = strategy.broadcast(envelope(), BroadcastRoute.toRoom(ROOM, "alice"), context).block();

        assertEquals(1, result.getDelivered());
        assertEquals(1, bob.written().size());
        assertTrue(carol.written().isEmpty());
        assertTrue(erin.written().isEmpty());
        assertEquals(2, TestSupport.count(metrics, MetricsNames.DROPS_TOTAL, "reason", "muted"));
    }

    @Test
    void testChannelMuteOnlyAppliesToThatChannel() {
        join("alice");
        RecordingFrameSink bob = join("bob");
        mutes.muteChannel("bob", ChannelType.EMOTE);

        strategy.broadcast(envelope(), BroadcastRoute.toRoom(ROOM, "alice"), context).block();

        assertEquals(1, bob.written().size());
    }

    @Test
    void testDeliverRemote_DoesNotRepublish() {
        RecordingFrameSink bob = join("bob");

        BroadcastResult result = strategy.deliverRemote(envelope(), BroadcastRoute.toRoom(ROOM, "alice"), context).block();

        assertEquals(1, result.getDelivered());
        assertFalse(result.isPublished());
        assertEquals(1, bob.written().size());
        assertTrue(bus.published().isEmpty());
    }

    @Test
    void testNonRoomChannelRejected() {
        assertThrows(IllegalArgumentException.class, () -> new RoomBasedChannelStrategy(ChannelType.GLOBAL));
    }

    private RecordingFrameSink join(String playerId) {
        RecordingFrameSink sink = TestSupport.connect(registry, playerId);
        registry.moveToRoom(playerId, ROOM);
        return sink;
    }

    private static Envelope envelope() {
        return Envelope.builder()
            .eventType("chat")
            .timestamp(TestSupport.START)
            .sequenceNumber(1)
            .data(Map.of("message", "Ph'nglui mglw'nafh"))
            .senderId("alice")
            .channel("say")
            .build();
    }
}
