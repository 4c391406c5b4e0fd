package com.mythosmud.socket.broadcast;

import com.mythosmud.core.metrics.MetricsNames;
import com.mythosmud.core.msg.BroadcastRoute;
import com.mythosmud.core.msg.Envelope;
import com.mythosmud.core.msg.RelayMessage;
import com.mythosmud.core.util.SequenceGenerator;
import com.mythosmud.socket.bus.DistributedEventBus;
import com.mythosmud.socket.bus.InMemoryDeadLetterStore;
import com.mythosmud.socket.bus.LocalMessageBroker;
import com.mythosmud.socket.bus.RecordingEventBus;
import com.mythosmud.socket.config.SocketConfig;
import com.mythosmud.socket.connection.ConnectionRegistry;
import com.mythosmud.socket.metrics.MetricsService;
import com.mythosmud.socket.mute.MuteListLookup;
import com.mythosmud.socket.payload.PayloadOptimizer;
import com.mythosmud.socket.payload.PayloadTooLargeException;
import com.mythosmud.socket.support.RecordingFrameSink;
import com.mythosmud.socket.support.TestSupport;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.scheduler.Schedulers;
import reactor.test.StepVerifier;
import reactor.test.scheduler.VirtualTimeScheduler;

import java.time.Clock;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BroadcastCoordinatorTest {

    private static final String ROOM = "earth_arkhamcity_northside_intersection_derby_high";

    private final Clock clock = Clock.fixed(TestSupport.START, ZoneOffset.UTC);
    private VirtualTimeScheduler retryScheduler;

    @BeforeEach
    void setUp() {
        retryScheduler = VirtualTimeScheduler.create();
    }

    @AfterEach
    void tearDown() {
        retryScheduler.dispose();
    }

    @Test
    void testRoomChat_ReachesOccupantsOnOtherNode() {
        LocalMessageBroker broker = new LocalMessageBroker();
        Node nodeA = new Node("node-a", broker);
        Node nodeB = new Node("node-b", broker);
        RecordingFrameSink alice = nodeA.join("alice", ROOM);
        RecordingFrameSink bob = nodeB.join("bob", ROOM);
        RecordingFrameSink carol = nodeB.join("carol", "earth_innsmouth_docks_pier");
        nodeA.start();
        nodeB.start();

        Envelope envelope = nodeA.coordinator.newEnvelope("chat", Map.of("message", "hi"), "alice", "say");
        BroadcastResult result = nodeA.coordinator.publish(envelope, BroadcastRoute.toRoom(ROOM, "alice")).block();

        assertEquals(BroadcastResult.Status.DELIVERED, result.getStatus());
        assertEquals(0, result.getDelivered());
        assertTrue(result.isPublished());
        assertTrue(alice.written().isEmpty());
        assertEquals(1, bob.written().size());
        assertEquals("chat", bob.writtenJson().get(0).get("event_type"));
        assertTrue(carol.written().isEmpty());
        assertEquals(1, TestSupport.count(nodeB.metrics, MetricsNames.DELIVER_TOTAL, "type", "remote"));
    }

    @Test
    void testGlobalChat_ReachesEveryNodeOnce() {
        LocalMessageBroker broker = new LocalMessageBroker();
        Node nodeA = new Node("node-a", broker);
        Node nodeB = new Node("node-b", broker);
        RecordingFrameSink alice = nodeA.join("alice", null);
        RecordingFrameSink ann = nodeA.join("ann", null);
        RecordingFrameSink bob = nodeB.join("bob", null);
        nodeA.start();
        nodeB.start();

        Envelope envelope = nodeA.coordinator.newEnvelope("chat", Map.of("message", "hi"), "alice", "global");
        nodeA.coordinator.publish(envelope, BroadcastRoute.fromSender("alice")).block();

        assertTrue(alice.written().isEmpty());
        assertEquals(1, ann.written().size());
        assertEquals(1, bob.written().size());
    }

    @Test
    void testDeliverRemote_OwnMessagesIgnored() {
        Node node = new Node("node-a", new LocalMessageBroker());
        RecordingFrameSink bob = node.join("bob", null);
        RelayMessage own = RelayMessage.builder()
            .subject("global")
            .originNodeId("node-a")
            .channel("global")
            .envelope(node.coordinator.newEnvelope("chat", Map.of(), "alice", "global"))
            .build();

        StepVerifier.create(node.coordinator.deliverRemote(own)).verifyComplete();

        assertTrue(bob.written().isEmpty());
    }

    @Test
    void testPublish_OversizedPayloadErrorsBeforeRouting() {
        SocketConfig config = SocketConfig.defaults("node-a");
        MetricsService metrics = TestSupport.metrics(config);
        ConnectionRegistry registry = TestSupport.registry(config, metrics, clock);
        RecordingEventBus bus = new RecordingEventBus();
        BroadcastCoordinator coordinator = new BroadcastCoordinator(
            new ChannelBroadcastingStrategyFactory(),
            TestSupport.context(config, registry, MuteListLookup.NONE, bus, metrics, clock),
            new PayloadOptimizer(10, 20, 30),
            new SequenceGenerator()
        );
        Envelope envelope = coordinator.newEnvelope("chat", Map.of("message", "x".repeat(500) + "yz".repeat(300)),
            "alice", "global");

        StepVerifier.create(coordinator.publish(envelope, BroadcastRoute.fromSender("alice")))
            .expectError(PayloadTooLargeException.class)
            .verify();

        assertTrue(bus.published().isEmpty());
        assertEquals(1, metrics.getRegistry().find(MetricsNames.PAYLOAD_REJECTED_TOTAL).counter().count());
    }

    @Test
    void testPublish_UnknownChannelDropped() {
        Node node = new Node("node-a", new LocalMessageBroker());
        Envelope envelope = node.coordinator.newEnvelope("chat", Map.of(), "alice", "shout");

        BroadcastResult result = node.coordinator.publish(envelope, BroadcastRoute.fromSender("alice")).block();

        assertEquals(BroadcastResult.Status.DROPPED, result.getStatus());
    }

    @Test
    void testNewEnvelope_SequenceIncreasesPerSender() {
        Node node = new Node("node-a", new LocalMessageBroker());

        Envelope first = node.coordinator.newEnvelope("chat", Map.of(), "alice", "say");
        Envelope second = node.coordinator.newEnvelope("chat", Map.of(), "alice", "say");
        Envelope other = node.coordinator.newEnvelope("chat", Map.of(), "bob", "say");

        assertEquals(1, first.getSequenceNumber());
        assertEquals(2, second.getSequenceNumber());
        assertEquals(1, other.getSequenceNumber());
        assertEquals(TestSupport.START, first.getTimestamp());
    }

    @Test
    void testPublishState_SendsFullThenDeltaThenNothing() {
        Node node = new Node("node-a", new LocalMessageBroker());
        RecordingFrameSink alice = node.join("alice", null);

        assertTrue(node.coordinator.publishState("alice", "vitals", Map.of("hp", 10, "sanity", 50)).block());
        assertTrue(node.coordinator.publishState("alice", "vitals", Map.of("hp", 8, "sanity", 50)).block());
        assertFalse(node.coordinator.publishState("alice", "vitals", Map.of("hp", 8, "sanity", 50)).block());

        List<Map<String, Object>> frames = alice.writtenJson();
        assertEquals(2, frames.size());
        assertEquals("state_update", frames.get(0).get("event_type"));
        assertEquals("alice", frames.get(0).get("player_id"));
        Map<?, ?> full = (Map<?, ?>) ((Map<?, ?>) frames.get(0).get("data")).get("state");
        assertEquals(10, full.get("hp"));
        Map<?, ?> delta = (Map<?, ?>) ((Map<?, ?>) frames.get(1).get("data")).get("state");
        assertEquals(true, delta.get("incremental"));
        assertEquals(Map.of("hp", 8), delta.get("changes"));
    }

    @Test
    void testPublishState_OfflinePlayerForgetsSnapshots() {
        Node node = new Node("node-a", new LocalMessageBroker());
        node.start();
        node.join("alice", null);
        node.coordinator.publishState("alice", "vitals", Map.of("hp", 10)).block();

        node.registry.unregister(node.registry.handlesOf("alice").get(0));
        RecordingFrameSink again = node.join("alice", null);
        node.coordinator.publishState("alice", "vitals", Map.of("hp", 10)).block();

        Map<?, ?> state = (Map<?, ?>) ((Map<?, ?>) again.writtenJson().get(0).get("data")).get("state");
        assertEquals(Map.of("hp", 10), state);
    }

    @Test
    void testStart_FollowsRoomOccupancy() {
        Node node = new Node("node-a", new LocalMessageBroker());
        node.start();
        node.join("alice", ROOM);

        assertTrue(node.coordinator.getRoomSubscriptions().activeSubjects().contains("room.arkhamcity.northside"));

        node.registry.moveToRoom("alice", null);

        assertTrue(node.coordinator.getRoomSubscriptions().activeSubjects().isEmpty());
    }

    /**
     * One socket node wired over a shared in-process broker.
     */
    private final class Node {
        final MetricsService metrics;
        final ConnectionRegistry registry;
        final BroadcastCoordinator coordinator;

        Node(String nodeId, LocalMessageBroker broker) {
            SocketConfig config = SocketConfig.defaults(nodeId);
            metrics = TestSupport.metrics(config);
            registry = TestSupport.registry(config, metrics, clock);
            DistributedEventBus bus = new DistributedEventBus(config, broker, new InMemoryDeadLetterStore(10), metrics,
                retryScheduler, Schedulers.immediate(), clock);
            coordinator = TestSupport.coordinator(config,
                TestSupport.context(config, registry, MuteListLookup.NONE, bus, metrics, clock));
        }

        void start() {
            coordinator.start().block();
        }

        RecordingFrameSink join(String playerId, String roomId) {
            RecordingFrameSink sink = TestSupport.connect(registry, playerId);
            if (roomId != null) {
                registry.moveToRoom(playerId, roomId);
            }
            return sink;
        }
    }
}
