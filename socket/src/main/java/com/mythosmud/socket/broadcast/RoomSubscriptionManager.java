package com.mythosmud.socket.broadcast;

import com.mythosmud.core.msg.RelayMessage;
import com.mythosmud.core.msg.Subjects;
import com.mythosmud.socket.bus.BusSubscription;
import com.mythosmud.socket.bus.IEventBus;
import com.mythosmud.socket.connection.IConnectionRegistry;
import com.mythosmud.socket.connection.OccupancyListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Keeps one bus subscription per room subject while any room mapped to that subject has
 * local occupants.
 * <p>
 * Occupancy events can arrive out of order across threads, so each event is checked against
 * the registry's current state before the reference count changes.
 * </p>
 */
public class RoomSubscriptionManager implements OccupancyListener {
    private static final Logger log = LoggerFactory.getLogger(RoomSubscriptionManager.class);

    private final IConnectionRegistry registry;
    private final IEventBus bus;
    private final Consumer<RelayMessage> onMessage;

    private final Map<String, SubjectEntry> subjects = new HashMap<>();
    private boolean running;

    private static final class SubjectEntry {
        final Set<String> rooms = new HashSet<>();
        BusSubscription subscription;
    }

    public RoomSubscriptionManager(IConnectionRegistry registry, IEventBus bus, Consumer<RelayMessage> onMessage) {
        this.registry = registry;
        this.bus = bus;
        this.onMessage = onMessage;
    }

    public void start() {
        synchronized (this) {
            if (running) {
                return;
            }
            running = true;
        }
        registry.addOccupancyListener(this);
        registry.occupiedRooms().forEach(this::onRoomOccupied);
    }

    public synchronized void stop() {
        running = false;
        subjects.values().forEach(entry -> entry.subscription.dispose());
        subjects.clear();
    }

    @Override
    public synchronized void onRoomOccupied(String roomId) {
        if (!running || registry.roomOccupants(roomId).isEmpty()) {
            return;
        }
        String subject = Subjects.forRoom(roomId);
        SubjectEntry entry = subjects.computeIfAbsent(subject, s -> new SubjectEntry());
        if (entry.rooms.add(roomId) && entry.subscription == null) {
            entry.subscription = bus.subscribe(subject, onMessage);
            log.info("Subscribed to {} (first occupied room {})", subject, roomId);
        }
    }

    @Override
    public synchronized void onRoomVacated(String roomId) {
        if (!running || !registry.roomOccupants(roomId).isEmpty()) {
            return;
        }
        String subject = Subjects.forRoom(roomId);
        SubjectEntry entry = subjects.get(subject);
        if (entry == null || !entry.rooms.remove(roomId)) {
            return;
        }
        if (entry.rooms.isEmpty()) {
            entry.subscription.dispose();
            subjects.remove(subject);
            log.info("Unsubscribed from {} (last room {} vacated)", subject, roomId);
        }
    }

    public synchronized Set<String> activeSubjects() {
        return Set.copyOf(subjects.keySet());
    }

    public synchronized int roomCount(String subject) {
        SubjectEntry entry = subjects.get(subject);
        return entry == null ? 0 : entry.rooms.size();
    }
}
