package com.mythosmud.socket.connection;

import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.mythosmud.core.metrics.MetricsNames;
import com.mythosmud.core.msg.Envelope;
import com.mythosmud.core.util.BytesUtils;
import com.mythosmud.core.util.JsonUtils;
import com.mythosmud.socket.metrics.MetricsService;
import com.mythosmud.socket.payload.OptimizedPayload;
import com.mythosmud.socket.payload.PayloadOptimizer;
import com.mythosmud.socket.payload.PayloadTooLargeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Tracks live connections per player and which room each connected player is in.
 * <p>
 * <b>Concurrency:</b> per-player state is an immutable {@link PlayerEntry} swapped inside
 * {@link ConcurrentHashMap#compute}. Room membership is updated inside the same compute so a
 * player's handles and room never disagree. Frame writes and listener callbacks happen after
 * the compute returns.
 * </p>
 * <p>
 * <b>Failure handling:</b> a write that finds its handle closed removes only that handle.
 * A full buffer drops the frame for that handle and keeps the handle.
 * </p>
 */
public class ConnectionRegistry implements IConnectionRegistry {
    private static final Logger log = LoggerFactory.getLogger(ConnectionRegistry.class);

    private final PayloadOptimizer payloadOptimizer;
    private final MetricsService metricsService;
    private final Clock clock;

    private final Map<String, PlayerEntry> players = new ConcurrentHashMap<>();
    private final Map<String, Set<String>> rooms = new ConcurrentHashMap<>();
    private final List<OccupancyListener> listeners = new CopyOnWriteArrayList<>();

    public ConnectionRegistry(PayloadOptimizer payloadOptimizer, MetricsService metricsService, Clock clock) {
        this.payloadOptimizer = payloadOptimizer;
        this.metricsService = metricsService;
        this.clock = clock;
        metricsService.registerGauge(MetricsNames.ACTIVE_CONNECTIONS, "Live transport handles",
            this::activeConnectionCount);
    }

    private record PlayerEntry(List<ConnectionHandle> handles, @Nullable String roomId) {
        PlayerEntry withHandles(List<ConnectionHandle> newHandles) {
            return new PlayerEntry(newHandles, roomId);
        }

        PlayerEntry withRoom(@Nullable String newRoomId) {
            return new PlayerEntry(handles, newRoomId);
        }
    }

    /**
     * Room transitions observed inside a compute block, fired once it returns.
     */
    private static final class Transitions {
        final List<String> occupied = new ArrayList<>(1);
        final List<String> vacated = new ArrayList<>(1);
        final List<ConnectionHandle> closed = new ArrayList<>(1);
        boolean wentOffline;
    }

    @Override
    public void register(ConnectionHandle handle) {
        Preconditions.checkArgument(handle.isOpen(), "Cannot register closed connection %s", handle);
        Transitions transitions = new Transitions();
        players.compute(handle.getPlayerId(), (playerId, entry) -> {
            if (entry == null) {
                return new PlayerEntry(ImmutableList.of(handle), null);
            }
            ImmutableList.Builder<ConnectionHandle> handles = ImmutableList.builder();
            for (ConnectionHandle existing : entry.handles()) {
                if (existing == handle) {
                    continue;
                }
                if (existing.getTransport() == handle.getTransport()) {
                    transitions.closed.add(existing);
                } else {
                    handles.add(existing);
                }
            }
            handles.add(handle);
            return entry.withHandles(handles.build());
        });

        for (ConnectionHandle replaced : transitions.closed) {
            log.info("Replacing {} connection {} of player {} with {}",
                replaced.getTransport(), replaced.getConnectionId(), replaced.getPlayerId(), handle.getConnectionId());
            replaced.invalidate();
        }
        log.debug("Registered {}", handle);
    }

    @Override
    public void unregister(ConnectionHandle handle) {
        Transitions transitions = new Transitions();
        players.computeIfPresent(handle.getPlayerId(), (playerId, entry) -> {
            if (!entry.handles().contains(handle)) {
                return entry;
            }
            List<ConnectionHandle> remaining = entry.handles().stream()
                .filter(existing -> existing != handle)
                .collect(ImmutableList.toImmutableList());
            if (!remaining.isEmpty()) {
                return entry.withHandles(remaining);
            }
            if (entry.roomId() != null) {
                leaveRoom(playerId, entry.roomId(), transitions);
            }
            transitions.wentOffline = true;
            return null;
        });

        handle.invalidate();
        log.debug("Unregistered {}", handle);
        fire(transitions, handle.getPlayerId());
    }

    @Override
    public boolean sendLocal(String playerId, Envelope envelope) {
        List<ConnectionHandle> handles = handlesOf(playerId);
        if (handles.isEmpty()) {
            log.debug("No local connection for player {}", playerId);
            return false;
        }
        String frame = encode(envelope);
        if (frame == null) {
            return false;
        }
        return writeToPlayer(handles, frame);
    }

    @Override
    public DeliveryReport deliverTo(Collection<String> playerIds, Envelope envelope) {
        if (playerIds.isEmpty()) {
            return DeliveryReport.EMPTY;
        }
        String frame = encode(envelope);
        if (frame == null) {
            return new DeliveryReport(playerIds.size(), 0, playerIds.size());
        }

        int delivered = 0;
        int failed = 0;
        for (String playerId : playerIds) {
            if (writeToPlayer(handlesOf(playerId), frame)) {
                delivered++;
            } else {
                failed++;
            }
        }
        return new DeliveryReport(playerIds.size(), delivered, failed);
    }

    @Override
    public DeliveryReport broadcastLocal(Envelope envelope, @Nullable String excludePlayerId) {
        Set<String> recipients = new HashSet<>(players.keySet());
        if (excludePlayerId != null) {
            recipients.remove(excludePlayerId);
        }
        return deliverTo(recipients, envelope);
    }

    @Override
    public Set<String> roomOccupants(String roomId) {
        if (Strings.isNullOrEmpty(roomId)) {
            return Collections.emptySet();
        }
        Set<String> occupants = rooms.get(roomId);
        return occupants == null ? Collections.emptySet() : Set.copyOf(occupants);
    }

    @Override
    public Set<String> occupiedRooms() {
        return Set.copyOf(rooms.keySet());
    }

    @Override
    public boolean moveToRoom(String playerId, @Nullable String roomId) {
        String target = Strings.emptyToNull(roomId);
        Transitions transitions = new Transitions();
        PlayerEntry updated = players.computeIfPresent(playerId, (id, entry) -> {
            String previous = entry.roomId();
            if (Objects.equals(previous, target)) {
                return entry;
            }
            if (previous != null) {
                leaveRoom(id, previous, transitions);
            }
            if (target != null) {
                enterRoom(id, target, transitions);
            }
            return entry.withRoom(target);
        });

        if (updated == null) {
            log.debug("Ignoring room move for player {} without a local connection", playerId);
            return false;
        }
        fire(transitions, playerId);
        return true;
    }

    @Override
    public Optional<String> currentRoom(String playerId) {
        PlayerEntry entry = players.get(playerId);
        return entry == null ? Optional.empty() : Optional.ofNullable(entry.roomId());
    }

    @Override
    public List<ConnectionHandle> handlesOf(String playerId) {
        if (playerId == null) {
            return Collections.emptyList();
        }
        PlayerEntry entry = players.get(playerId);
        return entry == null ? Collections.emptyList() : entry.handles();
    }

    @Override
    public Optional<ConnectionHandle> findHandle(String playerId, TransportType transport) {
        return handlesOf(playerId).stream()
            .filter(handle -> handle.getTransport() == transport)
            .findFirst();
    }

    @Override
    public void touch(ConnectionHandle handle) {
        handle.touch(clock.instant());
    }

    @Override
    public int pruneStale(Duration maxIdle) {
        Instant cutoff = clock.instant().minus(maxIdle);
        List<ConnectionHandle> stale = new ArrayList<>();
        for (PlayerEntry entry : players.values()) {
            for (ConnectionHandle handle : entry.handles()) {
                if (handle.getLastSeen().isBefore(cutoff)) {
                    stale.add(handle);
                }
            }
        }
        for (ConnectionHandle handle : stale) {
            log.info("Pruning stale connection {} of player {} (last seen {})",
                handle.getConnectionId(), handle.getPlayerId(), handle.getLastSeen());
            unregister(handle);
        }
        return stale.size();
    }

    @Override
    public int activeConnectionCount() {
        int count = 0;
        for (PlayerEntry entry : players.values()) {
            count += entry.handles().size();
        }
        return count;
    }

    @Override
    public Set<String> onlinePlayers() {
        return Set.copyOf(players.keySet());
    }

    @Override
    public void addOccupancyListener(OccupancyListener listener) {
        listeners.add(listener);
    }

    @Override
    public void closeAll() {
        List<ConnectionHandle> all = new ArrayList<>();
        players.values().forEach(entry -> all.addAll(entry.handles()));
        log.info("Closing {} connections", all.size());
        all.forEach(this::unregister);
    }

    private boolean writeToPlayer(List<ConnectionHandle> handles, String frame) {
        boolean delivered = false;
        for (ConnectionHandle handle : handles) {
            switch (handle.write(frame)) {
                case WRITTEN -> {
                    delivered = true;
                    metricsService.recordNetworkOutboundClient(BytesUtils.getBytesLength(frame));
                }
                case BACKPRESSURE_DROPPED -> {
                    log.warn("Outbound buffer full for {}, dropping frame", handle);
                    metricsService.recordDrop("buffer_full");
                }
                case CLOSED -> {
                    log.debug("Write to closed {}, removing it", handle);
                    metricsService.recordDrop("connection_closed");
                    unregister(handle);
                }
            }
        }
        return delivered;
    }

    @Nullable
    private String encode(Envelope envelope) {
        try {
            OptimizedPayload optimized = payloadOptimizer.optimize(envelope);
            if (optimized.isCompressed()) {
                metricsService.recordPayloadCompressed();
            }
            return JsonUtils.writeValueAsString(optimized.toWire());
        } catch (PayloadTooLargeException e) {
            log.warn("Dropping {} envelope: {}", envelope.getEventType(), e.getMessage());
            metricsService.recordPayloadRejected();
            metricsService.recordDrop("payload_too_large");
            return null;
        }
    }

    private void enterRoom(String playerId, String roomId, Transitions transitions) {
        rooms.compute(roomId, (id, occupants) -> {
            Set<String> set = occupants;
            if (set == null) {
                set = ConcurrentHashMap.newKeySet();
                transitions.occupied.add(id);
            }
            set.add(playerId);
            return set;
        });
    }

    private void leaveRoom(String playerId, String roomId, Transitions transitions) {
        rooms.computeIfPresent(roomId, (id, occupants) -> {
            occupants.remove(playerId);
            if (occupants.isEmpty()) {
                transitions.vacated.add(id);
                return null;
            }
            return occupants;
        });
    }

    private void fire(Transitions transitions, String playerId) {
        if (listeners.isEmpty()) {
            return;
        }
        for (OccupancyListener listener : listeners) {
            try {
                transitions.vacated.forEach(listener::onRoomVacated);
                transitions.occupied.forEach(listener::onRoomOccupied);
                if (transitions.wentOffline) {
                    listener.onPlayerOffline(playerId);
                }
            } catch (RuntimeException e) {
                log.warn("Occupancy listener {} failed: {}", listener, e.getMessage(), e);
            }
        }
    }
}
