package com.mythosmud.socket.connection;

import com.mythosmud.core.msg.Envelope;

import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Node-local directory of live connections and room occupancy.
 */
public interface IConnectionRegistry {

    /**
     * Adds a handle. A live handle of the same player and transport is replaced and closed.
     *
     * @throws IllegalArgumentException if the handle was already closed
     */
    void register(ConnectionHandle handle);

    /**
     * Removes exactly this handle and invalidates it. Unknown handles are ignored.
     */
    void unregister(ConnectionHandle handle);

    /**
     * Writes the envelope to every live handle of the player.
     *
     * @return true if at least one handle accepted the frame
     */
    boolean sendLocal(String playerId, Envelope envelope);

    /**
     * Writes the envelope to the given players, encoding it once.
     */
    DeliveryReport deliverTo(Collection<String> playerIds, Envelope envelope);

    /**
     * Writes the envelope to every connected player except {@code excludePlayerId}.
     */
    DeliveryReport broadcastLocal(Envelope envelope, String excludePlayerId);

    Set<String> roomOccupants(String roomId);

    Set<String> occupiedRooms();

    /**
     * Records the player's room; {@code null} leaves the current room.
     *
     * @return false when the player has no live connection on this node
     */
    boolean moveToRoom(String playerId, String roomId);

    Optional<String> currentRoom(String playerId);

    List<ConnectionHandle> handlesOf(String playerId);

    Optional<ConnectionHandle> findHandle(String playerId, TransportType transport);

    void touch(ConnectionHandle handle);

    /**
     * Unregisters handles idle for longer than {@code maxIdle}.
     *
     * @return number of handles removed
     */
    int pruneStale(Duration maxIdle);

    int activeConnectionCount();

    Set<String> onlinePlayers();

    void addOccupancyListener(OccupancyListener listener);

    void closeAll();
}
