package com.mythosmud.socket.connection;

/**
 * Notified by the registry when room occupancy or player presence changes.
 * <p>
 * Callbacks run on the thread that caused the change, after the registry state is updated,
 * and may arrive out of order across threads; listeners re-read the registry.
 * </p>
 */
public interface OccupancyListener {

    default void onRoomOccupied(String roomId) {
    }

    default void onRoomVacated(String roomId) {
    }

    default void onPlayerOffline(String playerId) {
    }
}
