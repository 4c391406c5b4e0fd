package com.mythosmud.socket.connection;

public enum WriteOutcome {
    WRITTEN,
    /**
     * The handle's buffer was full; this frame was dropped, the handle stays usable.
     */
    BACKPRESSURE_DROPPED,
    /**
     * The handle is closed; the caller should remove it.
     */
    CLOSED
}
