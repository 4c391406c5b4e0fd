package com.mythosmud.socket.connection;

import lombok.AccessLevel;
import lombok.Getter;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One live transport connection owned by a player.
 * <p>
 * Writes are serialized per handle, since the underlying sink rejects concurrent emitters.
 * Once {@link #invalidate()} runs every later write reports {@link WriteOutcome#CLOSED} and the
 * transport's close actions have run.
 * </p>
 */
@Getter
public class ConnectionHandle {
    private final String connectionId;
    private final String playerId;
    private final TransportType transport;
    private final Instant createdAt;
    private volatile Instant lastSeen;

    @Getter(AccessLevel.NONE)
    private final FrameSink sink;
    @Getter(AccessLevel.NONE)
    private final AtomicBoolean open = new AtomicBoolean(true);
    @Getter(AccessLevel.NONE)
    private final List<Runnable> closeActions = new CopyOnWriteArrayList<>();
    @Getter(AccessLevel.NONE)
    private final AtomicBoolean invalidated = new AtomicBoolean(false);

    public ConnectionHandle(String connectionId, String playerId, TransportType transport,
                            Instant createdAt, FrameSink sink) {
        this.connectionId = connectionId;
        this.playerId = playerId;
        this.transport = transport;
        this.createdAt = createdAt;
        this.lastSeen = createdAt;
        this.sink = sink;
    }

    public synchronized WriteOutcome write(String frame) {
        if (!open.get()) {
            return WriteOutcome.CLOSED;
        }
        Sinks.EmitResult result = sink.tryEmit(frame);
        if (result.isSuccess()) {
            return WriteOutcome.WRITTEN;
        }
        if (result == Sinks.EmitResult.FAIL_TERMINATED || result == Sinks.EmitResult.FAIL_CANCELLED) {
            open.set(false);
            return WriteOutcome.CLOSED;
        }
        return WriteOutcome.BACKPRESSURE_DROPPED;
    }

    public Flux<String> outbound() {
        return sink.frames();
    }

    public void touch(Instant now) {
        this.lastSeen = now;
    }

    public boolean isOpen() {
        return open.get();
    }

    /**
     * Registers an action that closes the underlying transport. Runs once, on
     * {@link #invalidate()}, or right away if the handle is already invalidated.
     */
    public void onInvalidate(Runnable action) {
        closeActions.add(action);
        if (invalidated.get()) {
            runCloseActions();
        }
    }

    /**
     * Marks the handle closed, completes its outbound stream and closes the transport. Idempotent.
     */
    public void invalidate() {
        open.set(false);
        if (invalidated.compareAndSet(false, true)) {
            synchronized (this) {
                sink.complete();
            }
        }
        runCloseActions();
    }

    private void runCloseActions() {
        for (Runnable action : closeActions) {
            if (closeActions.remove(action)) {
                action.run();
            }
        }
    }

    @Override
    public String toString() {
        return "ConnectionHandle{" + connectionId + ", player=" + playerId + ", " + transport + "}";
    }
}
