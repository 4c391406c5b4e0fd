package com.mythosmud.socket.bus;

import com.mythosmud.core.msg.RelayMessage;
import com.mythosmud.core.msg.SubjectPattern;
import lombok.Getter;
import reactor.core.Disposable;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * A live subscription. Disposing it stops callbacks, including ones already queued.
 */
public class BusSubscription implements Disposable {
    @Getter
    private final String id;
    @Getter
    private final SubjectPattern pattern;
    private final Consumer<RelayMessage> callback;
    private final Consumer<BusSubscription> onDispose;
    private final AtomicBoolean active = new AtomicBoolean(true);

    BusSubscription(String id, SubjectPattern pattern, Consumer<RelayMessage> callback,
                    Consumer<BusSubscription> onDispose) {
        this.id = id;
        this.pattern = pattern;
        this.callback = callback;
        this.onDispose = onDispose;
    }

    boolean accepts(String subject) {
        return active.get() && pattern.matches(subject);
    }

    void deliver(RelayMessage message) {
        if (active.get()) {
            callback.accept(message);
        }
    }

    @Override
    public void dispose() {
        if (active.compareAndSet(true, false)) {
            onDispose.accept(this);
        }
    }

    @Override
    public boolean isDisposed() {
        return !active.get();
    }

    @Override
    public String toString() {
        return "BusSubscription{" + id + ", " + pattern + "}";
    }
}
