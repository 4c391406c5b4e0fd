package com.mythosmud.socket.bus;

import com.mythosmud.core.msg.RelayMessage;
import lombok.Getter;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * One message on its way to the broker, with its attempt history.
 * <p>
 * {@code PENDING -> RETRYING -> DELIVERED | DEAD_LETTERED}; both end states are final.
 * </p>
 */
@Getter
class PublishTask {

    enum DeliveryState {
        PENDING,
        RETRYING,
        DELIVERED,
        DEAD_LETTERED
    }

    private final String id;
    private final String subject;
    private final RelayMessage message;
    private final String payload;

    private final AtomicInteger attempts = new AtomicInteger();
    private final AtomicReference<DeliveryState> state = new AtomicReference<>(DeliveryState.PENDING);
    private volatile Instant firstFailedAt;
    private volatile String lastError;

    PublishTask(String id, String subject, RelayMessage message, String payload) {
        this.id = id;
        this.subject = subject;
        this.message = message;
        this.payload = payload;
    }

    int beginAttempt() {
        return attempts.incrementAndGet();
    }

    int attemptCount() {
        return attempts.get();
    }

    DeliveryState currentState() {
        return state.get();
    }

    void recordFailure(Instant at, Throwable error) {
        if (firstFailedAt == null) {
            firstFailedAt = at;
        }
        lastError = error.getClass().getSimpleName() + ": " + error.getMessage();
        state.compareAndSet(DeliveryState.PENDING, DeliveryState.RETRYING);
    }

    /**
     * @return true if this call moved the task into {@code target}
     */
    boolean finish(DeliveryState target) {
        DeliveryState current = state.get();
        while (current != DeliveryState.DELIVERED && current != DeliveryState.DEAD_LETTERED) {
            if (state.compareAndSet(current, target)) {
                return true;
            }
            current = state.get();
        }
        return false;
    }
}
