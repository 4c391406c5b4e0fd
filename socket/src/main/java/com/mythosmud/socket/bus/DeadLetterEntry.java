package com.mythosmud.socket.bus;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.mythosmud.core.msg.RelayMessage;
import lombok.Value;

import java.time.Instant;

/**
 * A publish that exhausted its attempts. Kept for inspection, never redelivered automatically.
 */
@Value
public class DeadLetterEntry {

    @JsonProperty("id")
    String id;

    @JsonProperty("subject")
    String subject;

    @JsonProperty("message")
    RelayMessage message;

    @JsonProperty("attempt_count")
    int attemptCount;

    @JsonProperty("last_error")
    String lastError;

    @JsonProperty("first_failed_at")
    Instant firstFailedAt;

    @JsonProperty("dead_lettered_at")
    Instant deadLetteredAt;

    @JsonCreator
    public DeadLetterEntry(
        @JsonProperty("id") String id,
        @JsonProperty("subject") String subject,
        @JsonProperty("message") RelayMessage message,
        @JsonProperty("attempt_count") int attemptCount,
        @JsonProperty("last_error") String lastError,
        @JsonProperty("first_failed_at") Instant firstFailedAt,
        @JsonProperty("dead_lettered_at") Instant deadLetteredAt
    ) {
        this.id = id;
        this.subject = subject;
        this.message = message;
        this.attemptCount = attemptCount;
        this.lastError = lastError;
        this.firstFailedAt = firstFailedAt;
        this.deadLetteredAt = deadLetteredAt;
    }
}
