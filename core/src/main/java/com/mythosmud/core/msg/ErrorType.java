package com.mythosmud.core.msg;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Error categories reported to clients in {@link ErrorResponse} frames.
 */
public enum ErrorType {
    INVALID_COMMAND("invalid_command", "Invalid command"),
    INVALID_FORMAT("invalid_format", "Invalid message format"),
    MESSAGE_PROCESSING_ERROR("message_processing_error", "Error processing message"),
    PAYLOAD_TOO_LARGE("payload_too_large", "Message is too large to deliver");

    private final String wireName;
    private final String userFriendly;

    ErrorType(String wireName, String userFriendly) {
        this.wireName = wireName;
        this.userFriendly = userFriendly;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    public String getUserFriendly() {
        return userFriendly;
    }
}
