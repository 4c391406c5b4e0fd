package com.mythosmud.core.msg;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Error frame sent back to the client whose inbound frame could not be handled.
 * <p>
 * Wire shape: {@code {type:"error", error_type, message, user_friendly, details}}.
 * Distribution-side failures never produce one of these; they only reach logs and metrics.
 * </p>
 */
@Value
public class ErrorResponse {

    @JsonProperty("type")
    String type;

    @JsonProperty("error_type")
    ErrorType errorType;

    @JsonProperty("message")
    String message;

    @JsonProperty("user_friendly")
    String userFriendly;

    @JsonProperty("details")
    Map<String, Object> details;

    @JsonCreator
    public ErrorResponse(
        @JsonProperty("type") String type,
        @JsonProperty("error_type") ErrorType errorType,
        @JsonProperty("message") String message,
        @JsonProperty("user_friendly") String userFriendly,
        @JsonProperty("details") Map<String, Object> details
    ) {
        this.type = type;
        this.errorType = errorType;
        this.message = message;
        this.userFriendly = userFriendly;
        this.details = details == null
            ? Collections.emptyMap()
            : Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    public static ErrorResponse of(ErrorType errorType, String message, Map<String, Object> details) {
        return new ErrorResponse("error", errorType, message, errorType.getUserFriendly(), details);
    }
}
