package com.mythosmud.socket.inbound;

import com.mythosmud.core.msg.Envelope;
import com.mythosmud.core.msg.ErrorResponse;
import com.mythosmud.core.msg.ErrorType;
import com.mythosmud.core.util.JsonUtils;
import com.mythosmud.socket.broadcast.BroadcastCoordinator;
import com.mythosmud.socket.connection.ConnectionHandle;
import com.mythosmud.socket.connection.WriteOutcome;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * The connection an inbound frame arrived on, with helpers to answer on that same connection.
 */
@Getter
public class InboundContext {
    private static final Logger log = LoggerFactory.getLogger(InboundContext.class);

    private final ConnectionHandle connection;
    private final BroadcastCoordinator coordinator;

    public InboundContext(ConnectionHandle connection, BroadcastCoordinator coordinator) {
        this.connection = connection;
        this.coordinator = coordinator;
    }

    public String getPlayerId() {
        return connection.getPlayerId();
    }

    public WriteOutcome reply(String eventType, Map<String, Object> data) {
        Envelope envelope = coordinator.newEnvelope(eventType, data, null, null).toBuilder()
            .playerId(getPlayerId())
            .build();
        return write(JsonUtils.writeValueAsString(envelope));
    }

    public WriteOutcome replyError(ErrorType errorType, String message, Map<String, Object> details) {
        return write(JsonUtils.writeValueAsString(ErrorResponse.of(errorType, message, details)));
    }

    private WriteOutcome write(String frame) {
        WriteOutcome outcome = connection.write(frame);
        if (outcome != WriteOutcome.WRITTEN) {
            log.debug("Reply to {} not written: {}", connection, outcome);
        }
        return outcome;
    }
}
