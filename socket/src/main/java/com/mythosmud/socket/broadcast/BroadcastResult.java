package com.mythosmud.socket.broadcast;

import com.mythosmud.socket.connection.DeliveryReport;
import lombok.Builder;
import lombok.Value;

/**
 * What a strategy did with one envelope.
 * <p>
 * A partial failure ({@code failed > 0}) is still {@link Status#DELIVERED}.
 * </p>
 */
@Value
@Builder(toBuilder = true)
public class BroadcastResult {

    public enum Status {
        DELIVERED,
        /**
         * Routing arguments were missing; nothing was delivered or published.
         */
        SKIPPED,
        NOT_IMPLEMENTED,
        DROPPED
    }

    String channelType;
    Status status;
    int recipients;
    int delivered;
    int failed;
    boolean published;

    public static BroadcastResult delivered(String channelType, DeliveryReport report, boolean published) {
        return BroadcastResult.builder()
            .channelType(channelType)
            .status(Status.DELIVERED)
            .recipients(report.getRecipients())
            .delivered(report.getDelivered())
            .failed(report.getFailed())
            .published(published)
            .build();
    }

    public static BroadcastResult of(String channelType, Status status) {
        return BroadcastResult.builder()
            .channelType(channelType)
            .status(status)
            .build();
    }
}
