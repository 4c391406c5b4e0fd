package com.mythosmud.socket.connection;

import lombok.Value;

/**
 * Outcome of a multi-recipient local delivery.
 * <p>
 * {@code recipients} counts players targeted, {@code delivered} players that got at least one
 * frame, {@code failed} players none of whose handles accepted the frame.
 * </p>
 */
@Value
public class DeliveryReport {
    public static final DeliveryReport EMPTY = new DeliveryReport(0, 0, 0);

    int recipients;
    int delivered;
    int failed;
}
