package com.mythosmud.core.metrics;

/**
 * Standard tag keys for Micrometer metrics.
 * <p>
 * Consistent tagging enables aggregation and filtering in Prometheus/Grafana.
 * </p>
 */
public final class MetricsTags {
    private MetricsTags() {
    }

    /**
     * Tag key for node identifier.
     */
    public static final String NODE_ID = "node_id";

    /**
     * Tag key for delivery type (local/remote).
     */
    public static final String TYPE = "type";

    /**
     * Tag key for failure/drop reason.
     */
    public static final String REASON = "reason";

    /**
     * Tag key for channel name.
     */
    public static final String CHANNEL = "channel";

    /**
     * Tag key for broadcast status.
     */
    public static final String STATUS = "status";

    /**
     * Tag key for bus publish outcome.
     */
    public static final String OUTCOME = "outcome";

    /**
     * Tag key for client transport.
     */
    public static final String TRANSPORT = "transport";

    /**
     * Tag key for traffic direction.
     */
    public static final String DIRECTION = "direction";

}
