package com.surveyindex.backend.dto;

/**
 * Fallback values for telemetry fields the client left out.
 *
 * <p>Conflict and engagement scoring read the same velocity field with
 * different fallbacks; both live here so they cannot drift apart.</p>
 */
public final class MetricDefaults {

    public static final double DEVIATION = 0.0;

    public static final double CONFLICT_AVERAGE_VELOCITY_PX_PER_SEC = 0.0;

    public static final double ENGAGEMENT_AVERAGE_VELOCITY_PX_PER_SEC = 500.0;
    public static final double ENGAGEMENT_MAXIMAL_VELOCITY_PX_PER_SEC = 1000.0;
    public static final double ENGAGEMENT_ANGLE_ENTROPY = 1.0;
    public static final double ENGAGEMENT_INITIATION_TIME_MS = 200.0;

    public static final String METADATA_TEXT = "";

    private MetricDefaults() {}
}
