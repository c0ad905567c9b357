package com.surveyindex.backend.dto;

import java.util.List;
import java.util.Objects;

public class TelemetryRecord {

    private final ResponseMetadata metadata;
    private final List<TrajectoryPoint> trajectory;
    private final MetricsBundle metrics;

    public TelemetryRecord(ResponseMetadata metadata, List<TrajectoryPoint> trajectory, MetricsBundle metrics) {
        this.metadata = Objects.requireNonNull(metadata, "metadata");
        this.trajectory = List.copyOf(Objects.requireNonNull(trajectory, "trajectory"));
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    public ResponseMetadata getMetadata() {
        return metadata;
    }

    public List<TrajectoryPoint> getTrajectory() {
        return trajectory;
    }

    public MetricsBundle getMetrics() {
        return metrics;
    }
}
