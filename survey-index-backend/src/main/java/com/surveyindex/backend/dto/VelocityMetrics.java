package com.surveyindex.backend.dto;

public class VelocityMetrics {

    private Double averageVelocityPxPerSec;
    private Double maximalVelocityPxPerSec;
    private Double averageVelocity;
    private Double maximalVelocity;

    public VelocityMetrics() {}

    public VelocityMetrics(Double averageVelocityPxPerSec, Double maximalVelocityPxPerSec,
                           Double averageVelocity, Double maximalVelocity) {
        this.averageVelocityPxPerSec = averageVelocityPxPerSec;
        this.maximalVelocityPxPerSec = maximalVelocityPxPerSec;
        this.averageVelocity = averageVelocity;
        this.maximalVelocity = maximalVelocity;
    }

    public static VelocityMetrics empty() {
        return new VelocityMetrics();
    }

    public double averageVelocityPxPerSecOr(double fallback) {
        return averageVelocityPxPerSec != null ? averageVelocityPxPerSec : fallback;
    }

    public double maximalVelocityPxPerSecOr(double fallback) {
        return maximalVelocityPxPerSec != null ? maximalVelocityPxPerSec : fallback;
    }

    public Double getAverageVelocityPxPerSec() {
        return averageVelocityPxPerSec;
    }

    public Double getMaximalVelocityPxPerSec() {
        return maximalVelocityPxPerSec;
    }

    public Double getAverageVelocity() {
        return averageVelocity;
    }

    public Double getMaximalVelocity() {
        return maximalVelocity;
    }
}
