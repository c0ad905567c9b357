package com.surveyindex.backend.dto;

public class ComplexityMetrics {

    private Double angleEntropy;
    private Double initiationTimeMs;

    public ComplexityMetrics() {}

    public ComplexityMetrics(Double angleEntropy, Double initiationTimeMs) {
        this.angleEntropy = angleEntropy;
        this.initiationTimeMs = initiationTimeMs;
    }

    public static ComplexityMetrics empty() {
        return new ComplexityMetrics();
    }

    public double angleEntropyOr(double fallback) {
        return angleEntropy != null ? angleEntropy : fallback;
    }

    public double initiationTimeMsOr(double fallback) {
        return initiationTimeMs != null ? initiationTimeMs : fallback;
    }

    public Double getAngleEntropy() {
        return angleEntropy;
    }

    public Double getInitiationTimeMs() {
        return initiationTimeMs;
    }
}
