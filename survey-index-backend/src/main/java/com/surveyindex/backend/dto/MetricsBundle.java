package com.surveyindex.backend.dto;

public class MetricsBundle {

    private final DeviationMetrics deviation;
    private final VelocityMetrics velocity;
    private final ComplexityMetrics complexity;
    private final HoverMetrics hover;

    public MetricsBundle(DeviationMetrics deviation, VelocityMetrics velocity,
                         ComplexityMetrics complexity, HoverMetrics hover) {
        this.deviation = deviation != null ? deviation : DeviationMetrics.empty();
        this.velocity = velocity != null ? velocity : VelocityMetrics.empty();
        this.complexity = complexity != null ? complexity : ComplexityMetrics.empty();
        this.hover = hover != null ? hover : HoverMetrics.empty();
    }

    public static MetricsBundle empty() {
        return new MetricsBundle(null, null, null, null);
    }

    public DeviationMetrics getDeviation() {
        return deviation;
    }

    public VelocityMetrics getVelocity() {
        return velocity;
    }

    public ComplexityMetrics getComplexity() {
        return complexity;
    }

    public HoverMetrics getHover() {
        return hover;
    }
}
