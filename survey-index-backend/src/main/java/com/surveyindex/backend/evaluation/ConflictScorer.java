package com.surveyindex.backend.evaluation;

import com.surveyindex.backend.dto.DeviationMetrics;
import com.surveyindex.backend.dto.HoverMetrics;
import com.surveyindex.backend.dto.MetricDefaults;
import com.surveyindex.backend.dto.TelemetryRecord;

/**
 * Survey conflict index (SCI): hesitation inferred from path shape,
 * traversal speed and hovering over options that were not chosen.
 */
public class ConflictScorer {

    static final double FLIPS_CEILING = 20.0;
    static final double MAX_DEVIATION_CEILING = 100.0;
    static final double AUC_CEILING = 500.0;
    static final double AVERAGE_DEVIATION_CEILING = 50.0;
    static final double VELOCITY_CEILING = 2000.0;

    static final double W_FLIPS = 0.25;
    static final double W_MAX_DEVIATION = 0.20;
    static final double W_AUC = 0.20;
    static final double W_AVERAGE_DEVIATION = 0.15;
    static final double W_VELOCITY = 0.10;
    static final double W_HOVER = 0.10;

    private final GeometryAnalyzer geometryAnalyzer;

    public ConflictScorer(GeometryAnalyzer geometryAnalyzer) {
        this.geometryAnalyzer = geometryAnalyzer;
    }

    public double score(TelemetryRecord record) {
        return score(record, geometryAnalyzer.analyze(record.getTrajectory()));
    }

    public double score(TelemetryRecord record, TrajectoryGeometry geometry) {

        DeviationMetrics deviation = record.getMetrics().getDeviation();
        double averageVelocity = record.getMetrics().getVelocity()
                .averageVelocityPxPerSecOr(MetricDefaults.CONFLICT_AVERAGE_VELOCITY_PX_PER_SEC);

        double flips = ScoreMath.clamp01(geometry.totalFlips() / FLIPS_CEILING);
        double maxDeviation = ScoreMath.clamp01(deviation.totalMaxDeviation() / MAX_DEVIATION_CEILING);
        double auc = ScoreMath.clamp01(deviation.totalAuc() / AUC_CEILING);
        double averageDeviation = ScoreMath.clamp01(geometry.getAverageDeviation() / AVERAGE_DEVIATION_CEILING);
        // slower traversal reads as more conflict
        double velocityFactor = ScoreMath.clamp01(1 - averageVelocity / VELOCITY_CEILING);
        double hover = hoverRatio(record.getMetrics().getHover(), record.getMetadata().getSelectedResponse());

        double raw = W_FLIPS * flips
                + W_MAX_DEVIATION * maxDeviation
                + W_AUC * auc
                + W_AVERAGE_DEVIATION * averageDeviation
                + W_VELOCITY * velocityFactor
                + W_HOVER * hover;

        return ScoreMath.clamp(raw * 100, 0, 100);
    }

    /**
     * Share of hovers that landed on options other than the selected one.
     * Zero when there are no hover counts.
     */
    static double hoverRatio(HoverMetrics hover, String selectedResponse) {
        long total = hover.sumOfCounts();
        if (total <= 0) {
            return 0.0;
        }
        long nonSelected = total - hover.countFor(selectedResponse);
        return ScoreMath.clamp01((double) nonSelected / total);
    }
}
