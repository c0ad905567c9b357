package com.surveyindex.backend.evaluation;

import com.surveyindex.backend.dto.ComplexityMetrics;
import com.surveyindex.backend.dto.TelemetryRecord;
import com.surveyindex.backend.dto.VelocityMetrics;

import static com.surveyindex.backend.dto.MetricDefaults.ENGAGEMENT_ANGLE_ENTROPY;
import static com.surveyindex.backend.dto.MetricDefaults.ENGAGEMENT_AVERAGE_VELOCITY_PX_PER_SEC;
import static com.surveyindex.backend.dto.MetricDefaults.ENGAGEMENT_INITIATION_TIME_MS;
import static com.surveyindex.backend.dto.MetricDefaults.ENGAGEMENT_MAXIMAL_VELOCITY_PX_PER_SEC;

/**
 * User engagement index (UEI) under a dual model.
 *
 * <p>A respondent is credited for either pattern, whichever is stronger:</p>
 * <ul>
 *   <li><b>confident</b>: direct, smooth, reasonably fast and decisive</li>
 *   <li><b>exploratory</b>: complex, wide-ranging and deliberate</li>
 * </ul>
 * <p>Responses initiated in under {@value #INSTANT_RESPONSE_MS} ms are
 * treated as suspicious and scaled by {@value #INSTANT_RESPONSE_PENALTY}.</p>
 */
public class EngagementScorer {

    static final double INSTANT_RESPONSE_MS = 100.0;
    static final double INSTANT_RESPONSE_PENALTY = 0.7;

    private final GeometryAnalyzer geometryAnalyzer;

    public EngagementScorer(GeometryAnalyzer geometryAnalyzer) {
        this.geometryAnalyzer = geometryAnalyzer;
    }

    public double score(TelemetryRecord record) {
        return score(record, geometryAnalyzer.analyze(record.getTrajectory()));
    }

    public double score(TelemetryRecord record, TrajectoryGeometry geometry) {

        double raw = Math.max(confident(record, geometry), exploratory(record, geometry));

        double initiationTime = record.getMetrics().getComplexity()
                .initiationTimeMsOr(ENGAGEMENT_INITIATION_TIME_MS);

        return ScoreMath.clamp(raw * penalty(initiationTime) * 100, 0, 100);
    }

    double confident(TelemetryRecord record, TrajectoryGeometry geometry) {
        VelocityMetrics velocity = record.getMetrics().getVelocity();

        double directness = ScoreMath.clamp01(1 - record.getMetrics().getDeviation().totalMaxDeviation() / 100);
        double smoothness = ScoreMath.clamp01(geometry.getTrajectorySmoothness());
        double speedAdequacy = ScoreMath.clamp01(
                velocity.averageVelocityPxPerSecOr(ENGAGEMENT_AVERAGE_VELOCITY_PX_PER_SEC) / 1000);
        double decisiveness = ScoreMath.clamp01(
                velocity.maximalVelocityPxPerSecOr(ENGAGEMENT_MAXIMAL_VELOCITY_PX_PER_SEC) / 2000);

        return (directness + smoothness + speedAdequacy + decisiveness) / 4;
    }

    double exploratory(TelemetryRecord record, TrajectoryGeometry geometry) {
        ComplexityMetrics complexity = record.getMetrics().getComplexity();
        double averageVelocity = record.getMetrics().getVelocity()
                .averageVelocityPxPerSecOr(ENGAGEMENT_AVERAGE_VELOCITY_PX_PER_SEC);

        double entropy = ScoreMath.clamp01(complexity.angleEntropyOr(ENGAGEMENT_ANGLE_ENTROPY) / 3.0);
        double auc = ScoreMath.clamp01(record.getMetrics().getDeviation().totalAuc() / 500);
        double length = ScoreMath.clamp01(geometry.getTrajectoryLength() / 5.0);
        double deliberation = ScoreMath.clamp01(1 - averageVelocity / 1000);

        double exploration = (entropy + auc + length) / 3;
        return exploration * 0.7 + deliberation * 0.3;
    }

    static double penalty(double initiationTimeMs) {
        return initiationTimeMs < INSTANT_RESPONSE_MS ? INSTANT_RESPONSE_PENALTY : 1.0;
    }
}
