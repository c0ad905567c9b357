package com.surveyindex.backend.evaluation;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.surveyindex.backend.TelemetryFixtures;
import com.surveyindex.backend.dto.TelemetryRecord;
import com.surveyindex.backend.dto.TelemetryRecordParser;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class EngagementScorerTest {

    private final GeometryAnalyzer geometry = new GeometryAnalyzer();
    private final EngagementScorer scorer = new EngagementScorer(geometry);

    private static TelemetryRecord withInitiationTime(double initiationTimeMs) {
        ObjectNode json = TelemetryFixtures.json(TelemetryFixtures.DIRECT);
        ((ObjectNode) json.get("metrics").get("complexity")).put("initiationTimeMs", initiationTimeMs);
        return new TelemetryRecordParser().parse(json);
    }

    @Nested
    @DisplayName("Dual model")
    class DualModel {

        @Test
        @DisplayName("defaults favour the confident pattern")
        void defaults() {
            TelemetryRecord record = TelemetryFixtures.parse(
                    "{\"metadata\": {}, \"trajectory\": [], \"metrics\": {}}");
            TrajectoryGeometry g = geometry.analyze(record.getTrajectory());

            assertThat(scorer.confident(record, g)).isCloseTo(0.75, within(1e-12));
            assertThat(scorer.exploratory(record, g)).isCloseTo(0.7 / 9 + 0.15, within(1e-12));
            assertThat(scorer.score(record)).isCloseTo(75.0, within(1e-9));
        }

        @Test
        @DisplayName("a slow, wide, complex path is credited as exploratory engagement")
        void exploratoryWins() {
            TelemetryRecord record = TelemetryFixtures.parse("""
                    {"metadata": {},
                     "trajectory": [{"x": 0, "y": 0}, {"x": 5, "y": 0}, {"x": 0, "y": 0}],
                     "metrics": {
                       "deviation": {"aucPositive": 500},
                       "velocity": {"averageVelocityPxPerSec": 0, "maximalVelocityPxPerSec": 0},
                       "complexity": {"angleEntropy": 3.0, "initiationTimeMs": 400}}}
                    """);
            TrajectoryGeometry g = geometry.analyze(record.getTrajectory());

            assertThat(scorer.exploratory(record, g)).isGreaterThan(scorer.confident(record, g));
            assertThat(scorer.score(record)).isCloseTo(100.0, within(1e-9));
        }

        @Test
        @DisplayName("matches reference values for both fixtures")
        void fixtures() {
            assertThat(scorer.score(TelemetryFixtures.record(TelemetryFixtures.DIRECT)))
                    .isCloseTo(64.43927550991506, within(1e-9));
            assertThat(scorer.score(TelemetryFixtures.record(TelemetryFixtures.CHANGE_OF_MIND)))
                    .isCloseTo(63.354091267608716, within(1e-9));
        }
    }

    @Nested
    @DisplayName("Instant response penalty")
    class Penalty {

        @Test
        @DisplayName("a 50ms start is scaled by 0.7, a 150ms start is not")
        void penaltyRemovedAboveThreshold() {
            double instant = scorer.score(withInitiationTime(50));
            double normal = scorer.score(withInitiationTime(150));

            assertThat(normal).isGreaterThanOrEqualTo(instant);
            assertThat(instant).isCloseTo(normal * 0.7, within(1e-9));
            assertThat(normal).isCloseTo(64.43927550991506, within(1e-9));
        }

        @ParameterizedTest
        @CsvSource({"0, 0.7", "99.9, 0.7", "100, 1.0", "250, 1.0"})
        void threshold(double initiationTimeMs, double expected) {
            assertThat(EngagementScorer.penalty(initiationTimeMs)).isEqualTo(expected);
        }
    }

    @Test
    @DisplayName("stays within [0, 100] for out-of-range inputs")
    void bounded() {
        TelemetryRecord record = TelemetryFixtures.parse("""
                {"metadata": {}, "trajectory": [],
                 "metrics": {
                   "deviation": {"maxDeviationPositive": -400},
                   "velocity": {"averageVelocityPxPerSec": 99999, "maximalVelocityPxPerSec": 99999},
                   "complexity": {"angleEntropy": -5}}}
                """);

        assertThat(scorer.score(record)).isBetween(0.0, 100.0);
    }
}
