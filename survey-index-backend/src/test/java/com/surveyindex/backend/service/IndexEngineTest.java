package com.surveyindex.backend.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.surveyindex.backend.TelemetryFixtures;
import com.surveyindex.backend.dto.HistoryEntry;
import com.surveyindex.backend.dto.IndexScores;
import com.surveyindex.backend.dto.TelemetryRecord;
import com.surveyindex.backend.dto.TelemetryRecordParser;
import com.surveyindex.backend.error.MalformedRecordException;
import com.surveyindex.backend.error.ValidationException;
import com.surveyindex.backend.evaluation.ConflictScorer;
import com.surveyindex.backend.evaluation.EngagementScorer;
import com.surveyindex.backend.evaluation.GeometryAnalyzer;
import com.surveyindex.backend.evaluation.ScoreMath;
import com.surveyindex.backend.evaluation.SessionQualityScorer;
import com.surveyindex.backend.evaluation.TrajectoryGeometry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class IndexEngineTest {

    private HistoryStore store;
    private IndexEngine engine;

    @BeforeEach
    void setUp() {
        store = new HistoryStore();
        engine = IndexEngine.withDefaults(store);
    }

    @Nested
    @DisplayName("Scoring")
    class Scoring {

        @Test
        @DisplayName("returns the three indices rounded to two decimals")
        void rounded() {
            IndexScores scores = engine.score(TelemetryFixtures.json(TelemetryFixtures.DIRECT), true);

            assertThat(scores.getSci()).isEqualTo(32.53);
            assertThat(scores.getUei()).isEqualTo(64.44);
            assertThat(scores.getSei()).isEqualTo(62.28);
        }

        @Test
        @DisplayName("rounding an already rounded score changes nothing")
        void roundingIsIdempotent() {
            IndexScores scores = engine.score(TelemetryFixtures.json(TelemetryFixtures.CHANGE_OF_MIND), true);

            for (double v : new double[]{scores.getSci(), scores.getUei(), scores.getSei()}) {
                assertThat(ScoreMath.round2(v)).isEqualTo(v);
                assertThat(v).isBetween(0.0, 100.0);
            }
        }

        @Test
        @DisplayName("history keeps the unrounded scores")
        void historyUnrounded() {
            engine.score(TelemetryFixtures.json(TelemetryFixtures.DIRECT), true);

            HistoryEntry entry = engine.history().get(0);
            assertThat(entry.getSci()).isCloseTo(32.52898052169256, within(1e-9));
            assertThat(entry.getUei()).isCloseTo(64.43927550991506, within(1e-9));
            assertThat(entry.getUserId()).isEqualTo("user_001");
            assertThat(entry.getQuestionId()).isEqualTo("q1");
            assertThat(entry.getTimestamp()).isEqualTo("2026-01-19T12:00:00.000Z");
        }

        @Test
        @DisplayName("without a history update SEI reflects only what is already stored")
        void noHistoryUpdate() {
            IndexScores scores = engine.score(TelemetryFixtures.json(TelemetryFixtures.DIRECT), false);

            assertThat(scores.getSei()).isEqualTo(50.0);
            assertThat(engine.history()).isEmpty();
        }
    }

    @Nested
    @DisplayName("Cumulative SEI")
    class Cumulative {

        @Test
        @DisplayName("the second answer's SEI covers both answers")
        void twoQuestions() {
            engine.score(TelemetryFixtures.json(TelemetryFixtures.DIRECT), true);
            IndexScores second = engine.score(TelemetryFixtures.json(TelemetryFixtures.CHANGE_OF_MIND), true);

            assertThat(engine.history("user_001")).hasSize(2);
            assertThat(second.getSci()).isEqualTo(57.1);
            assertThat(second.getUei()).isEqualTo(63.35);
            assertThat(second.getSei()).isEqualTo(69.34);
        }

        @Test
        @DisplayName("identical records scored twice give a two-entry history")
        void identicalTwice() {
            IndexScores first = engine.score(TelemetryFixtures.json(TelemetryFixtures.DIRECT), true);
            IndexScores second = engine.score(TelemetryFixtures.json(TelemetryFixtures.DIRECT), true);

            assertThat(engine.history()).hasSize(2);
            // identical entries have zero spread, so the cumulative SEI equals the single-entry one
            assertThat(second.getSei()).isEqualTo(first.getSei());
            assertThat(engine.sessionQuality("user_001").entryCount).isEqualTo(2);
        }

        @Test
        @DisplayName("other respondents do not leak into a user's SEI")
        void perUser() {
            engine.score(TelemetryFixtures.json(TelemetryFixtures.CHANGE_OF_MIND, "someone_else"), true);
            IndexScores mine = engine.score(TelemetryFixtures.json(TelemetryFixtures.DIRECT), true);

            assertThat(mine.getSei()).isEqualTo(62.28);
            assertThat(engine.history("user_001")).hasSize(1);
            assertThat(engine.history()).hasSize(2);
            assertThat(engine.stats().getUniqueUsers()).isEqualTo(2);
            assertThat(engine.stats().getTotalCalculations()).isEqualTo(2);
        }

        @Test
        @DisplayName("reset empties history and changes the session id")
        void reset() {
            engine.score(TelemetryFixtures.json(TelemetryFixtures.DIRECT), true);
            String before = engine.sessionId();

            String after = engine.reset();

            assertThat(engine.history()).isEmpty();
            assertThat(after).isNotEqualTo(before);
            assertThat(engine.stats().getTotalCalculations()).isZero();
        }
    }

    @Nested
    @DisplayName("Rejected records")
    class Rejected {

        @Test
        @DisplayName("a missing section is a validation error and nothing is stored")
        void missingSection() {
            ObjectNode json = TelemetryFixtures.json(TelemetryFixtures.DIRECT);
            json.remove("metrics");

            assertThatThrownBy(() -> engine.score(json, true))
                    .isInstanceOf(ValidationException.class)
                    .hasMessageContaining("metrics");
            assertThat(engine.history()).isEmpty();
        }

        @Test
        @DisplayName("malformed hover counts are rejected and nothing is stored")
        void malformedHover() {
            ObjectNode json = TelemetryFixtures.json(TelemetryFixtures.DIRECT);
            ((ObjectNode) json.get("metrics").get("hover")).putArray("hoverCounts").add(1);

            assertThatThrownBy(() -> engine.score(json, true))
                    .isInstanceOf(MalformedRecordException.class);
            assertThat(engine.history()).isEmpty();
        }

        @Test
        @DisplayName("a scorer failure leaves history untouched")
        void scorerFailure() {
            GeometryAnalyzer geometry = new GeometryAnalyzer();
            EngagementScorer failing = mock(EngagementScorer.class);
            when(failing.score(any(TelemetryRecord.class), any(TrajectoryGeometry.class)))
                    .thenThrow(new IllegalStateException("boom"));
            IndexEngine broken = new IndexEngine(new TelemetryRecordParser(), geometry,
                    new ConflictScorer(geometry), failing, new SessionQualityScorer(), store);

            JsonNode json = TelemetryFixtures.json(TelemetryFixtures.DIRECT);

            assertThatThrownBy(() -> broken.score(json, true)).isInstanceOf(IllegalStateException.class);
            assertThat(store.size()).isZero();
        }
    }

    @Nested
    @DisplayName("Extreme coordinates")
    class Extreme {

        private JsonNode recordFor(String userId, String trajectory) throws Exception {
            return TelemetryFixtures.MAPPER.readTree(
                    "{\"metadata\": {\"userId\": \"" + userId + "\", \"questionId\": \"qx\"},"
                            + " \"trajectory\": " + trajectory + ", \"metrics\": {}}");
        }

        @Test
        @DisplayName("huge finite coordinates score within bounds and later answers still score")
        void hugeCoordinates() throws Exception {
            IndexScores scores = engine.score(
                    recordFor("user_001", "[{\"x\": 0, \"y\": 0}, {\"x\": 1e200, \"y\": 1e200}, {\"x\": 2e200, \"y\": 0}]"),
                    true);

            for (double v : new double[]{scores.getSci(), scores.getUei(), scores.getSei()}) {
                assertThat(v).isFinite().isBetween(0.0, 100.0);
            }
            HistoryEntry stored = engine.history().get(0);
            assertThat(stored.getSci()).isFinite();
            assertThat(stored.getUei()).isFinite();

            IndexScores next = engine.score(TelemetryFixtures.json(TelemetryFixtures.DIRECT), true);
            assertThat(next.getSei()).isFinite().isBetween(0.0, 100.0);
            assertThat(engine.history("user_001")).hasSize(2);
        }

        @Test
        @DisplayName("coordinates that overflow to infinity are rejected and nothing is stored")
        void infiniteCoordinates() throws Exception {
            JsonNode json = recordFor("user_001", "[{\"x\": 0, \"y\": 0}, {\"x\": 1e400, \"y\": 0}]");

            assertThatThrownBy(() -> engine.score(json, true))
                    .isInstanceOf(MalformedRecordException.class)
                    .hasMessageContaining("trajectory[1].x");
            assertThat(store.size()).isZero();
        }

        @Test
        @DisplayName("a non-finite score is rejected before it reaches history")
        void nonFiniteScore() {
            GeometryAnalyzer geometry = new GeometryAnalyzer();
            ConflictScorer conflict = mock(ConflictScorer.class);
            when(conflict.score(any(TelemetryRecord.class), any(TrajectoryGeometry.class)))
                    .thenReturn(Double.NaN);
            IndexEngine guarded = new IndexEngine(new TelemetryRecordParser(), geometry,
                    conflict, new EngagementScorer(geometry), new SessionQualityScorer(), store);

            JsonNode json = TelemetryFixtures.json(TelemetryFixtures.DIRECT);

            assertThatThrownBy(() -> guarded.score(json, true)).isInstanceOf(MalformedRecordException.class);
            assertThat(store.size()).isZero();
        }
    }
}
