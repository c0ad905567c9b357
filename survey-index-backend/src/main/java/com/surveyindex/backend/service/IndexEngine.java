package com.surveyindex.backend.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.surveyindex.backend.dto.HistoryEntry;
import com.surveyindex.backend.dto.IndexScores;
import com.surveyindex.backend.dto.IndexStats;
import com.surveyindex.backend.dto.TelemetryRecord;
import com.surveyindex.backend.dto.TelemetryRecordParser;
import com.surveyindex.backend.error.MalformedRecordException;
import com.surveyindex.backend.evaluation.ConflictScorer;
import com.surveyindex.backend.evaluation.EngagementScorer;
import com.surveyindex.backend.evaluation.GeometryAnalyzer;
import com.surveyindex.backend.evaluation.ScoreMath;
import com.surveyindex.backend.evaluation.SessionQualityBreakdown;
import com.surveyindex.backend.evaluation.SessionQualityScorer;
import com.surveyindex.backend.evaluation.TrajectoryGeometry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Scores one telemetry record at a time: SCI and UEI for the question,
 * then SEI over everything the same respondent has answered this session.
 */
public class IndexEngine {

    private static final Logger log = LoggerFactory.getLogger(IndexEngine.class);

    private final TelemetryRecordParser parser;
    private final GeometryAnalyzer geometryAnalyzer;
    private final ConflictScorer conflictScorer;
    private final EngagementScorer engagementScorer;
    private final SessionQualityScorer sessionQualityScorer;
    private final HistoryStore historyStore;

    public IndexEngine(TelemetryRecordParser parser,
                       GeometryAnalyzer geometryAnalyzer,
                       ConflictScorer conflictScorer,
                       EngagementScorer engagementScorer,
                       SessionQualityScorer sessionQualityScorer,
                       HistoryStore historyStore) {
        this.parser = parser;
        this.geometryAnalyzer = geometryAnalyzer;
        this.conflictScorer = conflictScorer;
        this.engagementScorer = engagementScorer;
        this.sessionQualityScorer = sessionQualityScorer;
        this.historyStore = historyStore;
    }

    public static IndexEngine withDefaults(HistoryStore historyStore) {
        GeometryAnalyzer geometry = new GeometryAnalyzer();
        return new IndexEngine(
                new TelemetryRecordParser(),
                geometry,
                new ConflictScorer(geometry),
                new EngagementScorer(geometry),
                new SessionQualityScorer(),
                historyStore
        );
    }

    /** Parses the raw record first; nothing is stored if parsing fails. */
    public IndexScores score(JsonNode raw, boolean updateHistory) {
        return score(parser.parse(raw), updateHistory);
    }

    public IndexScores score(TelemetryRecord record, boolean updateHistory) {

        TrajectoryGeometry geometry = geometryAnalyzer.analyze(record.getTrajectory());
        double sci = conflictScorer.score(record, geometry);
        double uei = engagementScorer.score(record, geometry);

        if (log.isDebugEnabled()) {
            log.debug("question {} geometry [{}] -> sci={} uei={}",
                    record.getMetadata().getQuestionId(), geometry, sci, uei);
        }

        if (!Double.isFinite(sci) || !Double.isFinite(uei)) {
            throw new MalformedRecordException("trajectory", "coordinates with a finite geometry");
        }

        String userId = record.getMetadata().getUserId();
        List<HistoryEntry> history = updateHistory
                ? historyStore.appendAndQuery(HistoryEntry.of(sci, uei, record.getMetadata()), userId)
                : historyStore.query(userId);

        double sei = sessionQualityScorer.score(history);

        IndexScores scores = new IndexScores(ScoreMath.round2(sci), ScoreMath.round2(uei), ScoreMath.round2(sei));
        log.info("Calculated indices for user {}, question {}: {}",
                userId, record.getMetadata().getQuestionId(), scores);
        return scores;
    }

    public List<HistoryEntry> history() {
        return historyStore.query();
    }

    public List<HistoryEntry> history(String userId) {
        return historyStore.query(userId);
    }

    public SessionQualityBreakdown sessionQuality(String userId) {
        return sessionQualityScorer.breakdown(historyStore.query(userId));
    }

    public String sessionId() {
        return historyStore.getSessionId();
    }

    public String reset() {
        String sessionId = historyStore.reset();
        log.info("Calculator history reset, new session {}", sessionId);
        return sessionId;
    }

    public IndexStats stats() {
        return historyStore.stats();
    }
}
