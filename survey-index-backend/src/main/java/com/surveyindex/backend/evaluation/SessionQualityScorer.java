package com.surveyindex.backend.evaluation;

import com.surveyindex.backend.dto.HistoryEntry;

import java.util.ArrayList;
import java.util.List;

/**
 * Survey engagement index (SEI), recomputed from the full history on every call.
 */
public class SessionQualityScorer {

    public static final double NEUTRAL_SEI = 50.0;

    static final double HIGH_ENGAGEMENT_UEI = 60.0;
    static final double LOW_ENGAGEMENT_UEI = 30.0;
    static final double CONFLICT_SCI = 50.0;

    public double score(List<HistoryEntry> history) {
        return breakdown(history).sei;
    }

    public SessionQualityBreakdown breakdown(List<HistoryEntry> history) {

        if (history == null || history.isEmpty()) {
            return new SessionQualityBreakdown(0, 0.0, 0.0, 1.0, 0.0, 0.0, 0.0, NEUTRAL_SEI);
        }

        List<Double> ueiValues = new ArrayList<>(history.size());
        List<Double> sciValues = new ArrayList<>(history.size());
        int high = 0;
        int low = 0;
        int balanced = 0;

        for (HistoryEntry e : history) {
            ueiValues.add(e.getUei());
            sciValues.add(e.getSci());
            if (e.getUei() > HIGH_ENGAGEMENT_UEI) high++;
            if (e.getUei() < LOW_ENGAGEMENT_UEI) low++;
            // engaged despite conflict
            if (e.getSci() > CONFLICT_SCI && e.getUei() > HIGH_ENGAGEMENT_UEI) balanced++;
        }

        int n = history.size();
        double meanUei = ScoreMath.mean(ueiValues);
        double meanSci = ScoreMath.mean(sciValues);

        double cv = 0.0;
        if (n > 1 && meanUei > 0) {
            cv = ScoreMath.sampleStdDev(ueiValues) / meanUei;
        }
        double consistency = 1 / (1 + cv);

        double highRatio = (double) high / n;
        double lowRatio = (double) low / n;
        double balanceRatio = (double) balanced / n;

        double raw = 0.40 * (meanUei / 100)
                + 0.20 * (meanSci / 100)
                + 0.15 * consistency
                + 0.10 * highRatio
                + 0.10 * balanceRatio
                + 0.05 * (1 - lowRatio);

        return new SessionQualityBreakdown(
                n,
                meanUei,
                meanSci,
                consistency,
                highRatio,
                lowRatio,
                balanceRatio,
                ScoreMath.clamp(raw * 100, 0, 100)
        );
    }
}
