package com.surveyindex.backend.evaluation;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;

public final class ScoreMath {

    private ScoreMath() {}

    /** NaN clamps to {@code min}. */
    static double clamp(double value, double min, double max) {
        if (Double.isNaN(value)) {
            return min;
        }
        return Math.max(min, Math.min(max, value));
    }

    static double clamp01(double value) {
        return clamp(value, 0.0, 1.0);
    }

    /** Half-even on the exact binary value, so rounding twice is a no-op. */
    public static double round2(double value) {
        return new BigDecimal(value).setScale(2, RoundingMode.HALF_EVEN).doubleValue();
    }

    static double mean(List<Double> values) {
        if (values.isEmpty()) {
            return 0.0;
        }
        double sum = 0.0;
        for (double v : values) {
            sum += v;
        }
        return sum / values.size();
    }

    static double populationStdDev(List<Double> values) {
        return values.isEmpty() ? 0.0 : Math.sqrt(squaredDeviations(values) / values.size());
    }

    static double sampleStdDev(List<Double> values) {
        return values.size() < 2 ? 0.0 : Math.sqrt(squaredDeviations(values) / (values.size() - 1));
    }

    private static double squaredDeviations(List<Double> values) {
        double mean = mean(values);
        double sum = 0.0;
        for (double v : values) {
            sum += (v - mean) * (v - mean);
        }
        return sum;
    }
}
