package com.surveyindex.backend.dto;

public class DeviationMetrics {

    private Double maxDeviationPositive;
    private Double maxDeviationNegative;
    private Double aucPositive;
    private Double aucNegative;

    public DeviationMetrics() {}

    public DeviationMetrics(Double maxDeviationPositive, Double maxDeviationNegative,
                            Double aucPositive, Double aucNegative) {
        this.maxDeviationPositive = maxDeviationPositive;
        this.maxDeviationNegative = maxDeviationNegative;
        this.aucPositive = aucPositive;
        this.aucNegative = aucNegative;
    }

    public static DeviationMetrics empty() {
        return new DeviationMetrics();
    }

    /** Positive plus absolute negative maximum deviation. */
    public double totalMaxDeviation() {
        return orDefault(maxDeviationPositive) + Math.abs(orDefault(maxDeviationNegative));
    }

    /** Positive plus absolute negative area under curve. */
    public double totalAuc() {
        return orDefault(aucPositive) + Math.abs(orDefault(aucNegative));
    }

    private static double orDefault(Double value) {
        return value != null ? value : MetricDefaults.DEVIATION;
    }

    public Double getMaxDeviationPositive() {
        return maxDeviationPositive;
    }

    public Double getMaxDeviationNegative() {
        return maxDeviationNegative;
    }

    public Double getAucPositive() {
        return aucPositive;
    }

    public Double getAucNegative() {
        return aucNegative;
    }
}
