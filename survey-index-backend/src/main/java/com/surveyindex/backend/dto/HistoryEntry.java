package com.surveyindex.backend.dto;

public class HistoryEntry {

    private final double sci;
    private final double uei;
    private final String userId;
    private final String questionId;
    private final String timestamp;

    public HistoryEntry(double sci, double uei, String userId, String questionId, String timestamp) {
        this.sci = sci;
        this.uei = uei;
        this.userId = userId != null ? userId : MetricDefaults.METADATA_TEXT;
        this.questionId = questionId != null ? questionId : MetricDefaults.METADATA_TEXT;
        this.timestamp = timestamp != null ? timestamp : MetricDefaults.METADATA_TEXT;
    }

    public static HistoryEntry of(double sci, double uei, ResponseMetadata metadata) {
        return new HistoryEntry(sci, uei, metadata.getUserId(), metadata.getQuestionId(), metadata.getTimestamp());
    }

    public double getSci() {
        return sci;
    }

    public double getUei() {
        return uei;
    }

    public String getUserId() {
        return userId;
    }

    public String getQuestionId() {
        return questionId;
    }

    public String getTimestamp() {
        return timestamp;
    }
}
