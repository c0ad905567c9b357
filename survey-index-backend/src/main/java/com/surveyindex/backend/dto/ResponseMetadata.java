package com.surveyindex.backend.dto;

public class ResponseMetadata {

    private String userId;
    private String surveyId;
    private String questionId;
    private String timestamp;
    private String selectedResponse;

    public ResponseMetadata() {
        this(null, null, null, null, null);
    }

    public ResponseMetadata(String userId, String surveyId, String questionId,
                            String timestamp, String selectedResponse) {
        this.userId = orDefault(userId);
        this.surveyId = orDefault(surveyId);
        this.questionId = orDefault(questionId);
        this.timestamp = orDefault(timestamp);
        this.selectedResponse = orDefault(selectedResponse);
    }

    private static String orDefault(String value) {
        return value != null ? value : MetricDefaults.METADATA_TEXT;
    }

    public String getUserId() {
        return userId;
    }

    public String getSurveyId() {
        return surveyId;
    }

    public String getQuestionId() {
        return questionId;
    }

    public String getTimestamp() {
        return timestamp;
    }

    public String getSelectedResponse() {
        return selectedResponse;
    }
}
