package com.surveyindex.backend.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public class IndexStats {

    private final int totalCalculations;
    private final int uniqueUsers;
    private final String sessionId;

    public IndexStats(int totalCalculations, int uniqueUsers, String sessionId) {
        this.totalCalculations = totalCalculations;
        this.uniqueUsers = uniqueUsers;
        this.sessionId = sessionId;
    }

    @JsonProperty("total_calculations")
    public int getTotalCalculations() {
        return totalCalculations;
    }

    @JsonProperty("unique_users")
    public int getUniqueUsers() {
        return uniqueUsers;
    }

    @JsonProperty("session_id")
    public String getSessionId() {
        return sessionId;
    }
}
