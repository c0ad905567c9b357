package com.surveyindex.backend.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public class IndexScores {

    private final double sci;
    private final double uei;
    private final double sei;

    public IndexScores(double sci, double uei, double sei) {
        this.sci = sci;
        this.uei = uei;
        this.sei = sei;
    }

    @JsonProperty("SCI")
    public double getSci() {
        return sci;
    }

    @JsonProperty("UEI")
    public double getUei() {
        return uei;
    }

    @JsonProperty("SEI")
    public double getSei() {
        return sei;
    }

    @Override
    public String toString() {
        return "SCI=" + sci + ", UEI=" + uei + ", SEI=" + sei;
    }
}
