package com.surveyindex.backend.evaluation;

public class SessionQualityBreakdown {

    public final int entryCount;
    public final double meanUei;
    public final double meanSci;
    public final double consistency;
    public final double highEngagementRatio;
    public final double lowEngagementRatio;
    public final double balanceRatio;
    public final double sei;

    public SessionQualityBreakdown(int entryCount, double meanUei, double meanSci, double consistency,
                                   double highEngagementRatio, double lowEngagementRatio,
                                   double balanceRatio, double sei) {
        this.entryCount = entryCount;
        this.meanUei = meanUei;
        this.meanSci = meanSci;
        this.consistency = consistency;
        this.highEngagementRatio = highEngagementRatio;
        this.lowEngagementRatio = lowEngagementRatio;
        this.balanceRatio = balanceRatio;
        this.sei = sei;
    }
}
