package com.surveyindex.backend.dto;

public class TrajectoryPoint {

    private double x;
    private double y;
    private int step;
    private double normalizedTime;

    public TrajectoryPoint() {}

    public TrajectoryPoint(double x, double y, int step, double normalizedTime) {
        this.x = x;
        this.y = y;
        this.step = step;
        this.normalizedTime = normalizedTime;
    }

    public double getX() {
        return x;
    }

    public double getY() {
        return y;
    }

    public int getStep() {
        return step;
    }

    public double getNormalizedTime() {
        return normalizedTime;
    }
}
