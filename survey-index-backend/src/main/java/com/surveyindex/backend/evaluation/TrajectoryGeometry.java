package com.surveyindex.backend.evaluation;

public class TrajectoryGeometry {

    private static final TrajectoryGeometry DEGENERATE = new TrajectoryGeometry(0, 0, 0.0, 0.0, 1.0);

    private final int xFlips;
    private final int yFlips;
    private final double averageDeviation;
    private final double trajectoryLength;
    private final double trajectorySmoothness;

    public TrajectoryGeometry(int xFlips, int yFlips, double averageDeviation,
                              double trajectoryLength, double trajectorySmoothness) {
        this.xFlips = xFlips;
        this.yFlips = yFlips;
        this.averageDeviation = averageDeviation;
        this.trajectoryLength = trajectoryLength;
        this.trajectorySmoothness = trajectorySmoothness;
    }

    public static TrajectoryGeometry degenerate() {
        return DEGENERATE;
    }

    public int getXFlips() {
        return xFlips;
    }

    public int getYFlips() {
        return yFlips;
    }

    public int totalFlips() {
        return xFlips + yFlips;
    }

    public double getAverageDeviation() {
        return averageDeviation;
    }

    public double getTrajectoryLength() {
        return trajectoryLength;
    }

    public double getTrajectorySmoothness() {
        return trajectorySmoothness;
    }

    @Override
    public String toString() {
        return "xFlips=" + xFlips
                + ", yFlips=" + yFlips
                + ", averageDeviation=" + averageDeviation
                + ", trajectoryLength=" + trajectoryLength
                + ", smoothness=" + trajectorySmoothness;
    }
}
