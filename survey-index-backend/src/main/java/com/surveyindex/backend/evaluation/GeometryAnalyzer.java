package com.surveyindex.backend.evaluation;

import com.surveyindex.backend.dto.TrajectoryPoint;

import java.util.ArrayList;
import java.util.List;

/**
 * Derives direction flips, deviation from the straight start-to-end line,
 * path length and heading smoothness from a trajectory. Stateless.
 */
public class GeometryAnalyzer {

    public TrajectoryGeometry analyze(List<TrajectoryPoint> trajectory) {

        if (trajectory == null || trajectory.size() < 2) {
            return TrajectoryGeometry.degenerate();
        }

        int n = trajectory.size();

        int xFlips = 0;
        int yFlips = 0;
        for (int i = 1; i < n - 1; i++) {
            TrajectoryPoint prev = trajectory.get(i - 1);
            TrajectoryPoint cur = trajectory.get(i);
            TrajectoryPoint next = trajectory.get(i + 1);

            if ((cur.getX() - prev.getX()) * (next.getX() - cur.getX()) < 0) xFlips++;
            if ((cur.getY() - prev.getY()) * (next.getY() - cur.getY()) < 0) yFlips++;
        }

        return new TrajectoryGeometry(
                xFlips,
                yFlips,
                averageDeviation(trajectory),
                length(trajectory),
                smoothness(trajectory)
        );
    }

    // mean perpendicular distance of interior points to the start-end line
    private double averageDeviation(List<TrajectoryPoint> trajectory) {
        TrajectoryPoint start = trajectory.get(0);
        TrajectoryPoint end = trajectory.get(trajectory.size() - 1);

        double dx = end.getX() - start.getX();
        double dy = end.getY() - start.getY();
        double lineLength = Math.hypot(dx, dy);

        if (lineLength == 0 || trajectory.size() < 3) {
            return 0.0;
        }

        // unit direction keeps the products finite for large coordinates
        double ux = dx / lineLength;
        double uy = dy / lineLength;
        double sum = 0.0;
        for (int i = 1; i < trajectory.size() - 1; i++) {
            TrajectoryPoint p = trajectory.get(i);
            sum += Math.abs(uy * (p.getX() - start.getX()) - ux * (p.getY() - start.getY()));
        }
        return sum / (trajectory.size() - 2);
    }

    private double length(List<TrajectoryPoint> trajectory) {
        double total = 0.0;
        for (int i = 1; i < trajectory.size(); i++) {
            double dx = trajectory.get(i).getX() - trajectory.get(i - 1).getX();
            double dy = trajectory.get(i).getY() - trajectory.get(i - 1).getY();
            total += Math.hypot(dx, dy);
        }
        return total;
    }

    // 1 - populationStd(|heading change|) / pi, floored at 0
    private double smoothness(List<TrajectoryPoint> trajectory) {
        List<Double> headings = new ArrayList<>();
        for (int i = 1; i < trajectory.size(); i++) {
            double dx = trajectory.get(i).getX() - trajectory.get(i - 1).getX();
            double dy = trajectory.get(i).getY() - trajectory.get(i - 1).getY();
            headings.add(Math.atan2(dy, dx));
        }

        List<Double> changes = new ArrayList<>();
        for (int i = 1; i < headings.size(); i++) {
            changes.add(Math.abs(headings.get(i) - headings.get(i - 1)));
        }

        if (changes.size() < 2) {
            return 1.0;
        }
        return ScoreMath.clamp01(1 - ScoreMath.populationStdDev(changes) / Math.PI);
    }
}
