package com.surveyindex.backend.dto;

import com.fasterxml.jackson.databind.JsonNode;
import com.surveyindex.backend.error.MalformedRecordException;
import com.surveyindex.backend.error.ValidationException;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns a telemetry JSON tree into a {@link TelemetryRecord}.
 *
 * <p>Strict about the three top-level sections, lenient below them: absent
 * or {@code null} leaf fields stay unset and fall back to
 * {@link MetricDefaults} at scoring time. A field that is present with the
 * wrong JSON type is rejected.</p>
 */
public class TelemetryRecordParser {

    static final List<String> REQUIRED_SECTIONS = List.of("metadata", "trajectory", "metrics");

    public TelemetryRecord parse(JsonNode node) {

        if (node == null || node.isNull() || node.isMissingNode()) {
            throw new ValidationException("No JSON data provided");
        }
        if (!node.isObject()) {
            throw new MalformedRecordException("$", "an object");
        }

        List<String> missing = new ArrayList<>();
        for (String section : REQUIRED_SECTIONS) {
            if (!node.hasNonNull(section)) {
                missing.add(section);
            }
        }
        if (!missing.isEmpty()) {
            throw ValidationException.missing(missing);
        }

        return new TelemetryRecord(
                parseMetadata(node.get("metadata")),
                parseTrajectory(node.get("trajectory")),
                parseMetrics(node.get("metrics"))
        );
    }

    /* =========================
       SECTIONS
    ========================= */

    private ResponseMetadata parseMetadata(JsonNode node) {
        requireObject(node, "metadata");
        return new ResponseMetadata(
                text(node, "userId", "metadata.userId"),
                text(node, "surveyId", "metadata.surveyId"),
                text(node, "questionId", "metadata.questionId"),
                text(node, "timestamp", "metadata.timestamp"),
                text(node, "selectedResponse", "metadata.selectedResponse")
        );
    }

    private List<TrajectoryPoint> parseTrajectory(JsonNode node) {
        if (!node.isArray()) {
            throw new MalformedRecordException("trajectory", "an array");
        }

        List<TrajectoryPoint> points = new ArrayList<>(node.size());
        for (int i = 0; i < node.size(); i++) {
            String path = "trajectory[" + i + "]";
            JsonNode p = node.get(i);
            requireObject(p, path);

            Double x = number(p, "x", path + ".x");
            Double y = number(p, "y", path + ".y");
            if (x == null || y == null) {
                throw new MalformedRecordException(path, "numeric x and y");
            }
            Double step = number(p, "step", path + ".step");
            Double normalizedTime = number(p, "normalizedTime", path + ".normalizedTime");

            points.add(new TrajectoryPoint(
                    x,
                    y,
                    step != null ? step.intValue() : i,
                    normalizedTime != null ? normalizedTime : 0.0
            ));
        }
        return points;
    }

    private MetricsBundle parseMetrics(JsonNode node) {
        requireObject(node, "metrics");

        JsonNode deviation = section(node, "deviation");
        JsonNode velocity = section(node, "velocity");
        JsonNode complexity = section(node, "complexity");
        JsonNode hover = section(node, "hover");

        return new MetricsBundle(
                deviation == null ? null : new DeviationMetrics(
                        number(deviation, "maxDeviationPositive", "metrics.deviation.maxDeviationPositive"),
                        number(deviation, "maxDeviationNegative", "metrics.deviation.maxDeviationNegative"),
                        number(deviation, "aucPositive", "metrics.deviation.aucPositive"),
                        number(deviation, "aucNegative", "metrics.deviation.aucNegative")),
                velocity == null ? null : new VelocityMetrics(
                        number(velocity, "averageVelocityPxPerSec", "metrics.velocity.averageVelocityPxPerSec"),
                        number(velocity, "maximalVelocityPxPerSec", "metrics.velocity.maximalVelocityPxPerSec"),
                        number(velocity, "averageVelocity", "metrics.velocity.averageVelocity"),
                        number(velocity, "maximalVelocity", "metrics.velocity.maximalVelocity")),
                complexity == null ? null : new ComplexityMetrics(
                        number(complexity, "angleEntropy", "metrics.complexity.angleEntropy"),
                        number(complexity, "initiationTimeMs", "metrics.complexity.initiationTimeMs")),
                hover == null ? null : parseHover(hover)
        );
    }

    private HoverMetrics parseHover(JsonNode node) {
        Map<String, Integer> counts = new LinkedHashMap<>();

        JsonNode countsNode = node.get("hoverCounts");
        if (countsNode != null && !countsNode.isNull()) {
            if (!countsNode.isObject()) {
                throw new MalformedRecordException("metrics.hover.hoverCounts", "a mapping of label to count");
            }
            Iterator<Map.Entry<String, JsonNode>> fields = countsNode.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> e = fields.next();
                counts.put(e.getKey(), count(e.getValue(), "metrics.hover.hoverCounts." + e.getKey()));
            }
        }

        JsonNode total = node.get("totalHovers");
        return new HoverMetrics(counts,
                total == null || total.isNull() ? null : count(total, "metrics.hover.totalHovers"));
    }

    /* =========================
       HELPERS
    ========================= */

    private static JsonNode section(JsonNode parent, String field) {
        JsonNode child = parent.get(field);
        if (child == null || child.isNull()) {
            return null;
        }
        requireObject(child, "metrics." + field);
        return child;
    }

    private static void requireObject(JsonNode node, String path) {
        if (node == null || !node.isObject()) {
            throw new MalformedRecordException(path, "an object");
        }
    }

    private static Double number(JsonNode parent, String field, String path) {
        JsonNode value = parent.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (!value.isNumber()) {
            throw new MalformedRecordException(path, "a number");
        }
        // 1e400 parses as Infinity
        double d = value.doubleValue();
        if (!Double.isFinite(d)) {
            throw new MalformedRecordException(path, "a finite number");
        }
        return d;
    }

    private static int count(JsonNode value, String path) {
        if (!value.isIntegralNumber() || !value.canConvertToInt()) {
            throw new MalformedRecordException(path, "an integer count");
        }
        return value.intValue();
    }

    private static String text(JsonNode parent, String field, String path) {
        JsonNode value = parent.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (!value.isValueNode()) {
            throw new MalformedRecordException(path, "a scalar value");
        }
        return value.asText();
    }
}
