package com.surveyindex.backend.dto;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public class HoverMetrics {

    private final Map<String, Integer> hoverCounts;
    private final Integer totalHovers;

    public HoverMetrics(Map<String, Integer> hoverCounts, Integer totalHovers) {
        this.hoverCounts = hoverCounts == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(hoverCounts));
        this.totalHovers = totalHovers;
    }

    public static HoverMetrics empty() {
        return new HoverMetrics(null, null);
    }

    public int countFor(String label) {
        return hoverCounts.getOrDefault(label, 0);
    }

    public long sumOfCounts() {
        long sum = 0;
        for (int count : hoverCounts.values()) {
            sum += count;
        }
        return sum;
    }

    public Map<String, Integer> getHoverCounts() {
        return hoverCounts;
    }

    public Integer getTotalHovers() {
        return totalHovers;
    }
}
