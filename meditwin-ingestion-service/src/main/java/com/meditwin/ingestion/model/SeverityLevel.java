package com.meditwin.ingestion.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * Clinical severity labels, ordered from least to most severe. The weight drives regional severity
 * recalculation in the graph store.
 */
public enum SeverityLevel {
    NA("NA", 0),
    NORMAL("normal", 1),
    MILD("mild", 2),
    MODERATE("moderate", 4),
    SEVERE("severe", 7),
    CRITICAL("critical", 10);

    private final String label;
    private final int weight;

    SeverityLevel(String label, int weight) {
        this.label = label;
        this.weight = weight;
    }

    @JsonValue
    public String label() {
        return label;
    }

    public int weight() {
        return weight;
    }

    public static SeverityLevel fromLabel(String label) {
        return Arrays.stream(values())
                .filter(level -> level.label.equalsIgnoreCase(label))
                .findFirst()
                .orElse(NA);
    }
}
