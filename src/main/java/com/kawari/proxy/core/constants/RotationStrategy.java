package com.kawari.proxy.core.constants;

import java.util.Locale;

/**
 * Selection algorithms shared by identity and backend rotation.
 */
public enum RotationStrategy {
    /**
     * Uniform random choice on every call. Default.
     */
    RANDOM("random"),

    /**
     * Cycle through candidates in insertion order with a shared cursor.
     */
    ROUND_ROBIN("round-robin");

    private final String label;

    RotationStrategy(String label) {
        this.label = label;
    }

    /**
     * Name reported by statistics and accepted on the command line.
     *
     * @return lower-case label.
     */
    public String getLabel() {
        return label;
    }

    /**
     * Parses a strategy name. Accepts {@code random}, {@code round-robin},
     * {@code round_robin} and the enum constant names, case-insensitively.
     *
     * @param value the name to parse.
     * @return the matching strategy.
     * @throws IllegalArgumentException if the name is unknown.
     */
    public static RotationStrategy parse(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Rotation strategy must not be null");
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        for (RotationStrategy strategy : values()) {
            if (strategy.name().equals(normalized)) {
                return strategy;
            }
        }
        throw new IllegalArgumentException("Unknown rotation strategy: " + value
                + " (expected random or round-robin)");
    }
}
