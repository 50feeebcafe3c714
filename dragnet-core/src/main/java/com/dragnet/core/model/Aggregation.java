package com.dragnet.core.model;

import com.dragnet.core.exception.ConfigException;

public enum Aggregation {
    NONE("none"),
    /** Power-of-two buckets. */
    QUANTIZE("quantize"),
    /** Fixed-width buckets of {@code step}. */
    LQUANTIZE("lquantize");

    private final String label;

    Aggregation(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static Aggregation fromLabel(String label) {
        if (label == null || label.isEmpty()) {
            return NONE;
        }
        for (Aggregation a : values()) {
            if (a.label.equals(label)) {
                return a;
            }
        }
        throw new ConfigException("unsupported \"aggr\": \"" + label + "\"");
    }
}
