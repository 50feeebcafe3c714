package com.dragnet.core.model;

import java.math.BigDecimal;
import java.math.BigInteger;

/** Canonical forms for field values so that equal values from JSON, JDBC and bucketizers group together. */
public final class FieldValues {

    private static final double LONG_LIMIT = 9.007199254740992E15;

    private FieldValues() {}

    public static Object normalize(Object value) {
        if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue();
        }
        if (value instanceof BigInteger b) {
            return b.bitLength() < 64 ? (Object) b.longValue() : b.doubleValue();
        }
        if (value instanceof BigDecimal d) {
            return normalize(d.doubleValue());
        }
        if (value instanceof Float f) {
            return normalize(f.doubleValue());
        }
        if (value instanceof Double d && !d.isNaN() && !d.isInfinite() && d == Math.rint(d) && Math.abs(d) < LONG_LIMIT) {
            return d.longValue();
        }
        return value;
    }

    /** Numeric view of a value, or {@code null} if it has none. Numeric strings count. */
    public static Double asDouble(Object value) {
        if (value instanceof Number n) {
            return n.doubleValue();
        }
        if (value instanceof String s && !s.isBlank()) {
            try {
                return Double.parseDouble(s.trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }
}
