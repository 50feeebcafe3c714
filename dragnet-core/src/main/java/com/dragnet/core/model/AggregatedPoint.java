package com.dragnet.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A set of breakdown values and the number of records that carried them.
 *
 * @param fields breakdown name to value, in breakdown order; values may be {@code null}
 */
public record AggregatedPoint(Map<String, Object> fields, long value) {

    public AggregatedPoint {
        Map<String, Object> copy = new LinkedHashMap<>();
        fields.forEach((k, v) -> copy.put(k, FieldValues.normalize(v)));
        fields = Collections.unmodifiableMap(copy);
    }

    public static AggregatedPoint of(Map<String, ?> fields, long value) {
        return new AggregatedPoint(new LinkedHashMap<String, Object>(fields), value);
    }

    public Object field(String name) {
        return fields.get(name);
    }

    public AggregatedPoint withField(String name, Object fieldValue) {
        Map<String, Object> copy = new LinkedHashMap<>(fields);
        copy.put(name, fieldValue);
        return new AggregatedPoint(copy, value);
    }
}
