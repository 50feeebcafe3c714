package com.dragnet.core.model;

import com.dragnet.core.exception.ConfigException;
import com.dragnet.core.json.JsonUtil;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.Iterator;
import java.util.Set;

/**
 * One grouping dimension of a query or metric.
 *
 * @param name output field name (and index column)
 * @param field record field the value is read from; defaults to {@code name}
 * @param aggr numeric bucketing applied to the value
 * @param step bucket width, required for {@link Aggregation#LQUANTIZE}
 * @param date when non-null the value is parsed as a date and replaced by epoch seconds
 */
public record Breakdown(String name, String field, Aggregation aggr, Double step, String date) {

    private static final Set<String> KEYS = Set.of("name", "field", "aggr", "step", "date");

    public Breakdown {
        if (name == null || name.isEmpty()) {
            throw new ConfigException("breakdown name is required");
        }
        if (field == null || field.isEmpty()) {
            field = name;
        }
        if (aggr == null) {
            aggr = Aggregation.NONE;
        }
        if (aggr == Aggregation.LQUANTIZE && (step == null || !(step > 0))) {
            throw new ConfigException("breakdown \"" + name + "\": \"lquantize\" requires a positive \"step\"");
        }
    }

    public static Breakdown of(String name) {
        return new Breakdown(name, name, Aggregation.NONE, null, null);
    }

    public static Breakdown quantize(String name) {
        return new Breakdown(name, name, Aggregation.QUANTIZE, null, null);
    }

    public static Breakdown lquantize(String name, double step) {
        return new Breakdown(name, name, Aggregation.LQUANTIZE, step, null);
    }

    public boolean isBucketed() {
        return aggr != Aggregation.NONE;
    }

    public boolean isSynthetic() {
        return date != null;
    }

    /** Accepts either an object ({@code {"name": .., "aggr": ..}}) or the bracketed string shorthand. */
    public static Breakdown fromJson(JsonNode node) {
        if (node.isTextual()) {
            return BreakdownParser.parseOne(node.asText());
        }
        if (!node.isObject()) {
            throw new ConfigException("breakdown must be a string or an object: " + node);
        }
        Iterator<String> names = node.fieldNames();
        while (names.hasNext()) {
            String key = names.next();
            if (!KEYS.contains(key)) {
                throw new ConfigException("breakdown: unsupported property \"" + key + "\"");
            }
        }
        JsonNode step = node.get("step");
        if (step != null && !step.isNumber()) {
            throw new ConfigException("breakdown: \"step\" must be a number");
        }
        return new Breakdown(
                text(node, "name"),
                text(node, "field"),
                Aggregation.fromLabel(text(node, "aggr")),
                step == null ? null : step.asDouble(),
                text(node, "date"));
    }

    private static String text(JsonNode node, String key) {
        JsonNode v = node.get(key);
        return v == null || v.isNull() ? null : v.asText();
    }

    public ObjectNode toJson() {
        ObjectNode node = JsonUtil.object();
        node.put("name", name);
        node.put("field", field);
        if (aggr != Aggregation.NONE) {
            node.put("aggr", aggr.label());
        }
        if (step != null) {
            node.put("step", step);
        }
        if (date != null) {
            node.put("date", date);
        }
        return node;
    }
}
