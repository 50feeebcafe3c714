package com.dragnet.core.model;

import com.dragnet.core.exception.ConfigException;
import com.dragnet.core.filter.FilterPredicate;
import com.fasterxml.jackson.databind.JsonNode;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * What to count: an optional filter, the breakdowns to group by and an optional half-open time range {@code [after,
 * before)}.
 */
public record QueryConfig(FilterPredicate filter, List<Breakdown> breakdowns, Instant after, Instant before) {

    public QueryConfig {
        breakdowns = breakdowns == null ? List.of() : List.copyOf(breakdowns);
        if ((after == null) != (before == null)) {
            throw new ConfigException("\"after\" and \"before\" must be specified together");
        }
        if (after != null && after.isAfter(before)) {
            throw new ConfigException("\"after\" must not be later than \"before\"");
        }
        validateBreakdowns(breakdowns);
    }

    public static QueryConfig of(FilterPredicate filter, List<Breakdown> breakdowns) {
        return new QueryConfig(filter, breakdowns, null, null);
    }

    /**
     * Loads a user query: {@code {"filter": {..}, "breakdowns": [..], "timeAfter": iso, "timeBefore": iso}}. Breakdown
     * names in the reserved {@code __dn} namespace are rejected.
     */
    public static QueryConfig fromJson(JsonNode node) {
        if (node == null || !node.isObject()) {
            throw new ConfigException("invalid query: expected an object");
        }
        FilterPredicate filter = null;
        JsonNode rawFilter = node.get("filter");
        if (rawFilter != null && !rawFilter.isNull()) {
            try {
                filter = FilterPredicate.compile(rawFilter);
            } catch (ConfigException e) {
                throw new ConfigException("invalid query: invalid filter: " + e.getMessage(), e);
            }
        }
        List<Breakdown> breakdowns = new ArrayList<>();
        JsonNode rawBreakdowns = node.get("breakdowns");
        if (rawBreakdowns != null && !rawBreakdowns.isNull()) {
            if (!rawBreakdowns.isArray()) {
                throw new ConfigException("invalid query: \"breakdowns\" must be an array");
            }
            for (int i = 0; i < rawBreakdowns.size(); i++) {
                Breakdown b;
                try {
                    b = Breakdown.fromJson(rawBreakdowns.get(i));
                } catch (ConfigException e) {
                    throw new ConfigException("invalid query: field " + i + " is invalid: " + e.getMessage(), e);
                }
                if (DragnetFields.isReserved(b.name())) {
                    throw new ConfigException("invalid query: field " + i + " (\"" + b.name()
                            + "\") uses the reserved prefix \"" + DragnetFields.RESERVED_PREFIX + "\"");
                }
                breakdowns.add(b);
            }
        }
        return new QueryConfig(filter, breakdowns, instant(node, "timeAfter"), instant(node, "timeBefore"));
    }

    private static Instant instant(JsonNode node, String key) {
        JsonNode v = node.get(key);
        if (v == null || v.isNull()) {
            return null;
        }
        try {
            return Instant.parse(v.asText());
        } catch (DateTimeParseException e) {
            throw new ConfigException("\"" + key + "\" is not a valid date: \"" + v.asText() + "\"", e);
        }
    }

    /**
     * Names must be unique and a {@code quantize} breakdown must come last. {@code lquantize} breakdowns may appear
     * anywhere: hourly and daily metrics lead with the {@code lquantize}d {@code __dn_ts} column.
     */
    static void validateBreakdowns(List<Breakdown> breakdowns) {
        Set<String> names = new HashSet<>();
        for (int i = 0; i < breakdowns.size(); i++) {
            Breakdown b = breakdowns.get(i);
            if (!names.add(b.name())) {
                throw new ConfigException("breakdown " + i + " (\"" + b.name() + "\"): duplicate name");
            }
            if (b.aggr() == Aggregation.QUANTIZE && i != breakdowns.size() - 1) {
                throw new ConfigException(
                        "breakdown " + i + " (\"" + b.name() + "\"): quantized breakdowns must be last");
            }
        }
    }

    public boolean hasTimeBounds() {
        return after != null;
    }

    public QueryConfig withTimeBounds(Instant newAfter, Instant newBefore) {
        return new QueryConfig(filter, breakdowns, newAfter, newBefore);
    }

    public List<String> breakdownNames() {
        return breakdowns.stream().map(Breakdown::name).toList();
    }

    /** Breakdowns whose value is derived by parsing a date. */
    public List<Breakdown> syntheticFields() {
        return breakdowns.stream().filter(Breakdown::isSynthetic).toList();
    }

    public Breakdown breakdown(String name) {
        return breakdowns.stream().filter(b -> b.name().equals(name)).findFirst().orElse(null);
    }
}
