package com.dragnet.core.model;

import com.dragnet.core.exception.ConfigException;
import com.dragnet.core.filter.FilterPredicate;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Declares an index: the columns metrics may break down by, a filter every indexed record must pass, and how output
 * files are split by time.
 */
public record IndexConfig(
        String name, String root, List<Breakdown> columns, FilterPredicate filter, Interval interval) {

    public IndexConfig {
        if (name == null || name.isEmpty()) {
            throw new ConfigException("index name is required");
        }
        columns = List.copyOf(columns == null ? List.of() : columns);
        interval = interval == null ? Interval.ALL : interval;
        Map<String, Breakdown> seen = new LinkedHashMap<>();
        for (Breakdown column : columns) {
            if (seen.put(column.name(), column) != null) {
                throw new ConfigException("index \"" + name + "\": duplicate column \"" + column.name() + "\"");
            }
        }
    }

    public static IndexConfig fromJson(JsonNode node) {
        if (node == null || !node.isObject()) {
            throw new ConfigException("invalid index: expected an object");
        }
        FilterPredicate filter = null;
        JsonNode rawFilter = node.get("filter");
        if (rawFilter != null && !rawFilter.isNull()) {
            try {
                filter = FilterPredicate.compile(rawFilter);
            } catch (ConfigException e) {
                throw new ConfigException("invalid filter: " + e.getMessage(), e);
            }
        }
        List<Breakdown> columns = new ArrayList<>();
        JsonNode rawColumns = node.path("columns");
        for (int i = 0; i < rawColumns.size(); i++) {
            try {
                columns.add(Breakdown.fromJson(rawColumns.get(i)));
            } catch (ConfigException e) {
                throw new ConfigException("field \"" + i + "\" is invalid: " + e.getMessage(), e);
            }
        }
        return new IndexConfig(
                node.path("name").asText(null),
                node.path("root").asText(null),
                columns,
                filter,
                Interval.fromLabel(node.path("interval").asText(null)));
    }

    public Map<String, Breakdown> columnsByName() {
        Map<String, Breakdown> byName = new LinkedHashMap<>();
        columns.forEach(c -> byName.put(c.name(), c));
        return Collections.unmodifiableMap(byName);
    }

    /**
     * A metric over this index's columns. The index filter, if any, is combined with the metric's own filter.
     *
     * @param breakdownNames column names, in grouping order
     */
    public Metric metric(int id, String label, FilterPredicate metricFilter, List<String> breakdownNames) {
        return new Metric(id, label, FilterPredicate.and(filter, metricFilter), resolve(breakdownNames));
    }

    /** Looks up column definitions for a metric's breakdown names. */
    public List<Breakdown> resolve(List<String> names) {
        Map<String, Breakdown> byName = columnsByName();
        List<Breakdown> resolved = new ArrayList<>(names.size());
        for (int i = 0; i < names.size(); i++) {
            Breakdown column = byName.get(names.get(i));
            if (column == null) {
                throw new ConfigException("breakdown " + i + " (\"" + names.get(i) + "\"): field is not indexed");
            }
            resolved.add(column);
        }
        QueryConfig.validateBreakdowns(resolved);
        return resolved;
    }
}
