package com.dragnet.core.model;

import com.dragnet.core.exception.ConfigException;
import com.dragnet.core.filter.FilterPredicate;
import com.dragnet.core.json.JsonUtil;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * A pre-aggregated view stored in an index: one table of breakdown values and counts.
 *
 * @param id stable identifier, also the table suffix
 * @param filter records counted by this metric, or {@code null} for all
 */
public record Metric(int id, String label, FilterPredicate filter, List<Breakdown> breakdowns) {

    public static final String TABLE_PREFIX = "dragnet_index_";

    public Metric {
        if (id < 0) {
            throw new ConfigException("metric id must not be negative");
        }
        if (label == null) {
            label = "metric" + id;
        }
        breakdowns = List.copyOf(breakdowns == null ? List.of() : breakdowns);
        QueryConfig.validateBreakdowns(breakdowns);
    }

    public String tableName() {
        return TABLE_PREFIX + id;
    }

    public List<String> breakdownNames() {
        return breakdowns.stream().map(Breakdown::name).toList();
    }

    /**
     * The metric as stored for a build at {@code interval}: time-split builds group by the record time bucket first so
     * the output can be routed to per-bucket files.
     */
    public Metric materialize(Interval interval, String timeField) {
        if (interval == Interval.ALL || breakdownNames().contains(DragnetFields.TIMESTAMP)) {
            return this;
        }
        if (timeField == null) {
            throw new ConfigException("index interval \"" + interval.label() + "\" requires a time field");
        }
        List<Breakdown> withTime = new ArrayList<>(breakdowns.size() + 1);
        withTime.add(new Breakdown(
                DragnetFields.TIMESTAMP, timeField, Aggregation.LQUANTIZE, (double) interval.seconds(), ""));
        withTime.addAll(breakdowns);
        return new Metric(id, label, filter, withTime);
    }

    /** The raw-scan query that computes this metric's rows. */
    public QueryConfig query(Instant after, Instant before) {
        return new QueryConfig(filter, breakdowns, after, before);
    }

    public String filterJson() {
        return filter == null ? null : filter.serialize();
    }

    public String paramsJson() {
        ArrayNode params = JsonUtil.mapper().createArrayNode();
        breakdowns.forEach(b -> params.add(b.toJson()));
        return JsonUtil.toJson(params);
    }

    /** Rebuilds a metric from the JSON columns an index stores it in. */
    public static Metric fromStored(int id, String label, String filterJson, String paramsJson) {
        FilterPredicate filter = filterJson == null || filterJson.isEmpty() ? null : FilterPredicate.compile(filterJson);
        JsonNode params = JsonUtil.parse(paramsJson == null ? "[]" : paramsJson);
        List<Breakdown> breakdowns = new ArrayList<>();
        for (JsonNode node : params) {
            breakdowns.add(Breakdown.fromJson(node));
        }
        return new Metric(id, label, filter, breakdowns);
    }
}
