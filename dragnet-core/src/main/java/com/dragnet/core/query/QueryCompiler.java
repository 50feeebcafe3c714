package com.dragnet.core.query;

import com.dragnet.core.exception.ConfigException;
import com.dragnet.core.filter.FilterPredicate;
import com.dragnet.core.json.JsonUtil;
import com.dragnet.core.model.Breakdown;
import com.dragnet.core.model.DragnetFields;
import com.dragnet.core.model.QueryConfig;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/** Turns a {@link QueryConfig} into the predicates and aggregator a scan runs. */
public final class QueryCompiler {

    private QueryCompiler() {}

    /**
     * @param timeField record field holding the record time; required when the query has time bounds
     */
    public static CompiledQuery compile(QueryConfig query, String timeField) {
        List<Breakdown> synthetic = new ArrayList<>(query.syntheticFields());
        FilterPredicate timeBounds = null;
        if (query.hasTimeBounds()) {
            if (timeField == null) {
                throw new ConfigException("queries with time bounds require a time field");
            }
            if (query.breakdown(DragnetFields.TIMESTAMP) == null) {
                synthetic.add(new Breakdown(DragnetFields.TIMESTAMP, timeField, null, null, ""));
            }
            timeBounds = timeBoundsFilter(query, DragnetFields.TIMESTAMP);
        }
        return new CompiledQuery(query.filter(), timeBounds, synthetic, query.breakdowns());
    }

    /**
     * {@code {"and": [{"ge": [field, ceil(after)]}, {"lt": [field, ceil(before)]}]}} with times in epoch seconds, or
     * {@code null} when the query has no time bounds.
     */
    public static FilterPredicate timeBoundsFilter(QueryConfig query, String field) {
        if (!query.hasTimeBounds()) {
            return null;
        }
        ObjectNode root = JsonUtil.object();
        ArrayNode and = root.putArray("and");
        and.addObject().putArray("ge").add(field).add(ceilSeconds(query.after()));
        and.addObject().putArray("lt").add(field).add(ceilSeconds(query.before()));
        return FilterPredicate.compile(root);
    }

    static long ceilSeconds(Instant instant) {
        return instant.getNano() > 0 ? instant.getEpochSecond() + 1 : instant.getEpochSecond();
    }
}
