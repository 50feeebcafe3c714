package com.dragnet.service.storage.query;

import com.dragnet.core.exception.PlanException;
import com.dragnet.core.model.DragnetFields;
import com.dragnet.core.model.Metric;
import com.dragnet.core.model.QueryConfig;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;

/**
 * Picks the metric that answers a query. Metrics are tried in declaration order and the first one that fits wins.
 *
 * <p>A filtered metric fits only a query with exactly the same filter. An unfiltered metric fits if it has a column
 * for every breakdown and every field the query filters on. Time-bounded queries also need the {@code __dn_ts}
 * column.
 */
@Slf4j
public final class MetricPlanner {

    private final List<Metric> metrics;

    public MetricPlanner(List<Metric> metrics) {
        this.metrics = List.copyOf(metrics);
    }

    public MetricSelection findMetric(QueryConfig query) {
        String queryFilter = query.filter() == null ? null : query.filter().serialize();
        for (Metric metric : metrics) {
            List<String> needed = new ArrayList<>(query.breakdownNames());
            boolean filterApplied = false;
            if (metric.filter() != null) {
                if (!metric.filter().serialize().equals(queryFilter)) {
                    continue;
                }
                filterApplied = true;
            } else if (query.filter() != null) {
                needed.addAll(query.filter().fields());
            }
            if (query.hasTimeBounds()) {
                needed.add(DragnetFields.TIMESTAMP);
            }
            Set<String> available = new HashSet<>(metric.breakdownNames());
            if (available.containsAll(needed)) {
                log.debug("Selected metric id={} label={} filterApplied={}", metric.id(), metric.label(), filterApplied);
                return new MetricSelection(metric, filterApplied);
            }
        }
        throw new PlanException("no metrics available to serve query");
    }
}
