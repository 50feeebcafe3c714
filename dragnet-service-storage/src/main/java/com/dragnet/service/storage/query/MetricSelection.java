package com.dragnet.service.storage.query;

import com.dragnet.core.model.Metric;

/**
 * The metric chosen to answer a query.
 *
 * @param filterApplied the metric's rows were already filtered with the query's filter, so it must not be applied
 *     again
 */
public record MetricSelection(Metric metric, boolean filterApplied) {

    public String tableName() {
        return metric.tableName();
    }
}
