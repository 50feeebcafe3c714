package com.dragnet.core.query;

import com.dragnet.core.filter.FilterPredicate;
import com.dragnet.core.model.Breakdown;
import java.util.List;

/**
 * Executable parts of a query.
 *
 * @param filter the query's own filter, or {@code null}
 * @param timeBounds half-open time range on {@code __dn_ts}, or {@code null}
 * @param syntheticFields date fields to derive before filtering by time, in order
 * @param breakdowns grouping passed to the aggregator
 */
public record CompiledQuery(
        FilterPredicate filter,
        FilterPredicate timeBounds,
        List<Breakdown> syntheticFields,
        List<Breakdown> breakdowns) {

    public CompiledQuery {
        syntheticFields = List.copyOf(syntheticFields);
        breakdowns = List.copyOf(breakdowns);
    }
}
