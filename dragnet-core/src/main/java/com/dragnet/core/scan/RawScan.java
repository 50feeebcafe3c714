package com.dragnet.core.scan;

import com.dragnet.core.aggregate.PointAggregator;
import com.dragnet.core.filter.FilterPredicate;
import com.dragnet.core.model.AggregatedPoint;
import com.dragnet.core.model.QueryConfig;
import com.dragnet.core.pipeline.Pipeline;
import com.dragnet.core.query.CompiledQuery;
import com.dragnet.core.query.QueryCompiler;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;

/**
 * Answers a query by reading every raw record: datasource filter, query filter, date fields, time bounds, then
 * aggregation. Filters that are absent are left out of the pipeline.
 */
@Slf4j
public final class RawScan {

    public static final String DATASOURCE_FILTER = "datasource-filter";
    public static final String QUERY_FILTER = "query-filter";
    public static final String TIME_FILTER = "time-filter";

    private final QueryConfig query;
    private final CompiledQuery compiled;
    private final FilterPredicate datasourceFilter;
    private final int bufferSize;

    /**
     * @param timeField record field holding the record time, may be {@code null} for queries without time bounds
     * @param datasourceFilter filter every record of the datasource must pass, may be {@code null}
     */
    public RawScan(QueryConfig query, String timeField, FilterPredicate datasourceFilter, int bufferSize) {
        this.query = query;
        this.compiled = QueryCompiler.compile(query, timeField);
        this.datasourceFilter = datasourceFilter;
        this.bufferSize = bufferSize;
    }

    /** Reads {@code source} to the end and aggregates it. */
    public RawScanResult run(Iterator<Map<String, Object>> source) {
        PointAggregator aggregator = new PointAggregator(compiled.breakdowns());
        Pipeline.Builder<Map<String, Object>, Map<String, Object>> builder = Pipeline.builder("scan", bufferSize);
        String first = null;
        if (datasourceFilter != null) {
            builder = builder.then(new FilterStage(DATASOURCE_FILTER, datasourceFilter));
            first = DATASOURCE_FILTER;
        }
        if (compiled.filter() != null) {
            builder = builder.then(new FilterStage(QUERY_FILTER, compiled.filter()));
            first = first == null ? QUERY_FILTER : first;
        }
        if (!compiled.syntheticFields().isEmpty()) {
            builder = builder.then(new SyntheticFieldStage(compiled.syntheticFields()));
            first = first == null ? SyntheticFieldStage.NAME : first;
        }
        if (compiled.timeBounds() != null) {
            builder = builder.then(new FilterStage(TIME_FILTER, compiled.timeBounds()));
            first = first == null ? TIME_FILTER : first;
        }
        first = first == null ? PointMappingStage.NAME : first;

        try (Pipeline<Map<String, Object>, AggregatedPoint> pipeline = builder.then(
                        new PointMappingStage(compiled.breakdowns()))
                .then(new AggregationStage(aggregator))
                .build()) {
            pipeline.start(source);
            List<AggregatedPoint> points = pipeline.drain();
            RawScanStats stats = RawScanStats.from(pipeline.stats(), first);
            log.debug("Raw scan complete breakdowns={} points={} stats={}", query.breakdownNames(), points.size(), stats);
            return new RawScanResult(points, stats, aggregator.bucketizers());
        }
    }
}
