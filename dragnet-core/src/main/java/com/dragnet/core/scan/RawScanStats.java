package com.dragnet.core.scan;

import com.dragnet.core.pipeline.PipelineStats;

/**
 * Counters of one raw scan.
 *
 * @param inputs records read from the source
 * @param filteredOut records rejected by the datasource or query filter
 * @param filterErrors records a filter could not be evaluated on
 * @param syntheticErrors records dropped because a date field was missing or invalid
 * @param timeFilteredOut records outside the query's time bounds
 * @param aggregated points accepted by the aggregator
 * @param nonNumeric points dropped for a non-numeric bucketed value
 */
public record RawScanStats(
        long inputs,
        long filteredOut,
        long filterErrors,
        long syntheticErrors,
        long timeFilteredOut,
        long aggregated,
        long nonNumeric) {

    static RawScanStats from(PipelineStats stats, String firstStage) {
        long filteredOut = stats.counter(RawScan.DATASOURCE_FILTER, FilterStage.FILTERED_OUT)
                + stats.counter(RawScan.QUERY_FILTER, FilterStage.FILTERED_OUT);
        long filterErrors = stats.counter(RawScan.DATASOURCE_FILTER, FilterStage.FAILED_EVAL)
                + stats.counter(RawScan.QUERY_FILTER, FilterStage.FAILED_EVAL)
                + stats.counter(RawScan.TIME_FILTER, FilterStage.FAILED_EVAL);
        return new RawScanStats(
                stats.counter(firstStage, "ninputs"),
                filteredOut,
                filterErrors,
                stats.counter(SyntheticFieldStage.NAME, SyntheticFieldStage.UNDEFINED)
                        + stats.counter(SyntheticFieldStage.NAME, SyntheticFieldStage.BAD_DATE),
                stats.counter(RawScan.TIME_FILTER, FilterStage.FILTERED_OUT),
                stats.counter(AggregationStage.NAME, AggregationStage.PROCESSED),
                stats.counter(AggregationStage.NAME, AggregationStage.NON_NUMERIC));
    }
}
