package com.dragnet.core.scan;

import com.dragnet.core.aggregate.PointAggregator;
import com.dragnet.core.model.AggregatedPoint;
import com.dragnet.core.pipeline.Stage;
import com.dragnet.core.pipeline.StageContext;

/** Feeds every point to an aggregator and emits the aggregated points at end of input. */
public final class AggregationStage implements Stage<AggregatedPoint, AggregatedPoint> {

    public static final String NAME = "aggregate";
    public static final String PROCESSED = "nprocessed";
    public static final String NON_NUMERIC = "nerr_nonnumeric";

    private final PointAggregator aggregator;

    public AggregationStage(PointAggregator aggregator) {
        this.aggregator = aggregator;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public void process(AggregatedPoint point, StageContext<AggregatedPoint> context) {
        context.bump(aggregator.add(point) ? PROCESSED : NON_NUMERIC);
    }

    @Override
    public void finish(StageContext<AggregatedPoint> context) {
        for (AggregatedPoint point : aggregator.results()) {
            context.emit(point);
        }
    }

    public PointAggregator aggregator() {
        return aggregator;
    }
}
