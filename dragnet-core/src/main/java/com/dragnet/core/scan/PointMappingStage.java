package com.dragnet.core.scan;

import com.dragnet.core.aggregate.PointAggregator;
import com.dragnet.core.model.AggregatedPoint;
import com.dragnet.core.model.Breakdown;
import com.dragnet.core.pipeline.Stage;
import com.dragnet.core.pipeline.StageContext;
import java.util.List;
import java.util.Map;

/** Turns each record into a point worth one. */
public final class PointMappingStage implements Stage<Map<String, Object>, AggregatedPoint> {

    public static final String NAME = "points";

    private final List<Breakdown> projection;

    /** Keeps every record field. */
    public PointMappingStage() {
        this(null);
    }

    /** Keeps only the values of {@code projection}, keyed by breakdown name. */
    public PointMappingStage(List<Breakdown> projection) {
        this.projection = projection == null ? null : List.copyOf(projection);
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public void process(Map<String, Object> record, StageContext<AggregatedPoint> context) {
        Map<String, ?> fields = projection == null ? record : PointAggregator.project(record, projection);
        context.emit(AggregatedPoint.of(fields, 1));
    }
}
