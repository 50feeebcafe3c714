package com.dragnet.service.storage.build;

import com.dragnet.core.aggregate.PointAggregator;
import com.dragnet.core.exception.FilterEvaluationException;
import com.dragnet.core.filter.FilterPredicate;
import com.dragnet.core.model.AggregatedPoint;
import com.dragnet.core.model.DragnetFields;
import com.dragnet.core.model.Metric;
import com.dragnet.core.pipeline.Stage;
import com.dragnet.core.pipeline.StageContext;
import com.dragnet.core.query.CompiledQuery;
import com.dragnet.core.query.QueryCompiler;
import com.dragnet.core.scan.AggregationStage;
import com.dragnet.core.scan.FilterStage;
import com.dragnet.core.scan.SyntheticFieldStage;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Computes every metric of an index over one stream of points. Each metric applies its own filter, date fields and
 * time bounds and groups by its own breakdowns; results are emitted at end of input, tagged with {@code __dn_metric}.
 */
public final class MetricAggregationStage implements Stage<AggregatedPoint, AggregatedPoint> {

    public static final String NAME = "metrics";
    public static final String TIME_FILTERED_OUT = "ntimefilteredout";

    private final List<MetricAggregation> aggregations = new ArrayList<>();

    /**
     * @param metrics metrics as stored, i.e. already materialized for the build interval
     * @param timeField record time field; required for time-bounded builds and date breakdowns
     */
    public MetricAggregationStage(List<Metric> metrics, String timeField, Instant after, Instant before) {
        for (Metric metric : metrics) {
            CompiledQuery compiled = QueryCompiler.compile(metric.query(after, before), timeField);
            aggregations.add(new MetricAggregation(metric, compiled, new PointAggregator(compiled.breakdowns())));
        }
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public void process(AggregatedPoint point, StageContext<AggregatedPoint> context) {
        for (MetricAggregation aggregation : aggregations) {
            aggregation.accept(point, context);
        }
    }

    @Override
    public void finish(StageContext<AggregatedPoint> context) {
        for (MetricAggregation aggregation : aggregations) {
            int id = aggregation.metric().id();
            for (AggregatedPoint result : aggregation.aggregator().results()) {
                context.emit(result.withField(DragnetFields.METRIC, id));
            }
        }
    }

    private record MetricAggregation(Metric metric, CompiledQuery compiled, PointAggregator aggregator) {

        void accept(AggregatedPoint point, StageContext<AggregatedPoint> context) {
            Map<String, Object> fields = point.fields();
            if (!passes(compiled.filter(), fields, FilterStage.FILTERED_OUT, context)) {
                return;
            }
            if (!compiled.syntheticFields().isEmpty()) {
                Map<String, Object> extended = new LinkedHashMap<>(fields);
                String error = SyntheticFieldStage.derive(fields, compiled.syntheticFields(), extended);
                if (error != null) {
                    context.bump(error);
                    return;
                }
                fields = extended;
            }
            if (!passes(compiled.timeBounds(), fields, TIME_FILTERED_OUT, context)) {
                return;
            }
            AggregatedPoint projected =
                    AggregatedPoint.of(PointAggregator.project(fields, compiled.breakdowns()), point.value());
            context.bump(aggregator.add(projected) ? AggregationStage.PROCESSED : AggregationStage.NON_NUMERIC);
        }

        private static boolean passes(
                FilterPredicate predicate,
                Map<String, Object> fields,
                String rejected,
                StageContext<AggregatedPoint> context) {
            if (predicate == null) {
                return true;
            }
            try {
                if (predicate.eval(fields)) {
                    return true;
                }
                context.bump(rejected);
            } catch (FilterEvaluationException e) {
                context.warn(FilterStage.FAILED_EVAL, e);
            }
            return false;
        }
    }
}
