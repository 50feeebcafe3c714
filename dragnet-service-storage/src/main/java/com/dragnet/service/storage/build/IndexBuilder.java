package com.dragnet.service.storage.build;

import com.dragnet.core.model.AggregatedPoint;
import com.dragnet.core.model.Interval;
import com.dragnet.core.model.Metric;
import com.dragnet.core.pipeline.Pipeline;
import com.dragnet.core.pipeline.PipelineStats;
import com.dragnet.core.scan.FilterStage;
import com.dragnet.core.scan.PointMappingStage;
import com.dragnet.service.storage.sink.IndexSink;
import com.dragnet.service.storage.sink.IndexSinkMultiplexer;
import com.dragnet.service.storage.sink.IndexSinkStage;
import com.dragnet.service.storage.sink.PointSink;
import com.dragnet.service.storage.sqlite.IndexSchema;
import java.time.Instant;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Runs the index build pipeline: index filter, point mapping, per-metric aggregation, then the SQLite sink. Nothing
 * is published unless the whole source was read without a stage failing.
 */
@Slf4j
@RequiredArgsConstructor
public final class IndexBuilder {

    public static final String INDEX_FILTER = "index-filter";

    private final int bufferSize;
    private final Executor executor;

    public IndexBuildResult build(IndexBuildRequest request, Iterator<Map<String, Object>> source) {
        Interval interval = request.interval();
        List<Metric> metrics = request.metrics().stream()
                .map(m -> m.materialize(interval, request.timeField()))
                .toList();
        MetricAggregationStage aggregation =
                new MetricAggregationStage(metrics, request.timeField(), request.after(), request.before());
        IndexSinkStage sinkStage = new IndexSinkStage(sink(request, metrics));

        Pipeline.Builder<Map<String, Object>, Map<String, Object>> builder =
                Pipeline.builder("build-" + request.indexName(), bufferSize);
        if (request.filter() != null) {
            builder = builder.then(new FilterStage(INDEX_FILTER, request.filter()));
        }
        Pipeline.Builder<Map<String, Object>, AggregatedPoint> points = builder.then(new PointMappingStage());

        log.info(
                "Building index name={} interval={} metrics={} root={}",
                request.indexName(),
                interval.label(),
                metrics.size(),
                request.root());
        try (Pipeline<Map<String, Object>, Void> pipeline =
                points.then(aggregation).then(sinkStage).build()) {
            pipeline.start(source);
            pipeline.drain();
            PipelineStats stats = pipeline.stats();
            log.info(
                    "Index build complete name={} files={} stats={}",
                    request.indexName(),
                    sinkStage.published().size(),
                    stats.counters());
            return new IndexBuildResult(sinkStage.published(), stats);
        }
    }

    private PointSink sink(IndexBuildRequest request, List<Metric> metrics) {
        Map<String, String> config = new LinkedHashMap<>();
        config.put(IndexSchema.KEY_INDEX_NAME, request.indexName());
        if (request.user() != null) {
            config.put(IndexSchema.KEY_USER, request.user());
        }
        config.put(IndexSchema.KEY_MTIME, Instant.now().toString());
        if (request.interval() == Interval.ALL) {
            return new IndexSink(
                    request.root().resolve(Interval.ALL.directory()), metrics, config, executor);
        }
        return new IndexSinkMultiplexer(request.root(), request.interval(), metrics, config, executor);
    }
}
