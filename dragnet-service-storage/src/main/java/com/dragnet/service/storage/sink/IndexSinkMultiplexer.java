package com.dragnet.service.storage.sink;

import com.dragnet.core.model.AggregatedPoint;
import com.dragnet.core.model.DragnetFields;
import com.dragnet.core.model.FieldValues;
import com.dragnet.core.model.Interval;
import com.dragnet.core.model.Metric;
import com.dragnet.service.storage.sqlite.IndexSchema;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.Executor;
import lombok.extern.slf4j.Slf4j;

/**
 * Routes points to one {@link IndexSink} per time bucket, e.g. {@code by_hour/2014-07-02-00.sqlite}, using each
 * point's {@code __dn_ts} field. Sinks are created on first use. Either every file is published or none is.
 */
@Slf4j
public final class IndexSinkMultiplexer implements PointSink {

    private final Path directory;
    private final Interval interval;
    private final List<Metric> metrics;
    private final Map<String, String> config;
    private final Executor executor;
    private final TreeMap<Long, IndexSink> sinks = new TreeMap<>();

    /**
     * @param root index root; files go under {@code root/<interval directory>}
     */
    public IndexSinkMultiplexer(
            Path root, Interval interval, List<Metric> metrics, Map<String, String> config, Executor executor) {
        if (interval == Interval.ALL) {
            throw new IllegalArgumentException("interval \"all\" is written by a single sink");
        }
        this.directory = root.resolve(interval.directory());
        this.interval = interval;
        this.metrics = List.copyOf(metrics);
        this.config = new LinkedHashMap<>(config);
        this.executor = executor;
    }

    @Override
    public synchronized void write(AggregatedPoint point) {
        Double ts = FieldValues.asDouble(point.field(DragnetFields.TIMESTAMP));
        if (ts == null) {
            throw new IllegalArgumentException("point has no numeric \"" + DragnetFields.TIMESTAMP + "\" field");
        }
        long bucket = interval.bucketStart((long) Math.floor(ts));
        sinks.computeIfAbsent(bucket, this::createSink).write(point);
    }

    private IndexSink createSink(long bucket) {
        Map<String, String> bucketConfig = new LinkedHashMap<>(config);
        bucketConfig.put(IndexSchema.KEY_START, Long.toString(bucket));
        Path file = directory.resolve(interval.fileName(bucket));
        log.debug("Creating index sink file={} bucket={}", file, bucket);
        return new IndexSink(file, metrics, bucketConfig, executor);
    }

    /**
     * Completes every file before renaming any of them. If a file cannot be completed or renamed, the files already
     * renamed are removed again and the indexes they replaced are put back.
     */
    @Override
    public synchronized List<Path> flush() {
        List<Path> published = new ArrayList<>(sinks.size());
        try {
            for (IndexSink sink : sinks.values()) {
                sink.complete();
            }
            for (IndexSink sink : sinks.values()) {
                sink.publish();
                published.add(sink.target());
            }
        } catch (RuntimeException e) {
            log.error("Publishing indexes failed directory={} published={} of {}", directory, published.size(),
                    sinks.size(), e);
            abortAll();
            throw e;
        }
        sinks.values().forEach(IndexSink::commit);
        return published;
    }

    @Override
    public synchronized void abort() {
        abortAll();
    }

    private void abortAll() {
        sinks.values().forEach(IndexSink::abort);
    }
}
