package com.dragnet.datasource.file;

import com.dragnet.core.aggregate.PointAggregator;
import com.dragnet.core.datasource.BuildOptions;
import com.dragnet.core.datasource.BuildResult;
import com.dragnet.core.datasource.Datasource;
import com.dragnet.core.datasource.DatasourceConfig;
import com.dragnet.core.datasource.DatasourceSettings;
import com.dragnet.core.datasource.QueryResult;
import com.dragnet.core.exception.ConfigException;
import com.dragnet.core.filter.FilterPredicate;
import com.dragnet.core.model.AggregatedPoint;
import com.dragnet.core.model.Interval;
import com.dragnet.core.model.Metric;
import com.dragnet.core.model.QueryConfig;
import com.dragnet.core.pipeline.PipelineStats;
import com.dragnet.core.scan.RawScan;
import com.dragnet.core.scan.RawScanResult;
import com.dragnet.core.time.PartitionEnumerator;
import com.dragnet.core.time.TimeStringFilter;
import com.dragnet.service.storage.build.IndexBuildRequest;
import com.dragnet.service.storage.build.IndexBuildResult;
import com.dragnet.service.storage.build.IndexBuilder;
import com.dragnet.service.storage.query.IndexQuerier;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Predicate;
import lombok.extern.slf4j.Slf4j;

/**
 * Datasource over a local directory tree of newline-separated JSON files.
 *
 * <p>Backend settings: {@code path} (required) is the data root; {@code timeFormat} names the partition layout below
 * it, e.g. {@code %Y/%m/%d}, and lets time-bounded requests read only the matching directories; {@code timeField} is
 * the record field holding the record time; {@code indexPath} is where indexes are built and queried.
 */
@Slf4j
public final class FileDatasource implements Datasource {

    public static final String PATH = "path";
    public static final String TIME_FORMAT = "timeFormat";
    public static final String TIME_FIELD = "timeField";
    public static final String INDEX_PATH = "indexPath";

    private static final String INDEX_SUFFIX = ".sqlite";

    private final String name;
    private final Path dataPath;
    private final String timeFormat;
    private final String timeField;
    private final Path indexPath;
    private final FilterPredicate filter;
    private final DatasourceSettings settings;
    private final FileFinder finder;
    private final ExecutorService indexExecutor;

    public FileDatasource(DatasourceConfig config, DatasourceSettings settings) {
        this.name = config.name();
        this.dataPath = Paths.get(config.requireSetting(PATH));
        this.timeFormat = emptyToNull(config.setting(TIME_FORMAT));
        this.timeField = emptyToNull(config.setting(TIME_FIELD));
        String index = emptyToNull(config.setting(INDEX_PATH));
        this.indexPath = index == null ? null : Paths.get(index);
        this.filter = config.filter();
        this.settings = settings;
        this.finder = new FileFinder(settings.finderWorkers());
        if (timeFormat != null) {
            // fail on a bad layout now rather than on the first time-bounded request
            TimeStringFilter.create(timeFormat);
        }
        AtomicInteger threads = new AtomicInteger();
        this.indexExecutor = Executors.newFixedThreadPool(2, r -> {
            Thread t = new Thread(r, "dragnet-" + name + "-index-" + threads.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    private static String emptyToNull(String s) {
        return s == null || s.isEmpty() ? null : s;
    }

    @Override
    public RawScanResult scan(QueryConfig query) {
        requireTimeField(query.after(), query.before());
        List<Path> files = findInputs(query.after(), query.before());
        try (JsonRecordReader reader = new JsonRecordReader(files)) {
            RawScanResult result = new RawScan(query, timeField, filter, settings.bufferSize()).run(reader);
            log.info(
                    "Scan complete datasource={} files={} records={} invalidLines={} points={}",
                    name,
                    files.size(),
                    result.stats().inputs(),
                    reader.invalidLines(),
                    result.points().size());
            return result;
        }
    }

    @Override
    public List<String> listInputs(QueryConfig query) {
        requireTimeField(query.after(), query.before());
        return findInputs(query.after(), query.before()).stream().map(Path::toString).toList();
    }

    @Override
    public BuildResult build(List<Metric> metrics, BuildOptions options) {
        checkTimeArgs(options.after(), options.before());
        requireIndexPath();
        if (options.interval() != Interval.ALL && timeField == null) {
            throw new ConfigException("datasource is missing \"" + TIME_FIELD + "\"");
        }
        requireTimeField(options.after(), options.before());

        List<Path> files = findInputs(options.after(), options.before());
        List<String> inputs = files.stream().map(Path::toString).toList();
        if (options.dryRun()) {
            log.info("Dry run datasource={} wouldScan={}", name, inputs.size());
            return new BuildResult(inputs, List.of(), new PipelineStats(Map.of()));
        }

        IndexBuildRequest request = new IndexBuildRequest(
                indexPath,
                name,
                metrics,
                filter,
                timeField,
                options.interval(),
                options.after(),
                options.before(),
                settings.user());
        try (JsonRecordReader reader = new JsonRecordReader(files)) {
            IndexBuildResult result = new IndexBuilder(settings.bufferSize(), indexExecutor).build(request, reader);
            return new BuildResult(
                    inputs,
                    result.files().stream().map(Path::toString).toList(),
                    result.stats());
        }
    }

    @Override
    public QueryResult query(QueryConfig query, Interval interval) {
        requireIndexPath();
        Interval chosen = interval == null ? Interval.ALL : interval;
        List<Path> indexes = findIndexes(query, chosen);
        PointAggregator aggregator = new PointAggregator(query.breakdowns());
        for (Path index : indexes) {
            IndexQuerier.open(index).run(query, aggregator);
        }
        List<AggregatedPoint> points = aggregator.results();
        log.info(
                "Index query complete datasource={} interval={} indexes={} points={}",
                name,
                chosen.label(),
                indexes.size(),
                points.size());
        return new QueryResult(points, indexes.stream().map(Path::toString).toList());
    }

    /** Index files that may hold data for the query; {@code all} is a single file that must exist. */
    List<Path> findIndexes(QueryConfig query, Interval interval) {
        if (interval == Interval.ALL) {
            return List.of(indexPath.resolve(Interval.ALL.directory()));
        }
        Path root = indexPath.resolve(interval.directory());
        List<Path> candidates;
        if (query.hasTimeBounds()) {
            candidates = new ArrayList<>();
            for (String file : PartitionEnumerator.enumerate(interval.fileNamePattern(), query.after(), query.before())) {
                Path p = root.resolve(file);
                if (Files.isRegularFile(p)) {
                    candidates.add(p);
                }
            }
        } else {
            candidates = finder.find(List.of(root)).files();
        }
        return candidates.stream()
                .filter(p -> p.getFileName().toString().endsWith(INDEX_SUFFIX))
                .toList();
    }

    /**
     * Raw data files to read. With time bounds and a partition layout only the partitions overlapping {@code [after,
     * before)} are listed.
     */
    List<Path> findInputs(Instant after, Instant before) {
        List<Path> roots;
        Predicate<Path> include = p -> true;
        if (after != null && timeFormat != null) {
            Set<Path> partitions = new LinkedHashSet<>();
            for (String partition : PartitionEnumerator.enumerate(timeFormat, after, before)) {
                partitions.add(dataPath.resolve(partition));
            }
            roots = new ArrayList<>(partitions);
            TimeStringFilter timeFilter = TimeStringFilter.create(timeFormat);
            include = p -> timeFilter.rangeContains(after, before, dataPath.relativize(p).toString());
        } else {
            if (after != null) {
                log.warn("Datasource {} is missing \"{}\" for time bounds; reading every file", name, TIME_FORMAT);
            }
            roots = List.of(dataPath);
        }
        FileFinder.Found found = finder.find(roots, include);
        found.errors().forEach(error -> log.debug("Datasource {} find error: {}", name, error));
        return found.files();
    }

    private static void checkTimeArgs(Instant after, Instant before) {
        if (after != null && before == null) {
            throw new ConfigException("cannot specify --after without --before");
        }
        if (before != null && after == null) {
            throw new ConfigException("cannot specify --before without --after");
        }
    }

    private void requireTimeField(Instant after, Instant before) {
        if (timeField == null && (after != null || before != null)) {
            throw new ConfigException(
                    "datasource is missing \"" + TIME_FIELD + "\" for \"before\" and \"after\" constraints");
        }
    }

    private void requireIndexPath() {
        if (indexPath == null) {
            throw new ConfigException("datasource is missing \"" + INDEX_PATH + "\"");
        }
    }

    @Override
    public void close() {
        indexExecutor.shutdown();
    }
}
