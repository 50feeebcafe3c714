package com.dragnet.service.storage.build;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.dragnet.core.exception.ConfigException;
import com.dragnet.core.exception.PipelineException;
import com.dragnet.core.filter.FilterPredicate;
import com.dragnet.core.model.AggregatedPoint;
import com.dragnet.core.model.Breakdown;
import com.dragnet.core.model.Interval;
import com.dragnet.core.model.Metric;
import com.dragnet.core.model.QueryConfig;
import com.dragnet.core.scan.RawScan;
import com.dragnet.service.storage.query.IndexQuerier;
import com.dragnet.service.storage.sqlite.IndexSchema;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.stream.Stream;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class IndexBuilderTest {

    private static final FilterPredicate GET = FilterPredicate.compile("{\"eq\": [\"req.method\", \"GET\"]}");

    private final ExecutorService executor = Executors.newFixedThreadPool(2);
    private final IndexBuilder builder = new IndexBuilder(8, executor);

    @TempDir
    Path root;

    @AfterEach
    void shutdown() {
        executor.shutdownNow();
    }

    private static Map<String, Object> record(String host, String method, int latency, String time) {
        Map<String, Object> record = new LinkedHashMap<>();
        record.put("host", host);
        record.put("req", Map.of("method", method));
        record.put("latency", latency);
        record.put("time", time);
        return record;
    }

    private static List<Map<String, Object>> records() {
        return List.of(
                record("a", "GET", 3, "2014-05-02T00:10:00Z"),
                record("a", "PUT", 5, "2014-05-02T00:20:00Z"),
                record("b", "GET", 1000, "2014-05-02T01:20:00Z"),
                record("b", "GET", 6, "2014-05-02T01:40:00Z"),
                record("c", "DELETE", 7, "2014-05-02T02:00:00Z"));
    }

    private static List<Metric> metrics() {
        return List.of(
                new Metric(0, "gets", GET, List.of(Breakdown.of("host"))),
                new Metric(1, "all", null, List.of(
                        Breakdown.of("host"), Breakdown.of("req.method"), Breakdown.quantize("latency"))));
    }

    private IndexBuildRequest request(Interval interval, Instant after, Instant before) {
        return new IndexBuildRequest(root, "muskie", metrics(), null, "time", interval, after, before, "tester");
    }

    private static List<AggregatedPoint> scan(QueryConfig query) {
        return new RawScan(query, "time", null, 4).run(records().iterator()).points();
    }

    @Test
    void singleIndexAnswersLikeARawScan() {
        IndexBuildResult result = builder.build(request(Interval.ALL, null, null), records().iterator());

        Path all = root.resolve("all");
        assertThat(result.files()).containsExactly(all);
        IndexQuerier querier = IndexQuerier.open(all);
        assertThat(querier.metadata().config())
                .containsEntry(IndexSchema.KEY_INDEX_NAME, "muskie")
                .containsEntry(IndexSchema.KEY_USER, "tester")
                .containsKey(IndexSchema.KEY_MTIME);
        assertThat(querier.metadata().metrics()).extracting(Metric::label).containsExactly("gets", "all");

        for (QueryConfig query : List.of(
                QueryConfig.of(GET, List.of(Breakdown.of("host"))),
                QueryConfig.of(null, List.of(Breakdown.of("req.method"))),
                QueryConfig.of(FilterPredicate.compile("{\"ne\": [\"host\", \"c\"]}"), List.of(Breakdown.quantize("latency"))),
                QueryConfig.of(null, List.of()))) {
            assertThat(querier.run(query)).containsExactlyInAnyOrderElementsOf(scan(query));
        }
        assertThat(result.stats().counter(MetricAggregationStage.NAME, "ninputs")).isEqualTo(5);
        assertThat(result.stats().counter(MetricAggregationStage.NAME, "nfilteredout")).isEqualTo(2);
    }

    @Test
    void missingAndMixedTypeFieldsAnswerLikeARawScan() {
        List<Map<String, Object>> records = List.of(
                Map.of("host", "a", "code", 200),
                Map.of("host", "b", "code", "200"),
                Map.of("other", "x"),
                Map.of("host", 7, "code", 503));
        List<Metric> metrics = List.of(new Metric(0, null, null, List.of(Breakdown.of("host"), Breakdown.of("code"))));
        builder.build(
                new IndexBuildRequest(root, "muskie", metrics, null, null, Interval.ALL, null, null, null),
                records.iterator());

        IndexQuerier querier = IndexQuerier.open(root.resolve("all"));
        for (QueryConfig query : List.of(
                QueryConfig.of(FilterPredicate.compile("{\"ne\": [\"host\", \"a\"]}"), List.of()),
                QueryConfig.of(FilterPredicate.compile("{\"eq\": [\"code\", 200]}"), List.of(Breakdown.of("host"))),
                QueryConfig.of(FilterPredicate.compile("{\"lt\": [\"host\", \"m\"]}"), List.of(Breakdown.of("code"))),
                QueryConfig.of(FilterPredicate.compile("{\"ge\": [\"code\", 300]}"), List.of()))) {
            List<AggregatedPoint> raw = new RawScan(query, null, null, 4).run(records.iterator()).points();
            assertThat(querier.run(query)).as(query.toString()).containsExactlyInAnyOrderElementsOf(raw);
        }
        assertThat(querier.run(QueryConfig.of(FilterPredicate.compile("{\"ne\": [\"host\", \"a\"]}"), List.of())))
                .containsExactly(AggregatedPoint.of(Map.of(), 3));
    }

    @Test
    void hourlyBuildWritesOneFilePerHour() throws Exception {
        IndexBuildResult result = builder.build(request(Interval.HOUR, null, null), records().iterator());

        Path dir = root.resolve("by_hour");
        assertThat(result.files())
                .containsExactly(
                        dir.resolve("2014-05-02-00.sqlite"),
                        dir.resolve("2014-05-02-01.sqlite"),
                        dir.resolve("2014-05-02-02.sqlite"));
        try (Stream<Path> files = Files.list(dir)) {
            assertThat(files).hasSize(3);
        }

        IndexQuerier first = IndexQuerier.open(dir.resolve("2014-05-02-01.sqlite"));
        assertThat(first.metadata().config()).containsEntry(IndexSchema.KEY_START, "1398992400");
        assertThat(first.run(QueryConfig.of(null, List.of(Breakdown.of("host")))))
                .containsExactly(AggregatedPoint.of(Map.of("host", "b"), 2));

        // rows carry the start of their hour, so bounds select whole hours
        QueryConfig thisHour = new QueryConfig(
                null,
                List.of(Breakdown.of("host")),
                Instant.parse("2014-05-02T01:00:00Z"),
                Instant.parse("2014-05-02T02:00:00Z"));
        assertThat(first.run(thisHour)).containsExactly(AggregatedPoint.of(Map.of("host", "b"), 2));
        QueryConfig nextHour = thisHour.withTimeBounds(
                Instant.parse("2014-05-02T02:00:00Z"), Instant.parse("2014-05-02T03:00:00Z"));
        assertThat(first.run(nextHour)).isEmpty();
    }

    @Test
    void timeBoundsLimitIndexedRecords() {
        IndexBuildResult result = builder.build(
                request(Interval.DAY, Instant.parse("2014-05-02T00:15:00Z"), Instant.parse("2014-05-02T02:00:00Z")),
                records().iterator());

        assertThat(result.files()).containsExactly(root.resolve("by_day").resolve("2014-05-02.sqlite"));
        assertThat(IndexQuerier.open(result.files().get(0)).run(QueryConfig.of(null, List.of(Breakdown.of("host")))))
                .containsExactlyInAnyOrder(
                        AggregatedPoint.of(Map.of("host", "a"), 1), AggregatedPoint.of(Map.of("host", "b"), 2));
        assertThat(result.stats().counter(MetricAggregationStage.NAME, MetricAggregationStage.TIME_FILTERED_OUT))
                .isEqualTo(3);
    }

    @Test
    void indexFilterAppliesToEveryMetric() {
        IndexBuildRequest request = new IndexBuildRequest(
                root,
                "muskie",
                metrics(),
                FilterPredicate.compile("{\"ne\": [\"host\", \"b\"]}"),
                "time",
                Interval.ALL,
                null,
                null,
                null);

        IndexBuildResult result = builder.build(request, records().iterator());

        assertThat(IndexQuerier.open(root.resolve("all")).run(QueryConfig.of(null, List.of(Breakdown.of("host")))))
                .containsExactlyInAnyOrder(
                        AggregatedPoint.of(Map.of("host", "a"), 2), AggregatedPoint.of(Map.of("host", "c"), 1));
        assertThat(result.stats().counter(IndexBuilder.INDEX_FILTER, "nfilteredout")).isEqualTo(2);
    }

    @Test
    void failedBuildPublishesNothing() throws Exception {
        Path all = root.resolve("all");
        Files.writeString(all, "previous");
        List<Metric> bad = List.of(new Metric(0, null, null, List.of(Breakdown.of("a b"))));
        IndexBuildRequest request =
                new IndexBuildRequest(root, "muskie", bad, null, null, Interval.ALL, null, null, null);

        assertThrows(PipelineException.class, () -> builder.build(request, records().iterator()));

        assertThat(Files.readString(all)).isEqualTo("previous");
        try (Stream<Path> files = Files.list(root)) {
            assertThat(files).containsExactly(all);
        }
    }

    @Test
    void hourlyBuildNeedsTimeField() {
        IndexBuildRequest request =
                new IndexBuildRequest(root, "muskie", metrics(), null, null, Interval.HOUR, null, null, null);

        assertThrows(
                ConfigException.class, () -> builder.build(request, records().iterator()));
    }
}
