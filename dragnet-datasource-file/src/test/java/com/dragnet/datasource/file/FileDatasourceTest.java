package com.dragnet.datasource.file;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.dragnet.core.datasource.BuildOptions;
import com.dragnet.core.datasource.BuildResult;
import com.dragnet.core.datasource.DatasourceConfig;
import com.dragnet.core.datasource.DatasourceSettings;
import com.dragnet.core.datasource.QueryResult;
import com.dragnet.core.exception.ConfigException;
import com.dragnet.core.exception.StorageException;
import com.dragnet.core.filter.FilterPredicate;
import com.dragnet.core.model.AggregatedPoint;
import com.dragnet.core.model.Breakdown;
import com.dragnet.core.model.Interval;
import com.dragnet.core.model.Metric;
import com.dragnet.core.model.QueryConfig;
import com.dragnet.core.scan.RawScanResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FileDatasourceTest {

    private static final Instant MAY_2 = Instant.parse("2014-05-02T00:00:00Z");
    private static final Instant MAY_3 = Instant.parse("2014-05-03T00:00:00Z");
    private static final QueryConfig BY_HOST = QueryConfig.of(null, List.of(Breakdown.of("host")));

    @TempDir
    Path dir;

    private Path data;
    private Path indexes;
    private FileDatasource datasource;

    @BeforeEach
    void writeData() throws Exception {
        data = dir.resolve("data");
        indexes = dir.resolve("index");
        write("2014/05/01/a.log", "{\"host\": \"a\", \"time\": \"2014-05-01T23:59:59Z\", \"latency\": 3}");
        write(
                "2014/05/02/a.log",
                "{\"host\": \"a\", \"time\": \"2014-05-02T00:00:00Z\", \"latency\": 5}",
                "{\"host\": \"b\", \"time\": \"2014-05-02T13:30:00Z\", \"latency\": 70}",
                "garbage");
        write("2014/05/02/b.log", "{\"host\": \"b\", \"time\": \"2014-05-02T13:45:00Z\", \"latency\": 6}");
        write("2014/05/03/a.log", "{\"host\": \"c\", \"time\": \"2014-05-03T00:00:00Z\", \"latency\": 1}");
        datasource = create(Map.of());
    }

    @AfterEach
    void close() {
        datasource.close();
    }

    private void write(String relative, String... lines) throws Exception {
        Path file = data.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, String.join("\n", lines) + "\n");
    }

    private FileDatasource create(Map<String, Object> overrides) {
        Map<String, Object> settings = new HashMap<>();
        settings.put(FileDatasource.PATH, data.toString());
        settings.put(FileDatasource.TIME_FORMAT, "%Y/%m/%d");
        settings.put(FileDatasource.TIME_FIELD, "time");
        settings.put(FileDatasource.INDEX_PATH, indexes.toString());
        settings.putAll(overrides);
        settings.values().removeIf(v -> v.equals(""));
        return new FileDatasource(
                new DatasourceConfig("muskie", "file", settings, null, null), new DatasourceSettings(4, 2, "tester"));
    }

    private static List<Metric> metrics() {
        return List.of(new Metric(0, "by host", null, List.of(Breakdown.of("host"), Breakdown.quantize("latency"))));
    }

    @Test
    void scansEveryFileWithoutBounds() {
        RawScanResult result = datasource.scan(BY_HOST);

        assertThat(result.points())
                .containsExactly(
                        AggregatedPoint.of(Map.of("host", "a"), 2),
                        AggregatedPoint.of(Map.of("host", "b"), 2),
                        AggregatedPoint.of(Map.of("host", "c"), 1));
        assertThat(result.stats().inputs()).isEqualTo(5);
    }

    @Test
    void timeBoundsReadOnlyMatchingPartitions() {
        QueryConfig bounded = new QueryConfig(null, List.of(Breakdown.of("host")), MAY_2, MAY_3);

        assertThat(datasource.listInputs(bounded))
                .containsExactly(
                        data.resolve("2014/05/02/a.log").toString(), data.resolve("2014/05/02/b.log").toString());
        assertThat(datasource.scan(bounded).points())
                .containsExactly(AggregatedPoint.of(Map.of("host", "a"), 1), AggregatedPoint.of(Map.of("host", "b"), 2));
    }

    @Test
    void boundsWithoutLayoutReadEverythingButStillFilter() {
        try (FileDatasource flat = create(Map.of(FileDatasource.TIME_FORMAT, ""))) {
            QueryConfig bounded = new QueryConfig(null, List.of(Breakdown.of("host")), MAY_2, MAY_3);

            assertThat(flat.listInputs(bounded)).hasSize(4);
            assertThat(flat.scan(bounded).points())
                    .containsExactly(
                            AggregatedPoint.of(Map.of("host", "a"), 1), AggregatedPoint.of(Map.of("host", "b"), 2));
        }
    }

    @Test
    void boundsNeedTimeField() {
        try (FileDatasource untimed = create(Map.of(FileDatasource.TIME_FIELD, ""))) {
            QueryConfig bounded = new QueryConfig(null, List.of(), MAY_2, MAY_3);

            ConfigException e = assertThrows(ConfigException.class, () -> untimed.scan(bounded));

            assertThat(e).hasMessage("datasource is missing \"timeField\" for \"before\" and \"after\" constraints");
            assertThat(untimed.scan(BY_HOST).points()).hasSize(3);
        }
    }

    @Test
    void indexAnswersLikeAScan() {
        BuildResult build = datasource.build(metrics(), BuildOptions.all());

        assertThat(build.inputs()).hasSize(4);
        assertThat(build.indexFiles()).containsExactly(indexes.resolve("all").toString());

        for (QueryConfig query : List.of(
                BY_HOST,
                QueryConfig.of(FilterPredicate.compile("{\"eq\": [\"host\", \"b\"]}"), List.of(Breakdown.quantize("latency"))),
                QueryConfig.of(null, List.of()))) {
            QueryResult answer = datasource.query(query, Interval.ALL);
            assertThat(answer.points()).containsExactlyInAnyOrderElementsOf(datasource.scan(query).points());
        }
    }

    @Test
    void hourlyIndexesAreMergedAcrossFiles() {
        BuildResult build = datasource.build(metrics(), new BuildOptions(Interval.HOUR, null, null, false));

        assertThat(build.indexFiles())
                .containsExactly(
                        indexes.resolve("by_hour/2014-05-01-23.sqlite").toString(),
                        indexes.resolve("by_hour/2014-05-02-00.sqlite").toString(),
                        indexes.resolve("by_hour/2014-05-02-13.sqlite").toString(),
                        indexes.resolve("by_hour/2014-05-03-00.sqlite").toString());

        QueryResult all = datasource.query(BY_HOST, Interval.HOUR);
        assertThat(all.indexFiles()).hasSize(4);
        assertThat(all.points())
                .containsExactlyInAnyOrder(
                        AggregatedPoint.of(Map.of("host", "a"), 2),
                        AggregatedPoint.of(Map.of("host", "b"), 2),
                        AggregatedPoint.of(Map.of("host", "c"), 1));

        QueryResult may2 = datasource.query(new QueryConfig(null, List.of(Breakdown.of("host")), MAY_2, MAY_3), Interval.HOUR);
        assertThat(may2.indexFiles())
                .containsExactly(
                        indexes.resolve("by_hour/2014-05-02-00.sqlite").toString(),
                        indexes.resolve("by_hour/2014-05-02-13.sqlite").toString());
        assertThat(may2.points())
                .containsExactlyInAnyOrder(
                        AggregatedPoint.of(Map.of("host", "a"), 1), AggregatedPoint.of(Map.of("host", "b"), 2));
    }

    @Test
    void unboundedIndexQueryIgnoresOtherFiles() throws Exception {
        datasource.build(metrics(), new BuildOptions(Interval.DAY, MAY_2, MAY_3, false));
        Files.writeString(indexes.resolve("by_day/2014-05-02.sqlite.123.1"), "partial");

        QueryResult result = datasource.query(BY_HOST, Interval.DAY);

        assertThat(result.indexFiles()).containsExactly(indexes.resolve("by_day/2014-05-02.sqlite").toString());
        assertThat(result.points())
                .containsExactlyInAnyOrder(
                        AggregatedPoint.of(Map.of("host", "a"), 1), AggregatedPoint.of(Map.of("host", "b"), 2));
    }

    @Test
    void dryRunListsInputsOnly() {
        BuildResult result = datasource.build(metrics(), new BuildOptions(Interval.DAY, MAY_2, MAY_3, true));

        assertThat(result.inputs()).hasSize(2);
        assertThat(result.indexFiles()).isEmpty();
        assertThat(indexes).doesNotExist();
    }

    @Test
    void buildArgumentsAreChecked() {
        assertThat(assertThrows(
                        ConfigException.class,
                        () -> datasource.build(metrics(), new BuildOptions(Interval.ALL, MAY_2, null, false))))
                .hasMessage("cannot specify --after without --before");
        assertThat(assertThrows(
                        ConfigException.class,
                        () -> datasource.build(metrics(), new BuildOptions(Interval.ALL, null, MAY_3, false))))
                .hasMessage("cannot specify --before without --after");

        try (FileDatasource noIndex = create(Map.of(FileDatasource.INDEX_PATH, ""))) {
            assertThat(assertThrows(ConfigException.class, () -> noIndex.build(metrics(), BuildOptions.all())))
                    .hasMessage("datasource is missing \"indexPath\"");
            assertThrows(ConfigException.class, () -> noIndex.query(BY_HOST, Interval.ALL));
        }
        try (FileDatasource untimed = create(Map.of(FileDatasource.TIME_FIELD, ""))) {
            assertThat(assertThrows(
                            ConfigException.class,
                            () -> untimed.build(metrics(), new BuildOptions(Interval.HOUR, null, null, false))))
                    .hasMessage("datasource is missing \"timeField\"");
        }
    }

    @Test
    void queryingAnUnbuiltIndexFails() {
        assertThrows(StorageException.class, () -> datasource.query(BY_HOST, Interval.ALL));
        assertThat(datasource.query(BY_HOST, Interval.DAY).points()).isEmpty();
    }

    @Test
    void badTimeFormatIsRejectedUpFront() {
        assertThrows(ConfigException.class, () -> create(Map.of(FileDatasource.TIME_FORMAT, "%d/%m/%Y")));
    }
}
