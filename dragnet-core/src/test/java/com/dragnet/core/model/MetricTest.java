package com.dragnet.core.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.dragnet.core.exception.ConfigException;
import com.dragnet.core.filter.FilterPredicate;
import com.dragnet.core.json.JsonUtil;
import java.util.List;
import org.junit.jupiter.api.Test;

class MetricTest {

    private static final FilterPredicate GET = FilterPredicate.compile("{\"eq\": [\"req.method\", \"GET\"]}");

    @Test
    void materializeForTimeSplitBuildsGroupsByBucketFirst() {
        Metric metric = new Metric(3, "by host", null, List.of(Breakdown.of("host"), Breakdown.quantize("latency")));

        Metric hourly = metric.materialize(Interval.HOUR, "time");

        assertThat(hourly.breakdownNames()).containsExactly(DragnetFields.TIMESTAMP, "host", "latency");
        Breakdown ts = hourly.breakdowns().get(0);
        assertThat(ts.field()).isEqualTo("time");
        assertThat(ts.aggr()).isEqualTo(Aggregation.LQUANTIZE);
        assertThat(ts.step()).isEqualTo(3600.0);
        assertThat(ts.isSynthetic()).isTrue();
        assertThat(metric.materialize(Interval.ALL, null)).isSameAs(metric);
        assertThat(hourly.materialize(Interval.HOUR, "time")).isSameAs(hourly);
    }

    @Test
    void timeSplitBuildNeedsTimeField() {
        Metric metric = new Metric(0, null, null, List.of(Breakdown.of("host")));

        assertThrows(ConfigException.class, () -> metric.materialize(Interval.DAY, null));
        assertThat(metric.label()).isEqualTo("metric0");
        assertThat(metric.tableName()).isEqualTo("dragnet_index_0");
    }

    @Test
    void storedFormRestoresMetric() {
        Metric metric = new Metric(
                7,
                "gets",
                GET,
                List.of(Breakdown.of("host"), new Breakdown("ts", "time", Aggregation.LQUANTIZE, 60.0, "")));

        Metric restored = Metric.fromStored(7, "gets", metric.filterJson(), metric.paramsJson());

        assertThat(restored).isEqualTo(metric);
        assertThat(JsonUtil.parse(metric.paramsJson()).get(1).get("step").asDouble()).isEqualTo(60.0);
    }

    @Test
    void queryCarriesFilterAndBreakdowns() {
        Metric metric = new Metric(1, "gets", GET, List.of(Breakdown.of("host")));

        QueryConfig q = metric.query(null, null);

        assertThat(q.filter()).isEqualTo(GET);
        assertThat(q.breakdownNames()).containsExactly("host");
        assertThat(q.hasTimeBounds()).isFalse();
    }
}
