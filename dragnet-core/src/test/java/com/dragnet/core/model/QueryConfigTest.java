package com.dragnet.core.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.dragnet.core.exception.ConfigException;
import com.dragnet.core.json.JsonUtil;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;

class QueryConfigTest {

    @Test
    void loadsFromJson() {
        QueryConfig q = QueryConfig.fromJson(JsonUtil.parse(
                """
                {
                  "filter": {"eq": ["req.method", "GET"]},
                  "breakdowns": ["host", {"name": "ts", "field": "time", "date": ""}, "latency[aggr=quantize]"],
                  "timeAfter": "2014-05-02T00:00:00Z",
                  "timeBefore": "2014-05-03T00:00:00Z"
                }
                """));

        assertThat(q.filter().fields()).containsExactly("req.method");
        assertThat(q.breakdownNames()).containsExactly("host", "ts", "latency");
        assertThat(q.syntheticFields()).extracting(Breakdown::name).containsExactly("ts");
        assertThat(q.hasTimeBounds()).isTrue();
        assertThat(q.after()).isEqualTo(Instant.parse("2014-05-02T00:00:00Z"));
        assertThat(q.breakdown("latency").aggr()).isEqualTo(Aggregation.QUANTIZE);
        assertThat(q.breakdown("missing")).isNull();
    }

    @Test
    void boundsComeInPairs() {
        Instant t = Instant.parse("2014-05-02T00:00:00Z");

        assertThrows(ConfigException.class, () -> new QueryConfig(null, List.of(), t, null));
        assertThrows(ConfigException.class, () -> new QueryConfig(null, List.of(), null, t));
        assertThrows(ConfigException.class, () -> new QueryConfig(null, List.of(), t.plusSeconds(1), t));
        assertThat(new QueryConfig(null, List.of(), t, t).hasTimeBounds()).isTrue();
    }

    @Test
    void quantizedBreakdownMustBeLast() {
        ConfigException e = assertThrows(
                ConfigException.class,
                () -> QueryConfig.of(null, List.of(Breakdown.quantize("latency"), Breakdown.of("host"))));
        assertThat(e).hasMessageContaining("quantized breakdowns must be last");

        assertThat(QueryConfig.of(null, List.of(Breakdown.of("host"), Breakdown.quantize("latency")))
                        .breakdownNames())
                .containsExactly("host", "latency");
        assertThat(QueryConfig.of(null, List.of(Breakdown.lquantize("latency", 10), Breakdown.of("host")))
                        .breakdownNames())
                .containsExactly("latency", "host");
    }

    @Test
    void duplicateNamesAreRejected() {
        assertThrows(
                ConfigException.class, () -> QueryConfig.of(null, List.of(Breakdown.of("host"), Breakdown.of("host"))));
    }

    @Test
    void reservedNamesAreRejectedFromUsers() {
        ConfigException e = assertThrows(
                ConfigException.class,
                () -> QueryConfig.fromJson(JsonUtil.parse("{\"breakdowns\": [\"__dn_ts\"]}")));
        assertThat(e).hasMessageContaining("reserved prefix");
    }

    @Test
    void invalidDatesAreRejected() {
        ConfigException e = assertThrows(
                ConfigException.class,
                () -> QueryConfig.fromJson(
                        JsonUtil.parse("{\"timeAfter\": \"yesterday\", \"timeBefore\": \"2014-05-03T00:00:00Z\"}")));
        assertThat(e).hasMessage("\"timeAfter\" is not a valid date: \"yesterday\"");
    }
}
