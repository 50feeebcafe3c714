package com.dragnet.service.storage.sqlite;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.dragnet.core.exception.CompileException;
import com.dragnet.core.model.Breakdown;
import com.dragnet.core.model.Metric;
import java.util.List;
import org.junit.jupiter.api.Test;

class IndexSchemaTest {

    @Test
    void escapesFieldNames() {
        assertThat(SqlIdentifiers.escape("req.method")).isEqualTo("req_method");
        assertThat(SqlIdentifiers.escape("x-request-id")).isEqualTo("x_request_id");
        assertThat(SqlIdentifiers.escape("__dn_ts")).isEqualTo("__dn_ts");
        assertThrows(CompileException.class, () -> SqlIdentifiers.escape("1st"));
        assertThrows(CompileException.class, () -> SqlIdentifiers.escape("it's"));
    }

    @Test
    void metricTableHasAColumnPerBreakdown() {
        Metric metric = new Metric(4, null, null, List.of(Breakdown.of("req.method"), Breakdown.quantize("latency")));

        assertThat(IndexSchema.createMetricTable(metric))
                .isEqualTo("CREATE TABLE dragnet_index_4 (\n    req_method,\n    latency numeric,\n    value integer\n)");
        assertThat(IndexSchema.insertMetricRow(metric))
                .isEqualTo("INSERT INTO dragnet_index_4 (req_method, latency, value) VALUES (?, ?, ?)");
    }

    @Test
    void metricWithoutBreakdownsStoresOnlyACount() {
        Metric metric = new Metric(0, null, null, List.of());

        assertThat(IndexSchema.createMetricTable(metric)).isEqualTo("CREATE TABLE dragnet_index_0 (\n    value integer\n)");
        assertThat(IndexSchema.insertMetricRow(metric)).isEqualTo("INSERT INTO dragnet_index_0 (value) VALUES (?)");
    }

    @Test
    void fieldsSharingAColumnAreRejected() {
        Metric clash = new Metric(1, null, null, List.of(Breakdown.of("req.method"), Breakdown.of("req_method")));
        CompileException e = assertThrows(CompileException.class, () -> IndexSchema.createMetricTable(clash));
        assertThat(e).hasMessage("fields \"req.method\" and \"req_method\" would share index column \"req_method\"");

        Metric caseOnly = new Metric(2, null, null, List.of(Breakdown.of("Host"), Breakdown.of("host")));
        assertThrows(CompileException.class, () -> IndexSchema.createMetricTable(caseOnly));
        Metric value = new Metric(3, null, null, List.of(Breakdown.of("value")));
        assertThrows(CompileException.class, () -> IndexSchema.createMetricTable(value));
    }
}
