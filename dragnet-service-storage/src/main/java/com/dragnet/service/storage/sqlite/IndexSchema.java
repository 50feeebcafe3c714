package com.dragnet.service.storage.sqlite;

import com.dragnet.core.exception.CompileException;
import com.dragnet.core.model.Breakdown;
import com.dragnet.core.model.Metric;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Layout of an index file: a key/value {@code dragnet_config} table, a {@code dragnet_metrics} table describing each
 * metric, and one {@code dragnet_index_<id>} table per metric with a column per breakdown plus {@code value}.
 */
public final class IndexSchema {

    public static final String CONFIG_TABLE = "dragnet_config";
    public static final String METRICS_TABLE = "dragnet_metrics";
    public static final String VALUE_COLUMN = "value";

    public static final String VERSION = "2.0.0";
    public static final int SUPPORTED_MAJOR_VERSION = 2;

    public static final String KEY_VERSION = "version";
    public static final String KEY_INDEX_NAME = "index_name";
    public static final String KEY_USER = "user";
    public static final String KEY_MTIME = "mtime";
    public static final String KEY_START = "dn_start";

    public static final String CREATE_CONFIG =
            """
            CREATE TABLE dragnet_config (
                key varchar(128) primary key,
                value text
            )
            """;

    public static final String CREATE_METRICS =
            """
            CREATE TABLE dragnet_metrics (
                id integer,
                label varchar(128),
                filter text,
                params text
            )
            """;

    public static final String INSERT_CONFIG = "INSERT INTO dragnet_config (key, value) VALUES (?, ?)";
    public static final String INSERT_METRIC = "INSERT INTO dragnet_metrics (id, label, filter, params) VALUES (?, ?, ?, ?)";
    public static final String SELECT_CONFIG = "SELECT key, value FROM dragnet_config";
    public static final String SELECT_METRICS = "SELECT id, label, filter, params FROM dragnet_metrics ORDER BY rowid";

    private IndexSchema() {}

    /**
     * Bucketed breakdowns get numeric affinity. Other columns are declared without a type so stored values keep the
     * type they were written with.
     *
     * @throws CompileException if two breakdowns, or a breakdown and {@code value}, map to the same column
     */
    public static String createMetricTable(Metric metric) {
        checkDistinctColumns(metric);
        String columns = metric.breakdowns().stream()
                .map(b -> "    " + SqlIdentifiers.escape(b.name()) + (b.isBucketed() ? " numeric" : ""))
                .collect(Collectors.joining(",\n"));
        return "CREATE TABLE " + metric.tableName() + " (\n"
                + (columns.isEmpty() ? "" : columns + ",\n")
                + "    " + VALUE_COLUMN + " integer\n)";
    }

    // SQLite compares identifiers case-insensitively
    private static void checkDistinctColumns(Metric metric) {
        Map<String, String> owners = new HashMap<>();
        owners.put(VALUE_COLUMN, VALUE_COLUMN);
        for (Breakdown b : metric.breakdowns()) {
            String previous = owners.putIfAbsent(SqlIdentifiers.escape(b.name()).toLowerCase(Locale.ROOT), b.name());
            if (previous != null) {
                throw new CompileException("fields \"" + previous + "\" and \"" + b.name()
                        + "\" would share index column \"" + SqlIdentifiers.escape(b.name()) + "\"");
            }
        }
    }

    public static String insertMetricRow(Metric metric) {
        List<Breakdown> breakdowns = metric.breakdowns();
        String names = breakdowns.stream()
                .map(b -> SqlIdentifiers.escape(b.name()) + ", ")
                .collect(Collectors.joining());
        String params = "?, ".repeat(breakdowns.size());
        return "INSERT INTO " + metric.tableName() + " (" + names + VALUE_COLUMN + ") VALUES (" + params + "?)";
    }
}
