package com.dragnet.service.storage.query;

import com.dragnet.core.aggregate.PointAggregator;
import com.dragnet.core.exception.StorageException;
import com.dragnet.core.model.AggregatedPoint;
import com.dragnet.core.model.Metric;
import com.dragnet.core.model.QueryConfig;
import com.dragnet.service.storage.sqlite.IndexSchema;
import com.dragnet.service.storage.sqlite.SqliteDataSources;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowCallbackHandler;

/**
 * Answers queries from one index file. The file is opened read-only and every query uses its own connection, so one
 * querier may serve concurrent callers.
 */
@Slf4j
public final class IndexQuerier {

    private final Path file;
    private final JdbcTemplate jdbcTemplate;
    private final IndexMetadata metadata;
    private final MetricPlanner planner;

    private IndexQuerier(Path file, JdbcTemplate jdbcTemplate, IndexMetadata metadata) {
        this.file = file;
        this.jdbcTemplate = jdbcTemplate;
        this.metadata = metadata;
        this.planner = new MetricPlanner(metadata.metrics());
    }

    /**
     * Loads the index's configuration and metric definitions.
     *
     * @throws StorageException if the file is missing, unreadable, or not a version 2 index
     */
    public static IndexQuerier open(Path file) {
        if (!Files.isRegularFile(file)) {
            throw new StorageException("index \"" + file + "\" does not exist");
        }
        JdbcTemplate jdbc = new JdbcTemplate(SqliteDataSources.readOnly(file));
        try {
            Map<String, String> config = new LinkedHashMap<>();
            jdbc.query(IndexSchema.SELECT_CONFIG, (RowCallbackHandler)
                    rs -> config.put(rs.getString("key"), rs.getString("value")));
            checkVersion(file, config.get(IndexSchema.KEY_VERSION));
            List<Metric> metrics = jdbc.query(IndexSchema.SELECT_METRICS, (rs, rowNum) -> Metric.fromStored(
                    rs.getInt("id"), rs.getString("label"), rs.getString("filter"), rs.getString("params")));
            IndexMetadata metadata = new IndexMetadata(config, metrics);
            log.debug("Index opened file={} version={} metrics={}", file, metadata.version(), metrics.size());
            return new IndexQuerier(file, jdbc, metadata);
        } catch (DataAccessException e) {
            throw new StorageException("reading index \"" + file + "\": " + e.getMostSpecificCause().getMessage(), e);
        }
    }

    private static void checkVersion(Path file, String version) {
        if (version == null) {
            throw new StorageException("index \"" + file + "\": index missing dragnet \"version\"");
        }
        int dot = version.indexOf('.');
        String major = dot < 0 ? version : version.substring(0, dot);
        try {
            if (Integer.parseInt(major) == IndexSchema.SUPPORTED_MAJOR_VERSION) {
                return;
            }
        } catch (NumberFormatException e) {
            throw new StorageException("index \"" + file + "\": unsupported index version \"" + version + "\"", e);
        }
        throw new StorageException("index \"" + file + "\": unsupported index version \"" + version + "\"");
    }

    public Path file() {
        return file;
    }

    public IndexMetadata metadata() {
        return metadata;
    }

    /** Runs a query and returns its points grouped by the query's breakdowns. */
    public List<AggregatedPoint> run(QueryConfig query) {
        PointAggregator aggregator = new PointAggregator(query.breakdowns());
        run(query, aggregator);
        return aggregator.results();
    }

    /**
     * Runs a query and adds its rows to {@code aggregator}, which must group by the query's breakdowns. Used to merge
     * the answers of several index files.
     */
    public void run(QueryConfig query, PointAggregator aggregator) {
        MetricSelection selection = planner.findMetric(query);
        String sql = IndexSqlCompiler.compile(query, selection);
        List<String> names = query.breakdownNames();
        log.debug("Querying index file={} metric={} sql={}", file, selection.metric().id(), sql);
        try {
            jdbcTemplate.query(sql, (RowCallbackHandler) rs -> aggregator.add(toPoint(rs, names)));
        } catch (DataAccessException e) {
            throw new StorageException("querying index \"" + file + "\": " + e.getMostSpecificCause().getMessage(), e);
        }
    }

    private static AggregatedPoint toPoint(ResultSet rs, List<String> names) throws SQLException {
        Map<String, Object> fields = new LinkedHashMap<>();
        for (int i = 0; i < names.size(); i++) {
            fields.put(names.get(i), rs.getObject(i + 1));
        }
        // SUM over no rows is NULL; getLong reads it as 0
        return new AggregatedPoint(fields, rs.getLong(IndexSchema.VALUE_COLUMN));
    }
}
