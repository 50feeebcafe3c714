package com.dragnet.service.storage.sink;

import com.dragnet.core.exception.StorageException;
import com.dragnet.core.model.AggregatedPoint;
import com.dragnet.core.model.DragnetFields;
import com.dragnet.core.model.Metric;
import com.dragnet.service.storage.sqlite.IndexSchema;
import com.dragnet.service.storage.sqlite.SqliteDataSources;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicLong;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.BatchPreparedStatementSetter;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.jdbc.datasource.SingleConnectionDataSource;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Writes one index file.
 *
 * <p>The database is created under a temporary name next to the target and set up asynchronously; points written
 * before it is ready are held and replayed in arrival order. {@link #flush()} writes the remaining rows, closes the
 * database and renames it onto the target in one atomic step, so readers never see a partial index. {@link #abort()}
 * and any failure delete the temporary file and leave an existing target untouched.
 *
 * <p>Builds that publish several files use the three steps of {@code flush} separately: {@link #complete()} every
 * sink, then {@link #publish()} each one, then {@link #commit()}. Until it is committed, {@link #abort()} puts the
 * previous target back.
 */
@Slf4j
public final class IndexSink implements PointSink {

    private static final AtomicLong SEQUENCE = new AtomicLong();
    private static final int BATCH_SIZE = 1000;

    private final Path target;
    private final Path temp;
    private final Map<Integer, Metric> metrics = new LinkedHashMap<>();
    private final Map<String, String> config;
    private final CompletableFuture<Void> initialized;
    private final Object lock = new Object();
    private final List<AggregatedPoint> pending = new ArrayList<>();
    private final Map<Integer, List<Object[]>> batches = new HashMap<>();

    private SingleConnectionDataSource dataSource;
    private JdbcTemplate jdbcTemplate;
    private TransactionTemplate txTemplate;
    private State state = State.OPEN;
    private boolean ready;
    private StorageException failure;
    private Path previous;
    private long written;

    private enum State {
        OPEN,
        COMPLETED,
        PUBLISHED,
        DONE
    }

    /**
     * @param metrics the metrics stored in this file; points are routed by their {@code __dn_metric} id
     * @param config extra {@code dragnet_config} entries (index name, build metadata)
     * @param executor runs database initialization
     */
    public IndexSink(Path target, List<Metric> metrics, Map<String, String> config, Executor executor) {
        this.target = target.toAbsolutePath();
        this.temp = this.target.resolveSibling(
                this.target.getFileName() + "." + ProcessHandle.current().pid() + "." + SEQUENCE.incrementAndGet());
        for (Metric metric : metrics) {
            if (this.metrics.put(metric.id(), metric) != null) {
                throw new IllegalArgumentException("duplicate metric id " + metric.id());
            }
        }
        this.config = new LinkedHashMap<>(config);
        this.initialized = CompletableFuture.runAsync(this::initialize, executor);
    }

    public Path target() {
        return target;
    }

    Path temp() {
        return temp;
    }

    public long written() {
        synchronized (lock) {
            return written;
        }
    }

    private void initialize() {
        synchronized (lock) {
            if (state != State.OPEN) {
                return;
            }
        }
        SingleConnectionDataSource ds = null;
        try {
            Files.createDirectories(temp.getParent());
            ds = SqliteDataSources.writable(temp);
            JdbcTemplate jdbc = new JdbcTemplate(ds);
            jdbc.execute("PRAGMA synchronous = OFF");
            TransactionTemplate tx = new TransactionTemplate(new DataSourceTransactionManager(ds));
            tx.executeWithoutResult(status -> createTables(jdbc));

            synchronized (lock) {
                dataSource = ds;
                jdbcTemplate = jdbc;
                txTemplate = tx;
                if (state != State.OPEN) {
                    release();
                    deleteTemp();
                    return;
                }
                ready = true;
                log.info(
                        "Index database initialized file={} metrics={} replayed={}",
                        temp,
                        metrics.size(),
                        pending.size());
                for (AggregatedPoint point : pending) {
                    insert(point);
                }
                pending.clear();
            }
        } catch (IOException e) {
            throw failed(ds, new StorageException("failed to create \"" + temp.getParent() + "\"", e));
        } catch (StorageException e) {
            throw failed(ds, e);
        } catch (RuntimeException e) {
            throw failed(ds, new StorageException("initializing database \"" + temp + "\": " + e.getMessage(), e));
        }
    }

    private void createTables(JdbcTemplate jdbc) {
        jdbc.execute(IndexSchema.CREATE_CONFIG);
        jdbc.execute(IndexSchema.CREATE_METRICS);
        for (Metric metric : metrics.values()) {
            jdbc.execute(IndexSchema.createMetricTable(metric));
        }
        Map<String, String> pairs = new LinkedHashMap<>();
        pairs.put(IndexSchema.KEY_VERSION, IndexSchema.VERSION);
        pairs.putAll(config);
        List<Object[]> configRows = new ArrayList<>();
        pairs.forEach((k, v) -> configRows.add(new Object[] {k, v}));
        jdbc.batchUpdate(IndexSchema.INSERT_CONFIG, configRows);

        List<Object[]> metricRows = new ArrayList<>();
        for (Metric metric : metrics.values()) {
            metricRows.add(new Object[] {metric.id(), metric.label(), metric.filterJson(), metric.paramsJson()});
        }
        jdbc.batchUpdate(IndexSchema.INSERT_METRIC, metricRows);
    }

    // recorded before the initialization future fails, so writers racing it see the cause
    private StorageException failed(SingleConnectionDataSource ds, StorageException e) {
        synchronized (lock) {
            failure = e;
            state = State.DONE;
            pending.clear();
            if (ds != null) {
                ds.destroy();
            }
            dataSource = null;
            deleteTemp();
        }
        return e;
    }

    /**
     * @throws IllegalArgumentException if the point does not name a metric of this file or lacks one of its fields
     * @throws StorageException if the database could not be initialized or written
     */
    @Override
    public void write(AggregatedPoint point) {
        synchronized (lock) {
            if (failure != null) {
                throw failure;
            }
            if (state != State.OPEN) {
                throw closedError();
            }
            if (!ready) {
                pending.add(point);
                return;
            }
            insert(point);
        }
    }

    private void insert(AggregatedPoint point) {
        Metric metric = metricOf(point);
        List<String> names = metric.breakdownNames();
        Object[] row = new Object[names.size() + 1];
        for (int i = 0; i < names.size(); i++) {
            if (!point.fields().containsKey(names.get(i))) {
                throw new IllegalArgumentException(
                        "point for metric \"" + metric.label() + "\" is missing field \"" + names.get(i) + "\"");
            }
            row[i] = point.field(names.get(i));
        }
        row[names.size()] = point.value();
        List<Object[]> batch = batches.computeIfAbsent(metric.id(), id -> new ArrayList<>());
        batch.add(row);
        written++;
        if (batch.size() >= BATCH_SIZE) {
            writeBatch(metric);
        }
    }

    private Metric metricOf(AggregatedPoint point) {
        Object id = point.field(DragnetFields.METRIC);
        Metric metric = id instanceof Number n ? metrics.get(n.intValue()) : null;
        if (metric == null) {
            throw new IllegalArgumentException("point is not tagged with a metric of this index: " + id);
        }
        return metric;
    }

    private void writeBatch(Metric metric) {
        List<Object[]> rows = batches.remove(metric.id());
        if (rows == null || rows.isEmpty()) {
            return;
        }
        String sql = IndexSchema.insertMetricRow(metric);
        try {
            txTemplate.executeWithoutResult(status -> jdbcTemplate.batchUpdate(sql, new BatchPreparedStatementSetter() {
                @Override
                public void setValues(PreparedStatement ps, int i) throws SQLException {
                    Object[] row = rows.get(i);
                    for (int c = 0; c < row.length; c++) {
                        ps.setObject(c + 1, row[c]);
                    }
                }

                @Override
                public int getBatchSize() {
                    return rows.size();
                }
            }));
        } catch (DataAccessException e) {
            throw new StorageException("writing " + rows.size() + " rows to " + metric.tableName(), e);
        }
    }

    @Override
    public List<Path> flush() {
        complete();
        publish();
        commit();
        return List.of(target);
    }

    /** Writes the remaining rows and closes the database, leaving it under its temporary name. */
    void complete() {
        try {
            initialized.join();
        } catch (CompletionException e) {
            throw initFailure(e);
        }
        synchronized (lock) {
            if (failure != null) {
                throw failure;
            }
            if (state != State.OPEN) {
                throw closedError();
            }
            try {
                for (Metric metric : metrics.values()) {
                    writeBatch(metric);
                }
            } catch (RuntimeException e) {
                state = State.DONE;
                release();
                deleteTemp();
                throw e;
            }
            release();
            state = State.COMPLETED;
        }
    }

    /** Renames the completed database onto the target; an existing target is kept aside until {@link #commit()}. */
    void publish() {
        synchronized (lock) {
            if (state != State.COMPLETED) {
                throw new IllegalStateException("index sink for \"" + target + "\" is not completed");
            }
            try {
                if (Files.isRegularFile(target, LinkOption.NOFOLLOW_LINKS)) {
                    Path aside = temp.resolveSibling(temp.getFileName() + ".previous");
                    Files.move(target, aside, StandardCopyOption.ATOMIC_MOVE);
                    previous = aside;
                }
                Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (IOException e) {
                state = State.DONE;
                restorePrevious();
                deleteTemp();
                throw new StorageException("renaming \"" + temp + "\"", e);
            }
            state = State.PUBLISHED;
        }
    }

    /** Makes a published index final by dropping the target it replaced. */
    void commit() {
        synchronized (lock) {
            if (state != State.PUBLISHED) {
                throw new IllegalStateException("index sink for \"" + target + "\" is not published");
            }
            state = State.DONE;
            if (previous != null) {
                delete(previous);
                previous = null;
            }
            log.info("Index published file={} points={}", target, written);
        }
    }

    @Override
    public void abort() {
        synchronized (lock) {
            if (state == State.DONE) {
                return;
            }
            if (state == State.PUBLISHED) {
                delete(target);
                restorePrevious();
            } else {
                pending.clear();
                batches.clear();
                release();
                deleteTemp();
            }
            state = State.DONE;
            log.info("Index build aborted file={}", target);
        }
    }

    private StorageException initFailure(CompletionException e) {
        synchronized (lock) {
            if (failure != null) {
                return failure;
            }
        }
        return new StorageException("initializing database \"" + temp + "\"", e.getCause());
    }

    private IllegalStateException closedError() {
        return new IllegalStateException("index sink for \"" + target + "\" is closed");
    }

    private void restorePrevious() {
        if (previous == null) {
            return;
        }
        try {
            Files.move(previous, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            log.error("Failed to restore index {} from {}", target, previous, e);
        }
        previous = null;
    }

    private void release() {
        if (dataSource != null) {
            dataSource.destroy();
            dataSource = null;
        }
    }

    private void deleteTemp() {
        delete(temp);
        delete(temp.resolveSibling(temp.getFileName() + "-journal"));
    }

    private static void delete(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            log.warn("Failed to remove index file {}", path, e);
        }
    }
}
