package com.dragnet.service.core.service;

import com.dragnet.core.datasource.BuildOptions;
import com.dragnet.core.datasource.BuildResult;
import com.dragnet.core.datasource.Datasource;
import com.dragnet.core.datasource.QueryResult;
import com.dragnet.core.model.Interval;
import com.dragnet.core.model.Metric;
import com.dragnet.core.model.QueryConfig;
import com.dragnet.core.scan.RawScanResult;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/** Entry point for scans, index builds and index queries against a named datasource. */
@Slf4j
@RequiredArgsConstructor
public class DragnetService {

    private final DatasourceRegistry registry;

    public RawScanResult scan(String datasource, QueryConfig query) {
        log.debug("Scan datasource={} breakdowns={}", datasource, query.breakdownNames());
        try (Datasource ds = registry.open(datasource)) {
            return ds.scan(query);
        }
    }

    /** The raw inputs a scan of {@code query} would read. */
    public List<String> listInputs(String datasource, QueryConfig query) {
        try (Datasource ds = registry.open(datasource)) {
            return ds.listInputs(query);
        }
    }

    public BuildResult build(String datasource, List<Metric> metrics, BuildOptions options) {
        log.debug(
                "Build datasource={} metrics={} interval={} dryRun={}",
                datasource,
                metrics.size(),
                options.interval().label(),
                options.dryRun());
        try (Datasource ds = registry.open(datasource)) {
            return ds.build(metrics, options);
        }
    }

    public QueryResult query(String datasource, QueryConfig query, Interval interval) {
        log.debug("Index query datasource={} interval={}", datasource, interval);
        try (Datasource ds = registry.open(datasource)) {
            return ds.query(query, interval);
        }
    }
}
