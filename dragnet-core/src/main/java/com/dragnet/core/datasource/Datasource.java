package com.dragnet.core.datasource;

import com.dragnet.core.model.Interval;
import com.dragnet.core.model.Metric;
import com.dragnet.core.model.QueryConfig;
import com.dragnet.core.scan.RawScanResult;
import java.util.List;

/** Something that holds raw records and, optionally, indexes built from them. */
public interface Datasource extends AutoCloseable {

    /** Answers a query by reading the raw records. */
    RawScanResult scan(QueryConfig query);

    /** The inputs {@link #scan} would read for this query. */
    List<String> listInputs(QueryConfig query);

    /** Builds (or rebuilds) index files holding {@code metrics}. */
    BuildResult build(List<Metric> metrics, BuildOptions options);

    /** Answers a query from index files built at {@code interval}. */
    QueryResult query(QueryConfig query, Interval interval);

    @Override
    void close();
}
