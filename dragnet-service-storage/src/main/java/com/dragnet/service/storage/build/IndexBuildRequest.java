package com.dragnet.service.storage.build;

import com.dragnet.core.filter.FilterPredicate;
import com.dragnet.core.model.Interval;
import com.dragnet.core.model.Metric;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

/**
 * What to build.
 *
 * @param root index directory; interval {@code all} writes {@code root/all}, others {@code root/by_hour/..} etc.
 * @param filter records every metric sees, or {@code null}
 * @param timeField record time field, or {@code null} for sources without one
 * @param after inclusive lower time bound, or {@code null}
 * @param before exclusive upper time bound, or {@code null}
 * @param user recorded as the builder in index metadata
 */
public record IndexBuildRequest(
        Path root,
        String indexName,
        List<Metric> metrics,
        FilterPredicate filter,
        String timeField,
        Interval interval,
        Instant after,
        Instant before,
        String user) {

    public IndexBuildRequest {
        if (metrics == null || metrics.isEmpty()) {
            throw new IllegalArgumentException("at least one metric is required");
        }
        metrics = List.copyOf(metrics);
        interval = interval == null ? Interval.ALL : interval;
    }
}
