package com.dragnet.core.datasource;

import com.dragnet.core.model.Interval;
import java.time.Instant;

/**
 * @param after inclusive lower time bound of records to index, or {@code null}
 * @param before exclusive upper time bound, or {@code null}
 * @param dryRun list the inputs without building anything
 */
public record BuildOptions(Interval interval, Instant after, Instant before, boolean dryRun) {

    public BuildOptions {
        interval = interval == null ? Interval.ALL : interval;
    }

    public static BuildOptions all() {
        return new BuildOptions(Interval.ALL, null, null, false);
    }
}
