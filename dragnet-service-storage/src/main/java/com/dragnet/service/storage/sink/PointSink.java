package com.dragnet.service.storage.sink;

import com.dragnet.core.model.AggregatedPoint;
import java.nio.file.Path;
import java.util.List;

/** Destination for aggregated points tagged with their metric. */
public interface PointSink {

    void write(AggregatedPoint point);

    /** Persists everything written and publishes the result. */
    List<Path> flush();

    /** Discards everything written; nothing is published. */
    void abort();
}
