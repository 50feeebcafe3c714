package com.dragnet.core.scan;

import com.dragnet.core.aggregate.Bucketizer;
import com.dragnet.core.model.AggregatedPoint;
import java.util.List;
import java.util.Map;

/**
 * @param bucketizers the bucketizer of each bucketed breakdown, by breakdown name
 */
public record RawScanResult(List<AggregatedPoint> points, RawScanStats stats, Map<String, Bucketizer> bucketizers) {

    public RawScanResult {
        points = List.copyOf(points);
    }
}
