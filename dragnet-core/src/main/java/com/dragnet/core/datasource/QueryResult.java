package com.dragnet.core.datasource;

import com.dragnet.core.model.AggregatedPoint;
import java.util.List;

/** Points answered from an index, and the index files that contributed. */
public record QueryResult(List<AggregatedPoint> points, List<String> indexFiles) {

    public QueryResult {
        points = List.copyOf(points);
        indexFiles = List.copyOf(indexFiles);
    }
}
