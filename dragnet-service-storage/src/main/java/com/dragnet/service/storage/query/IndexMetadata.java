package com.dragnet.service.storage.query;

import com.dragnet.core.model.Metric;
import com.dragnet.service.storage.sqlite.IndexSchema;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Contents of an index file's {@code dragnet_config} and {@code dragnet_metrics} tables. */
public record IndexMetadata(Map<String, String> config, List<Metric> metrics) {

    public IndexMetadata {
        config = Collections.unmodifiableMap(new LinkedHashMap<>(config));
        metrics = List.copyOf(metrics);
    }

    public String version() {
        return config.get(IndexSchema.KEY_VERSION);
    }

    public String indexName() {
        return config.get(IndexSchema.KEY_INDEX_NAME);
    }
}
