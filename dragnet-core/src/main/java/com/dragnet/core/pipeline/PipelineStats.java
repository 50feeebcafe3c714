package com.dragnet.core.pipeline;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** Snapshot of per-stage counters, keyed by stage name. */
public record PipelineStats(Map<String, Map<String, Long>> counters) {

    public PipelineStats {
        Map<String, Map<String, Long>> copy = new LinkedHashMap<>();
        counters.forEach((stage, values) -> copy.put(stage, Collections.unmodifiableMap(new LinkedHashMap<>(values))));
        counters = Collections.unmodifiableMap(copy);
    }

    /** @return the counter value, zero if the stage never bumped it */
    public long counter(String stage, String name) {
        Map<String, Long> values = counters.get(stage);
        if (values == null) {
            return 0;
        }
        return values.getOrDefault(name, 0L);
    }
}
