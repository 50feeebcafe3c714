package com.dragnet.core.datasource;

import com.dragnet.core.pipeline.PipelineStats;
import java.util.List;

/**
 * @param inputs source files read (or, for a dry run, that would be read)
 * @param indexFiles index files published
 */
public record BuildResult(List<String> inputs, List<String> indexFiles, PipelineStats stats) {

    public BuildResult {
        inputs = List.copyOf(inputs);
        indexFiles = List.copyOf(indexFiles);
    }
}
