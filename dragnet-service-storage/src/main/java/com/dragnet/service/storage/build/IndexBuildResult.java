package com.dragnet.service.storage.build;

import com.dragnet.core.pipeline.PipelineStats;
import java.nio.file.Path;
import java.util.List;

/** Index files published by a build and the build pipeline's counters. */
public record IndexBuildResult(List<Path> files, PipelineStats stats) {

    public IndexBuildResult {
        files = List.copyOf(files);
    }
}
