package com.dragnet.core.datasource;

/**
 * Process-wide tuning handed to every datasource at construction.
 *
 * @param bufferSize capacity of each buffer between pipeline stages
 * @param finderWorkers threads used to walk directory trees
 * @param user recorded in index metadata as the builder
 */
public record DatasourceSettings(int bufferSize, int finderWorkers, String user) {

    public static DatasourceSettings defaults() {
        return new DatasourceSettings(64, 4, "dragnet");
    }
}
