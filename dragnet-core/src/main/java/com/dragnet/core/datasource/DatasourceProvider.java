package com.dragnet.core.datasource;

/**
 * Creates datasources for one backend. Implementations are discovered through {@link java.util.ServiceLoader}.
 */
public interface DatasourceProvider {

    String backend();

    Datasource create(DatasourceConfig config, DatasourceSettings settings);
}
