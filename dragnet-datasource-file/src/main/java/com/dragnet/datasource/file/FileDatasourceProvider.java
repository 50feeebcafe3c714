package com.dragnet.datasource.file;

import com.dragnet.core.datasource.Datasource;
import com.dragnet.core.datasource.DatasourceConfig;
import com.dragnet.core.datasource.DatasourceProvider;
import com.dragnet.core.datasource.DatasourceSettings;
import com.dragnet.core.exception.ConfigException;

/** Provider for the {@code file} backend. */
public final class FileDatasourceProvider implements DatasourceProvider {

    public static final String BACKEND = "file";

    @Override
    public String backend() {
        return BACKEND;
    }

    @Override
    public Datasource create(DatasourceConfig config, DatasourceSettings settings) {
        if (!DatasourceConfig.DEFAULT_FORMAT.equals(config.dataFormat())) {
            throw new ConfigException(
                    "datasource \"" + config.name() + "\": unsupported data format \"" + config.dataFormat() + "\"");
        }
        return new FileDatasource(config, settings);
    }
}
