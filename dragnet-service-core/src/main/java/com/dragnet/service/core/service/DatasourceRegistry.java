package com.dragnet.service.core.service;

import com.dragnet.core.datasource.Datasource;
import com.dragnet.core.datasource.DatasourceConfig;
import com.dragnet.core.datasource.DatasourceFactory;
import com.dragnet.core.datasource.DatasourceSettings;
import com.dragnet.core.exception.ConfigException;
import com.dragnet.service.core.config.DragnetConfig;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.UnaryOperator;
import lombok.extern.slf4j.Slf4j;

/**
 * Holds the current {@link DragnetConfig} and opens datasources from it. Readers see a consistent snapshot; updates
 * replace the whole configuration atomically.
 */
@Slf4j
public class DatasourceRegistry {

    private final AtomicReference<DragnetConfig> ref;
    private final DatasourceFactory factory;
    private final DatasourceSettings settings;

    public DatasourceRegistry(DragnetConfig initial, DatasourceFactory factory, DatasourceSettings settings) {
        this.ref = new AtomicReference<>(initial);
        this.factory = factory;
        this.settings = settings;
    }

    public DragnetConfig current() {
        return ref.get();
    }

    /** Applies {@code change} to the current configuration and installs the result. */
    public DragnetConfig update(UnaryOperator<DragnetConfig> change) {
        DragnetConfig next = ref.updateAndGet(change);
        log.info("Datasource configuration updated datasources={}", next.datasources().size());
        return next;
    }

    /**
     * Creates a datasource from its current configuration. The caller owns it and must close it.
     *
     * @throws ConfigException if no datasource has this name or its backend is unknown
     */
    public Datasource open(String name) {
        DatasourceConfig config = current()
                .datasource(name)
                .orElseThrow(() -> new ConfigException("unknown datasource \"" + name + "\""));
        return factory.create(config, settings);
    }
}
