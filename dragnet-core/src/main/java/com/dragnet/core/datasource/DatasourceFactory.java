package com.dragnet.core.datasource;

import com.dragnet.core.exception.ConfigException;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.ServiceLoader;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;

/** Picks the provider for a datasource's backend. */
@Slf4j
public final class DatasourceFactory {

    private final Map<String, DatasourceProvider> providers = new LinkedHashMap<>();

    public DatasourceFactory(Collection<? extends DatasourceProvider> providers) {
        for (DatasourceProvider provider : providers) {
            DatasourceProvider previous = this.providers.putIfAbsent(provider.backend(), provider);
            if (previous != null) {
                log.warn(
                        "Ignoring duplicate datasource provider backend={} provider={}",
                        provider.backend(),
                        provider.getClass().getName());
            }
        }
    }

    public static DatasourceFactory fromServiceLoader() {
        return new DatasourceFactory(ServiceLoader.load(DatasourceProvider.class).stream()
                .map(ServiceLoader.Provider::get)
                .toList());
    }

    public Set<String> backends() {
        return providers.keySet();
    }

    public Datasource create(DatasourceConfig config, DatasourceSettings settings) {
        DatasourceProvider provider = providers.get(config.backend());
        if (provider == null) {
            throw new ConfigException("datasource \"" + config.name() + "\": unsupported backend \""
                    + config.backend() + "\" (available: " + providers.keySet() + ")");
        }
        log.debug("Creating datasource name={} backend={}", config.name(), config.backend());
        return provider.create(config, settings);
    }
}
