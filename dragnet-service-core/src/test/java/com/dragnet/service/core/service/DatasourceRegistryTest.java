package com.dragnet.service.core.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.dragnet.core.datasource.Datasource;
import com.dragnet.core.datasource.DatasourceConfig;
import com.dragnet.core.datasource.DatasourceFactory;
import com.dragnet.core.datasource.DatasourceProvider;
import com.dragnet.core.datasource.DatasourceSettings;
import com.dragnet.core.exception.ConfigException;
import com.dragnet.service.core.config.DragnetConfig;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class DatasourceRegistryTest {

    private static final DatasourceSettings SETTINGS = new DatasourceSettings(8, 1, "tester");
    private static final DatasourceConfig LOGS = new DatasourceConfig("logs", "file", Map.of("path", "/data"), null, null);

    @Test
    void opensConfiguredDatasources() {
        DatasourceProvider provider = mock(DatasourceProvider.class);
        Datasource datasource = mock(Datasource.class);
        when(provider.backend()).thenReturn("file");
        when(provider.create(LOGS, SETTINGS)).thenReturn(datasource);
        DatasourceRegistry registry = new DatasourceRegistry(
                DragnetConfig.empty().withDatasource(LOGS), new DatasourceFactory(List.of(provider)), SETTINGS);

        assertThat(registry.open("logs")).isSameAs(datasource);
        assertThat(assertThrows(ConfigException.class, () -> registry.open("other")))
                .hasMessage("unknown datasource \"other\"");
    }

    @Test
    void updatesReplaceTheSnapshot() {
        DatasourceRegistry registry =
                new DatasourceRegistry(DragnetConfig.empty(), new DatasourceFactory(List.of()), SETTINGS);
        DragnetConfig before = registry.current();

        DragnetConfig after = registry.update(c -> c.withDatasource(LOGS));

        assertThat(registry.current()).isSameAs(after);
        assertThat(before.datasources()).isEmpty();
        assertThat(after.datasource("logs")).contains(LOGS);
        assertThrows(ConfigException.class, () -> registry.update(c -> c.withDatasource(LOGS)));
        assertThat(registry.current()).isSameAs(after);
    }
}
