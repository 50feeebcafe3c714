package com.dragnet.core.datasource;

import com.dragnet.core.exception.ConfigException;
import com.dragnet.core.filter.FilterPredicate;
import com.dragnet.core.json.JsonUtil;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A named source of raw records.
 *
 * @param backend selects the {@link DatasourceProvider}, e.g. {@code file}
 * @param backendConfig backend-specific settings such as {@code path} or {@code timeField}
 * @param filter applied to every record before any query, may be {@code null}
 * @param dataFormat record encoding, {@code json} by default
 */
public record DatasourceConfig(
        String name, String backend, Map<String, Object> backendConfig, FilterPredicate filter, String dataFormat) {

    public static final String DEFAULT_FORMAT = "json";

    public DatasourceConfig {
        if (name == null || name.isEmpty()) {
            throw new ConfigException("datasource name is required");
        }
        if (backend == null || backend.isEmpty()) {
            throw new ConfigException("datasource \"" + name + "\": backend is required");
        }
        backendConfig = Collections.unmodifiableMap(new LinkedHashMap<>(backendConfig == null ? Map.of() : backendConfig));
        dataFormat = dataFormat == null ? DEFAULT_FORMAT : dataFormat;
    }

    /** @return the string value of a backend setting, or {@code null} */
    public String setting(String key) {
        Object value = backendConfig.get(key);
        return value == null ? null : value.toString();
    }

    public String requireSetting(String key) {
        String value = setting(key);
        if (value == null || value.isEmpty()) {
            throw new ConfigException("datasource \"" + name + "\": \"" + key + "\" is required");
        }
        return value;
    }

    @SuppressWarnings("unchecked")
    public static DatasourceConfig fromJson(String name, JsonNode node) {
        JsonNode filter = node.get("filter");
        return new DatasourceConfig(
                name,
                node.path("backend").asText(null),
                node.has("backend_config") ? JsonUtil.convert(node.get("backend_config"), Map.class) : Map.of(),
                filter == null || filter.isNull() ? null : FilterPredicate.compile(filter),
                node.path("dataFormat").asText(null));
    }

    public ObjectNode toJson() {
        ObjectNode node = JsonUtil.object();
        node.put("backend", backend);
        node.set("backend_config", JsonUtil.toTree(backendConfig));
        if (filter != null) {
            node.set("filter", filter.tree());
        }
        node.put("dataFormat", dataFormat);
        return node;
    }
}
