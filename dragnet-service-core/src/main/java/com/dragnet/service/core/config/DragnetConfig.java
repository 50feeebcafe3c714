package com.dragnet.service.core.config;

import com.dragnet.core.datasource.DatasourceConfig;
import com.dragnet.core.exception.ConfigException;
import com.dragnet.core.json.JsonUtil;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * The set of configured datasources. Immutable: {@link #withDatasource} and {@link #withoutDatasource} return a new
 * configuration and leave this one untouched.
 *
 * <p>Serialized form: {@code {"vmaj": 0, "vmin": 0, "datasources": [{"name": .., "backend": .., ..}]}}.
 */
public final class DragnetConfig {

    public static final int MAJOR_VERSION = 0;
    public static final int MINOR_VERSION = 0;

    private final Map<String, DatasourceConfig> datasources;

    private DragnetConfig(Map<String, DatasourceConfig> datasources) {
        this.datasources = Collections.unmodifiableMap(new LinkedHashMap<>(datasources));
    }

    public static DragnetConfig empty() {
        return new DragnetConfig(Map.of());
    }

    public static DragnetConfig parse(String json) {
        JsonNode node;
        try {
            node = JsonUtil.parse(json);
        } catch (IllegalArgumentException e) {
            throw new ConfigException("failed to load config: " + e.getMessage(), e);
        }
        return fromJson(node);
    }

    public static DragnetConfig fromJson(JsonNode node) {
        if (node == null || !node.isObject()) {
            throw new ConfigException("failed to load config: expected an object");
        }
        if (!node.path("vmaj").isNumber() || !node.path("vmin").isNumber()) {
            throw new ConfigException("failed to load config: \"vmaj\" and \"vmin\" must be numbers");
        }
        if (node.get("vmaj").asInt() != MAJOR_VERSION) {
            throw new ConfigException(
                    "failed to load config: major version (\"" + node.get("vmaj").asText() + "\") not supported");
        }
        Map<String, DatasourceConfig> datasources = new LinkedHashMap<>();
        for (JsonNode ds : node.path("datasources")) {
            String name = ds.path("name").asText(null);
            DatasourceConfig config;
            try {
                config = DatasourceConfig.fromJson(name, ds);
            } catch (ConfigException e) {
                throw new ConfigException("failed to load config: " + e.getMessage(), e);
            }
            if (datasources.put(config.name(), config) != null) {
                throw new ConfigException("failed to load config: duplicate datasource \"" + name + "\"");
            }
        }
        return new DragnetConfig(datasources);
    }

    public DragnetConfig withDatasource(DatasourceConfig datasource) {
        if (datasources.containsKey(datasource.name())) {
            throw new ConfigException("datasource \"" + datasource.name() + "\" already exists");
        }
        Map<String, DatasourceConfig> copy = new LinkedHashMap<>(datasources);
        copy.put(datasource.name(), datasource);
        return new DragnetConfig(copy);
    }

    public DragnetConfig withoutDatasource(String name) {
        if (!datasources.containsKey(name)) {
            throw new ConfigException("datasource \"" + name + "\" does not exist");
        }
        Map<String, DatasourceConfig> copy = new LinkedHashMap<>(datasources);
        copy.remove(name);
        return new DragnetConfig(copy);
    }

    public Optional<DatasourceConfig> datasource(String name) {
        return Optional.ofNullable(datasources.get(name));
    }

    /** Datasources in the order they were added. */
    public Collection<DatasourceConfig> datasources() {
        return datasources.values();
    }

    public ObjectNode toJson() {
        ObjectNode root = JsonUtil.object();
        root.put("vmaj", MAJOR_VERSION);
        root.put("vmin", MINOR_VERSION);
        ArrayNode list = root.putArray("datasources");
        for (DatasourceConfig ds : datasources.values()) {
            ObjectNode entry = list.addObject();
            entry.put("name", ds.name());
            entry.setAll(ds.toJson());
        }
        return root;
    }

    public String serialize() {
        return JsonUtil.toJson(toJson());
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof DragnetConfig other && datasources.equals(other.datasources);
    }

    @Override
    public int hashCode() {
        return datasources.hashCode();
    }
}
