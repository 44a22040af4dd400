package com.eainde.patientqa.provider;

import com.eainde.patientqa.config.ConfigurationException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Configured model configurations by id, in declaration order.
 */
public class ModelCatalog {

    private final Map<String, ModelConfig> configs;

    public ModelCatalog(Collection<ModelConfig> configs) {
        Map<String, ModelConfig> byId = new LinkedHashMap<>();
        for (ModelConfig config : configs) {
            if (byId.putIfAbsent(config.id(), config) != null) {
                throw new ConfigurationException("Duplicate model id: " + config.id());
            }
        }
        this.configs = byId;
    }

    public ModelConfig get(String id) {
        ModelConfig config = configs.get(id);
        if (config == null) {
            throw new ConfigurationException("Unknown model id '" + id + "', configured: " + configs.keySet());
        }
        return config;
    }

    /** All configurations when {@code ids} is empty, otherwise the named ones in the given order. */
    public List<ModelConfig> select(List<String> ids) {
        if (ids == null || ids.isEmpty()) {
            return List.copyOf(configs.values());
        }
        List<ModelConfig> selected = new ArrayList<>(ids.size());
        for (String id : ids) {
            selected.add(get(id));
        }
        return selected;
    }

    public List<String> ids() {
        return List.copyOf(configs.keySet());
    }
}
