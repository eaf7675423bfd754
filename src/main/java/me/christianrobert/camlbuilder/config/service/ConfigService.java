package me.christianrobert.camlbuilder.config.service;

import jakarta.enterprise.context.ApplicationScoped;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

@ApplicationScoped
public class ConfigService {

    private static final Logger log = LoggerFactory.getLogger(ConfigService.class);

    public static final String ESCAPE_VALUES = "caml.escape-values";
    public static final String FOLD_STRATEGY = "caml.fold-strategy";
    public static final String INCLUDE_TREE = "caml.include-tree";

    private final Map<String, Object> configuration = new ConcurrentHashMap<>();

    public ConfigService() {
        initializeDefaultConfiguration();
    }

    private void initializeDefaultConfiguration() {
        configuration.put(ESCAPE_VALUES, true);
        configuration.put(FOLD_STRATEGY, "LEFT_DEEP");
        configuration.put(INCLUDE_TREE, false);

        log.info("Configuration service initialized with default values");
    }

    public Map<String, Object> getAllConfiguration() {
        return new HashMap<>(configuration);
    }

    public Object getConfigValue(String key) {
        return configuration.get(key);
    }

    public String getConfigValueAsString(String key) {
        Object value = configuration.get(key);
        return value != null ? value.toString() : null;
    }

    public Boolean getConfigValueAsBoolean(String key) {
        Object value = configuration.get(key);
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof String) {
            return Boolean.parseBoolean((String) value);
        }
        return null;
    }

    /**
     * Gets a boolean configuration value, falling back when the key is unset
     * or holds something that is neither a Boolean nor a String.
     *
     * @param key Configuration key
     * @param defaultValue Value returned when nothing usable is configured
     * @return Configured or default value
     */
    public boolean getConfigValueAsBoolean(String key, boolean defaultValue) {
        Boolean value = getConfigValueAsBoolean(key);
        return value != null ? value : defaultValue;
    }

    public void updateConfiguration(Map<String, Object> newConfig) {
        log.info("Updating configuration with {} entries", newConfig.size());

        newConfig.forEach((key, value) -> {
            Object oldValue = store(key, value);
            if (log.isDebugEnabled()) {
                log.debug("Config updated: {} = {} (was: {})", key, value, oldValue);
            }
        });

        log.info("Configuration updated successfully");
    }

    /**
     * Sets a configuration value. A null value unsets the key.
     */
    public void setConfigValue(String key, Object value) {
        Object oldValue = store(key, value);
        log.debug("Config value set: {} = {} (was: {})", key, value, oldValue);
    }

    private Object store(String key, Object value) {
        return value != null ? configuration.put(key, value) : configuration.remove(key);
    }

    public boolean hasConfigKey(String key) {
        return configuration.containsKey(key);
    }

    public void resetToDefaults() {
        log.info("Resetting configuration to defaults");
        configuration.clear();
        initializeDefaultConfiguration();
    }
}
