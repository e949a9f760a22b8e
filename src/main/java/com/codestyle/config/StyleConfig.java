package com.codestyle.config;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Configuration of the style engine: general options, per-language options and per-rule options.
 */
public class StyleConfig {
    private final Map<String, Object> generalConfig;
    private final Map<String, Map<String, Object>> languageConfigs;
    private final Map<String, Map<String, Object>> ruleConfigs;

    public StyleConfig(Map<String, Object> generalConfig,
                       Map<String, Map<String, Object>> languageConfigs,
                       Map<String, Map<String, Object>> ruleConfigs) {
        this.generalConfig = generalConfig;
        this.languageConfigs = languageConfigs;
        this.ruleConfigs = ruleConfigs;
    }

    /**
     * Gets a copy of the general config map.
     */
    public Map<String, Object> getGeneralConfigMap() {
        return new HashMap<>(generalConfig);
    }

    /**
     * Gets a copy of the options for {@code language}, empty when none are configured.
     */
    public Map<String, Object> getLanguageConfigMap(String language) {
        if (language == null) {
            return new HashMap<>();
        }
        Map<String, Object> config = languageConfigs.get(language.toLowerCase(Locale.ROOT));
        return config != null ? new HashMap<>(config) : new HashMap<>();
    }

    public Map<String, Map<String, Object>> getLanguageConfigsMap() {
        return deepCopy(languageConfigs);
    }

    public Map<String, Map<String, Object>> getRuleConfigsMap() {
        return deepCopy(ruleConfigs);
    }

    @SuppressWarnings("unchecked")
    public <T> T getGeneralConfig(String key, T defaultValue) {
        Object value = generalConfig.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (defaultValue != null && !defaultValue.getClass().isInstance(value)) {
            if (defaultValue instanceof Integer && value instanceof Number) {
                return (T) Integer.valueOf(((Number) value).intValue());
            } else if (defaultValue instanceof Boolean && value instanceof String) {
                return (T) Boolean.valueOf(value.toString());
            } else if (defaultValue instanceof String) {
                return (T) value.toString();
            }
            return defaultValue;
        }
        return (T) value;
    }

    /**
     * A rule is enabled unless its section sets {@code enabled: false}.
     */
    public boolean isRuleEnabled(String ruleId) {
        Map<String, Object> rule = ruleConfigs.get(ruleId);
        if (rule == null) {
            return true;
        }
        Object enabled = rule.get("enabled");
        if (enabled instanceof Boolean) {
            return (Boolean) enabled;
        }
        if (enabled instanceof String) {
            return Boolean.parseBoolean((String) enabled);
        }
        return true;
    }

    private static Map<String, Map<String, Object>> deepCopy(Map<String, Map<String, Object>> source) {
        Map<String, Map<String, Object>> result = new HashMap<>();
        for (Map.Entry<String, Map<String, Object>> entry : source.entrySet()) {
            result.put(entry.getKey(), new HashMap<>(entry.getValue()));
        }
        return result;
    }
}
