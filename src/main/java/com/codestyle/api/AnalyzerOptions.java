package com.codestyle.api;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

import com.codestyle.api.error.Severity;

/**
 * Read-only option set resolved for one project.
 *
 * <p>Holds flat options (indent size, line length, charset, ...) and per-rule sections keyed by
 * rule id. Values come straight from YAML, so getters coerce numbers and strings to the type of
 * the supplied default.
 */
public final class AnalyzerOptions {
    public static final AnalyzerOptions EMPTY = new AnalyzerOptions(Map.of(), Map.of());

    private final Map<String, Object> options;
    private final Map<String, Map<String, Object>> ruleOptions;

    public AnalyzerOptions(Map<String, Object> options, Map<String, Map<String, Object>> ruleOptions) {
        this.options = Collections.unmodifiableMap(new HashMap<>(options));
        Map<String, Map<String, Object>> rules = new HashMap<>();
        for (Map.Entry<String, Map<String, Object>> entry : ruleOptions.entrySet()) {
            rules.put(entry.getKey(), Collections.unmodifiableMap(new HashMap<>(entry.getValue())));
        }
        this.ruleOptions = Collections.unmodifiableMap(rules);
    }

    public <T> T get(String key, T defaultValue) {
        return coerce(options.get(key), defaultValue);
    }

    public <T> T getRuleOption(String ruleId, String key, T defaultValue) {
        Map<String, Object> rule = ruleOptions.get(ruleId);
        if (rule == null) {
            return defaultValue;
        }
        return coerce(rule.get(key), defaultValue);
    }

    public boolean isRuleEnabled(String ruleId) {
        return getRuleOption(ruleId, "enabled", Boolean.TRUE);
    }

    /**
     * Severity configured for {@code ruleId}, or {@code defaultSeverity} when absent or invalid.
     */
    public Severity getRuleSeverity(String ruleId, Severity defaultSeverity) {
        String value = getRuleOption(ruleId, "severity", "");
        if (value.isBlank()) {
            return defaultSeverity;
        }
        try {
            return Severity.valueOf(value.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            return defaultSeverity;
        }
    }

    @SuppressWarnings("unchecked")
    private static <T> T coerce(Object value, T defaultValue) {
        if (value == null) {
            return defaultValue;
        }
        if (defaultValue == null || defaultValue.getClass().isInstance(value)) {
            return (T) value;
        }

        if (defaultValue instanceof Integer && value instanceof Number) {
            return (T) Integer.valueOf(((Number) value).intValue());
        } else if (defaultValue instanceof Integer && value instanceof String) {
            try {
                return (T) Integer.valueOf(((String) value).trim());
            } catch (NumberFormatException e) {
                return defaultValue;
            }
        } else if (defaultValue instanceof Boolean && value instanceof String) {
            return (T) Boolean.valueOf(value.toString());
        } else if (defaultValue instanceof String) {
            return (T) value.toString();
        }

        return defaultValue;
    }
}
