package com.codestyle.config;

import com.codestyle.api.error.ConfigurationException;
import com.codestyle.util.LoggerUtil;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Loads {@link StyleConfig} from YAML, filling gaps with defaults and dropping out-of-range values.
 */
public class ConfigurationLoader {
    private static final Logger logger = LoggerUtil.getLogger(ConfigurationLoader.class);
    private static final String DEFAULT_CONFIG_RESOURCE = "/config/default-config.yml";

    private static StyleConfig _cachedDefaultConfig = null;

    /**
     * Loads configuration from a file. A missing file falls back to the defaults;
     * a file that exists but cannot be parsed is a configuration error.
     */
    public static StyleConfig loadConfig(Path configPath) {
        if (configPath == null) {
            logger.fine("No config path provided, using default configuration");
            return loadDefaultConfig();
        }

        if (!Files.exists(configPath)) {
            logger.fine("Configuration file not found: " + configPath + ", using default configuration");
            return loadDefaultConfig();
        }

        try {
            logger.fine("Loading configuration from: " + configPath);

            ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
            @SuppressWarnings("unchecked")
            Map<String, Object> config = mapper.readValue(configPath.toFile(), Map.class);

            StyleConfig styleConfig = _createConfigFromMap(config != null ? config : new HashMap<>());
            logger.fine("Configuration loaded with " + styleConfig.getRuleConfigsMap().size() + " rule sections");

            return styleConfig;
        } catch (IOException e) {
            logger.log(Level.SEVERE, "Error parsing configuration file: " + configPath, e);
            throw new ConfigurationException("Invalid configuration file " + configPath + ": " + e.getMessage(), e);
        }
    }

    /**
     * Loads the embedded default configuration with caching.
     */
    public static synchronized StyleConfig loadDefaultConfig() {
        if (_cachedDefaultConfig != null) {
            return _cachedDefaultConfig;
        }

        try (InputStream defaultConfigStream =
                     ConfigurationLoader.class.getResourceAsStream(DEFAULT_CONFIG_RESOURCE)) {

            if (defaultConfigStream == null) {
                logger.severe("Default configuration resource not found: " + DEFAULT_CONFIG_RESOURCE);
                return _createEmptyConfig();
            }

            ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
            @SuppressWarnings("unchecked")
            Map<String, Object> config = mapper.readValue(defaultConfigStream, Map.class);

            _cachedDefaultConfig = _createConfigFromMap(config);
            logger.fine("Default configuration loaded successfully");

            return _cachedDefaultConfig;
        } catch (IOException e) {
            logger.log(Level.SEVERE, "Failed to load default configuration", e);
            return _createEmptyConfig();
        }
    }

    @SuppressWarnings("unchecked")
    private static StyleConfig _createConfigFromMap(Map<String, Object> config) {
        Map<String, Object> generalConfig = new HashMap<>();
        if (config.get("general") instanceof Map) {
            generalConfig = new HashMap<>((Map<String, Object>) config.get("general"));
        } else if (config.containsKey("general")) {
            logger.warning("Invalid 'general' section in config, using defaults");
        }
        _ensureDefaultGeneralConfig(generalConfig);
        _validateConfigurationValues(generalConfig);

        Map<String, Map<String, Object>> languageConfigs = _readSections(config, "languages", true);
        for (Map.Entry<String, Map<String, Object>> language : languageConfigs.entrySet()) {
            _validateLanguageValues(language.getKey(), language.getValue());
        }
        Map<String, Map<String, Object>> ruleConfigs = _readSections(config, "rules", false);

        return new StyleConfig(generalConfig, languageConfigs, ruleConfigs);
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Map<String, Object>> _readSections(Map<String, Object> config, String name,
                                                                  boolean lowerCaseKeys) {
        Map<String, Map<String, Object>> sections = new HashMap<>();
        Object value = config.get(name);
        if (value == null) {
            return sections;
        }
        if (!(value instanceof Map)) {
            logger.warning("Invalid '" + name + "' section in config, ignoring it");
            return sections;
        }

        for (Map.Entry<String, Object> entry : ((Map<String, Object>) value).entrySet()) {
            String key = lowerCaseKeys ? entry.getKey().toLowerCase(Locale.ROOT) : entry.getKey();
            if (entry.getValue() instanceof Map) {
                sections.put(key, new HashMap<>((Map<String, Object>) entry.getValue()));
            } else {
                logger.warning("Invalid configuration for " + name + " entry '" + entry.getKey() + "', using defaults");
                sections.put(key, new HashMap<>());
            }
        }
        return sections;
    }

    /**
     * Validates configuration values to ensure they are within acceptable ranges.
     */
    private static void _validateConfigurationValues(Map<String, Object> generalConfig) {
        _validateIntRange(generalConfig, "indentSize", 1, 8, 4);
        _validateIntRange(generalConfig, "tabWidth", 1, 8, 4);
        _validateIntRange(generalConfig, "lineLength", 40, 400, 120);
        _validateIntRange(generalConfig, "threads", 0, 256, 0);
        _validateIntRange(generalConfig, "maxFixPasses", 1, 10, 1);
    }

    /**
     * Language sections override the general section, so an out-of-range value is dropped
     * and the general value applies instead.
     */
    private static void _validateLanguageValues(String language, Map<String, Object> languageConfig) {
        _dropOutOfRange(language, languageConfig, "indentSize", 1, 8);
        _dropOutOfRange(language, languageConfig, "tabWidth", 1, 8);
        _dropOutOfRange(language, languageConfig, "lineLength", 40, 400);
    }

    private static void _dropOutOfRange(String language, Map<String, Object> config, String key, int min, int max) {
        if (config.get(key) instanceof Number) {
            int value = ((Number) config.get(key)).intValue();
            if (value < min || value > max) {
                logger.warning("Configuration value 'languages." + language + "." + key + "' is outside acceptable range " +
                        "(" + min + "-" + max + "). Using the general value.");
                config.remove(key);
            }
        }
    }

    private static void _validateIntRange(Map<String, Object> config, String key, int min, int max, int defaultValue) {
        if (config.get(key) instanceof Number) {
            int value = ((Number) config.get(key)).intValue();
            if (value < min || value > max) {
                logger.warning("Configuration value '" + key + "' is outside acceptable range " +
                        "(" + min + "-" + max + "). Using default value " + defaultValue + ".");
                config.put(key, defaultValue);
            }
        }
    }

    private static StyleConfig _createEmptyConfig() {
        Map<String, Object> generalConfig = new HashMap<>();
        _ensureDefaultGeneralConfig(generalConfig);
        return new StyleConfig(generalConfig, new HashMap<>(), new HashMap<>());
    }

    /**
     * Ensures that general configuration has all required default values.
     */
    private static void _ensureDefaultGeneralConfig(Map<String, Object> generalConfig) {
        if (!(generalConfig.get("indentSize") instanceof Number)) {
            generalConfig.put("indentSize", 4);
        }
        if (!(generalConfig.get("tabWidth") instanceof Number)) {
            generalConfig.put("tabWidth", 4);
        }
        if (!(generalConfig.get("lineLength") instanceof Number)) {
            generalConfig.put("lineLength", 120);
        }
        if (!(generalConfig.get("threads") instanceof Number)) {
            generalConfig.put("threads", 0);
        }
        if (!(generalConfig.get("maxFixPasses") instanceof Number)) {
            generalConfig.put("maxFixPasses", 1);
        }
        if (!(generalConfig.get("changesAreErrors") instanceof Boolean)) {
            generalConfig.put("changesAreErrors", false);
        }
        if (!(generalConfig.get("ignoreFiles") instanceof List)) {
            generalConfig.put("ignoreFiles", new ArrayList<String>());
        }
    }

    /**
     * Saves configuration to a file.
     */
    public static void saveConfig(StyleConfig config, Path configPath) throws IOException {
        try {
            Path parent = configPath.toAbsolutePath().getParent();
            if (parent != null && !Files.exists(parent)) {
                Files.createDirectories(parent);
            }

            Map<String, Object> configMap = new LinkedHashMap<>();
            configMap.put("general", new TreeMap<>(config.getGeneralConfigMap()));
            configMap.put("languages", new TreeMap<>(config.getLanguageConfigsMap()));
            configMap.put("rules", new TreeMap<>(config.getRuleConfigsMap()));

            ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
            mapper.writeValue(configPath.toFile(), configMap);

            logger.info("Configuration saved successfully to: " + configPath);
        } catch (IOException e) {
            logger.log(Level.SEVERE, "Failed to save configuration to: " + configPath, e);
            throw e;
        }
    }
}
