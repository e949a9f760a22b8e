package com.codestyle.config;

import com.codestyle.api.error.ConfigurationException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ConfigurationLoaderTest {

    @TempDir
    Path folder;

    @Test
    void missingFileFallsBackToDefaults() {
        StyleConfig config = ConfigurationLoader.loadConfig(folder.resolve("absent.yml"));

        assertSame(ConfigurationLoader.loadDefaultConfig(), config);
        int tabWidth = config.getGeneralConfig("tabWidth", 0);
        assertEquals(4, tabWidth);
        assertTrue(config.getRuleConfigsMap().containsKey("WS001"));
        assertTrue(config.isRuleEnabled("WS001"));
    }

    @Test
    void valuesAreReadFromYaml() throws IOException {
        Path file = folder.resolve("style.yml");
        Files.writeString(file, String.join("\n",
                "general:",
                "  tabWidth: 2",
                "  charset: utf-8-bom",
                "  ignoreFiles:",
                "    - generated/**",
                "languages:",
                "  Java:",
                "    maxMethodLines: 30",
                "rules:",
                "  JAVA002:",
                "    enabled: false",
                ""));

        StyleConfig config = ConfigurationLoader.loadConfig(file);

        int tabWidth = config.getGeneralConfig("tabWidth", 0);
        assertEquals(2, tabWidth);
        assertEquals("utf-8-bom", config.getGeneralConfig("charset", ""));
        assertEquals(List.of("generated/**"), config.getGeneralConfig("ignoreFiles", new ArrayList<String>()));
        assertEquals(30, config.getLanguageConfigMap("java").get("maxMethodLines"));
        assertFalse(config.isRuleEnabled("JAVA002"));
        assertTrue(config.isRuleEnabled("WS001"));
    }

    @Test
    void outOfRangeValuesAreReplacedByDefaults() throws IOException {
        Path file = folder.resolve("style.yml");
        Files.writeString(file, "general:\n  tabWidth: 99\n  maxFixPasses: 0\n  lineLength: 100\n");

        StyleConfig config = ConfigurationLoader.loadConfig(file);

        int tabWidth = config.getGeneralConfig("tabWidth", 0);
        int maxFixPasses = config.getGeneralConfig("maxFixPasses", 0);
        int lineLength = config.getGeneralConfig("lineLength", 0);
        assertEquals(4, tabWidth);
        assertEquals(1, maxFixPasses);
        assertEquals(100, lineLength);
    }

    @Test
    void outOfRangeLanguageValuesFallBackToGeneral() throws IOException {
        Path file = folder.resolve("style.yml");
        Files.writeString(file, "general:\n  tabWidth: 2\nlanguages:\n  Java:\n    tabWidth: 0\n    indentSize: -3\n    maxMethodLines: 30\n");

        StyleConfig config = ConfigurationLoader.loadConfig(file);

        assertFalse(config.getLanguageConfigMap("java").containsKey("tabWidth"));
        assertFalse(config.getLanguageConfigMap("java").containsKey("indentSize"));
        assertEquals(30, config.getLanguageConfigMap("java").get("maxMethodLines"));
        int tabWidth = config.getGeneralConfig("tabWidth", 0);
        assertEquals(2, tabWidth);
    }

    @Test
    void malformedYamlIsAConfigurationError() throws IOException {
        Path file = folder.resolve("broken.yml");
        Files.writeString(file, "general: [unclosed\n");

        assertThrows(ConfigurationException.class, () -> ConfigurationLoader.loadConfig(file));
    }

    @Test
    void savedConfigurationLoadsBack() throws IOException {
        Path file = folder.resolve("nested/saved.yml");

        ConfigurationLoader.saveConfig(ConfigurationLoader.loadDefaultConfig(), file);
        StyleConfig reloaded = ConfigurationLoader.loadConfig(file);

        assertTrue(Files.exists(file));
        assertEquals(ConfigurationLoader.loadDefaultConfig().getRuleConfigsMap(), reloaded.getRuleConfigsMap());
    }
}
