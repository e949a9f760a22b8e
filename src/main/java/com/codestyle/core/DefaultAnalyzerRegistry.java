package com.codestyle.core;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;

import com.codestyle.api.Analyzer;
import com.codestyle.api.AnalyzerFixerPair;
import com.codestyle.api.AnalyzerOptions;
import com.codestyle.api.CodeFixer;
import com.codestyle.config.StyleConfig;
import com.codestyle.util.LoggerUtil;
import com.codestyle.workspace.Project;
import com.codestyle.workspace.ProjectId;

/**
 * Registry built from explicit analyzer and fixer lists.
 *
 * <p>Each analyzer is paired with the first fixer able to fix one of its rule ids.
 * Analyzers whose rules are all disabled in the configuration are left out.
 */
public class DefaultAnalyzerRegistry implements AnalyzerRegistry {
    private static final Logger logger = LoggerUtil.getLogger(DefaultAnalyzerRegistry.class);

    private final List<AnalyzerFixerPair> pairs;
    private final StyleConfig config;
    private final Map<ProjectId, AnalyzerOptions> optionsCache = new ConcurrentHashMap<>();

    public DefaultAnalyzerRegistry(List<Analyzer> analyzers, List<CodeFixer> fixers, StyleConfig config) {
        this.config = config;
        this.pairs = List.copyOf(createPairs(analyzers, fixers, config));
    }

    private static List<AnalyzerFixerPair> createPairs(List<Analyzer> analyzers, List<CodeFixer> fixers, StyleConfig config) {
        List<AnalyzerFixerPair> result = new ArrayList<>();
        for (Analyzer analyzer : analyzers) {
            boolean enabled = analyzer.getSupportedDiagnosticIds().stream().anyMatch(config::isRuleEnabled);
            if (!enabled) {
                logger.fine("Analyzer " + analyzer.getId() + " disabled by configuration");
                continue;
            }

            CodeFixer match = null;
            for (CodeFixer fixer : fixers) {
                if (fixer.getFixableDiagnosticIds().stream().anyMatch(analyzer.getSupportedDiagnosticIds()::contains)) {
                    match = fixer;
                    break;
                }
            }
            result.add(new AnalyzerFixerPair(analyzer, match));
        }
        return result;
    }

    @Override
    public List<AnalyzerFixerPair> getAnalyzersAndFixers() {
        return pairs;
    }

    /**
     * General options overlaid with the options of the project's language, plus every rule section.
     */
    @Override
    public AnalyzerOptions getAnalyzerOptions(Project project) {
        return optionsCache.computeIfAbsent(project.getId(), id -> {
            Map<String, Object> options = new HashMap<>(config.getGeneralConfigMap());
            options.putAll(config.getLanguageConfigMap(project.getLanguage()));
            return new AnalyzerOptions(options, config.getRuleConfigsMap());
        });
    }
}
