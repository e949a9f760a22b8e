package com.codestyle.core;

import java.util.List;

import com.codestyle.api.AnalyzerFixerPair;
import com.codestyle.api.AnalyzerOptions;
import com.codestyle.workspace.Project;

/**
 * Supplies the analyzer/fixer pairs to run and the options each project is analyzed with.
 */
public interface AnalyzerRegistry {

    /**
     * Pairs in the order they must be applied.
     */
    List<AnalyzerFixerPair> getAnalyzersAndFixers();

    AnalyzerOptions getAnalyzerOptions(Project project);
}
