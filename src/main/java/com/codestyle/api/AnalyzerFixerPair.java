package com.codestyle.api;

import java.util.Objects;
import java.util.Optional;

/**
 * An analyzer and the fixer resolving its diagnostics, if there is one.
 */
public final class AnalyzerFixerPair {
    private final Analyzer analyzer;
    private final CodeFixer fixer;

    public AnalyzerFixerPair(Analyzer analyzer, CodeFixer fixer) {
        this.analyzer = Objects.requireNonNull(analyzer, "analyzer");
        this.fixer = fixer;
    }

    public static AnalyzerFixerPair reportOnly(Analyzer analyzer) {
        return new AnalyzerFixerPair(analyzer, null);
    }

    public Analyzer getAnalyzer() {
        return analyzer;
    }

    public Optional<CodeFixer> getFixer() {
        return Optional.ofNullable(fixer);
    }

    public boolean isReportOnly() {
        return fixer == null;
    }

    @Override
    public String toString() {
        return analyzer.getId() + " -> " + (fixer != null ? fixer.getId() : "(report only)");
    }
}
