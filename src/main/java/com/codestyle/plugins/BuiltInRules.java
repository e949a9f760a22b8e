package com.codestyle.plugins;

import java.util.List;

import com.codestyle.api.Analyzer;
import com.codestyle.api.CodeFixer;
import com.codestyle.plugins.java.DuplicateImportAnalyzer;
import com.codestyle.plugins.java.DuplicateImportFixer;
import com.codestyle.plugins.java.MethodLengthAnalyzer;
import com.codestyle.plugins.java.NamingConventionAnalyzer;
import com.codestyle.plugins.whitespace.TabIndentationAnalyzer;
import com.codestyle.plugins.whitespace.TabIndentationFixer;
import com.codestyle.plugins.whitespace.TrailingWhitespaceAnalyzer;
import com.codestyle.plugins.whitespace.TrailingWhitespaceFixer;

/**
 * The analyzers and fixers shipped with the tool, in the order their pairs run.
 */
public final class BuiltInRules {

    private BuiltInRules() {
    }

    public static List<Analyzer> analyzers() {
        return List.of(
                new TabIndentationAnalyzer(),
                new TrailingWhitespaceAnalyzer(),
                new DuplicateImportAnalyzer(),
                new NamingConventionAnalyzer(),
                new MethodLengthAnalyzer());
    }

    public static List<CodeFixer> fixers() {
        return List.of(
                new TabIndentationFixer(),
                new TrailingWhitespaceFixer(),
                new DuplicateImportFixer());
    }
}
