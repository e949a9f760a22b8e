package com.codestyle.workspace;

import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

/**
 * Languages the folder loader groups documents by. Each language becomes one project.
 */
public enum FileType {
    JAVA("Java", List.of("java")),
    JAVASCRIPT("JavaScript", List.of("js", "jsx", "mjs")),
    TYPESCRIPT("TypeScript", List.of("ts", "tsx")),
    UNKNOWN("", List.of());

    private final String language;
    private final List<String> extensions;

    FileType(String language, List<String> extensions) {
        this.language = language;
        this.extensions = extensions;
    }

    public String getLanguage() {
        return language;
    }

    public List<String> getExtensions() {
        return extensions;
    }

    /**
     * Primary file extension, without the dot.
     */
    public String getExtension() {
        return extensions.isEmpty() ? "" : extensions.get(0);
    }

    /**
     * Name given to the synthetic project holding all files of this type, e.g. {@code Java.javaproj}.
     */
    public String getProjectName() {
        return language + "." + getExtension() + "proj";
    }

    public boolean matches(Path filePath) {
        return this != UNKNOWN && detect(filePath) == this;
    }

    /**
     * Detects the file type from the file extension.
     */
    public static FileType detect(Path filePath) {
        Path fileName = filePath.getFileName();
        if (fileName == null) {
            return UNKNOWN;
        }
        String name = fileName.toString().toLowerCase(Locale.ROOT);
        int dot = name.lastIndexOf('.');
        if (dot < 0) {
            return UNKNOWN;
        }

        String extension = name.substring(dot + 1);
        for (FileType type : values()) {
            if (type.extensions.contains(extension)) {
                return type;
            }
        }
        return UNKNOWN;
    }

    /**
     * Looks a file type up by language name, ignoring case. Returns {@link #UNKNOWN} when none matches.
     */
    public static FileType fromLanguage(String language) {
        if (language != null) {
            for (FileType type : values()) {
                if (type != UNKNOWN && type.language.equalsIgnoreCase(language)) {
                    return type;
                }
            }
        }
        return UNKNOWN;
    }

    public String getDescription() {
        return switch (this) {
            case JAVA -> "Java source file";
            case JAVASCRIPT -> "JavaScript source file";
            case TYPESCRIPT -> "TypeScript source file";
            case UNKNOWN -> "Unknown file type";
        };
    }
}
