package com.codestyle.api;

import java.nio.file.Path;

/**
 * Caller-supplied options of a format run.
 */
public class FormatOptions {
    private final Path workspaceFilePath;
    private final boolean saveFormattedFiles;
    private final boolean changesAreErrors;
    private final int maxFixPasses;

    private FormatOptions(Builder builder) {
        this.workspaceFilePath = builder.workspaceFilePath;
        this.saveFormattedFiles = builder.saveFormattedFiles;
        this.changesAreErrors = builder.changesAreErrors;
        this.maxFixPasses = Math.max(1, builder.maxFixPasses);
    }

    /**
     * Folder, or file inside a folder, that reported paths are made relative to.
     */
    public Path getWorkspaceFilePath() {
        return workspaceFilePath;
    }

    /**
     * True for fix mode, false for report mode.
     */
    public boolean isSaveFormattedFiles() {
        return saveFormattedFiles;
    }

    /**
     * Report findings with error severity instead of warning severity.
     */
    public boolean isChangesAreErrors() {
        return changesAreErrors;
    }

    /**
     * Upper bound of analyze-and-fix passes per analyzer/fixer pair in fix mode.
     */
    public int getMaxFixPasses() {
        return maxFixPasses;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private Path workspaceFilePath;
        private boolean saveFormattedFiles;
        private boolean changesAreErrors;
        private int maxFixPasses = 1;

        public Builder workspaceFilePath(Path workspaceFilePath) {
            this.workspaceFilePath = workspaceFilePath;
            return this;
        }

        public Builder saveFormattedFiles(boolean saveFormattedFiles) {
            this.saveFormattedFiles = saveFormattedFiles;
            return this;
        }

        public Builder changesAreErrors(boolean changesAreErrors) {
            this.changesAreErrors = changesAreErrors;
            return this;
        }

        public Builder maxFixPasses(int maxFixPasses) {
            this.maxFixPasses = maxFixPasses;
            return this;
        }

        public FormatOptions build() {
            return new FormatOptions(this);
        }
    }
}
