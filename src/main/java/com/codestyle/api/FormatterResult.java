package com.codestyle.api;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import com.codestyle.api.error.Diagnostic;
import com.codestyle.workspace.Workspace;

/**
 * Result of a formatting step.
 */
public class FormatterResult {
    private final Workspace workspace;
    private final List<Diagnostic> reportedDiagnostics;
    private final boolean errorsReported;
    private final List<String> appliedFixers;
    private final int failureCount;
    private final boolean cancelled;
    private final Duration elapsed;

    private FormatterResult(Builder builder) {
        this.workspace = builder.workspace;
        this.reportedDiagnostics = List.copyOf(builder.reportedDiagnostics);
        this.errorsReported = builder.errorsReported;
        this.appliedFixers = List.copyOf(builder.appliedFixers);
        this.failureCount = builder.failureCount;
        this.cancelled = builder.cancelled;
        this.elapsed = builder.elapsed;
    }

    /**
     * The resulting snapshot. In report mode this is the input snapshot.
     */
    public Workspace getWorkspace() {
        return workspace;
    }

    public List<Diagnostic> getReportedDiagnostics() {
        return reportedDiagnostics;
    }

    /**
     * True when at least one finding was logged with error severity.
     */
    public boolean isErrorsReported() {
        return errorsReported;
    }

    /**
     * Ids of the fixers whose edits were adopted, in application order.
     */
    public List<String> getAppliedFixers() {
        return appliedFixers;
    }

    /**
     * Project analyses and document fixes that failed and were skipped.
     */
    public int getFailureCount() {
        return failureCount;
    }

    public boolean isCancelled() {
        return cancelled;
    }

    public Duration getElapsed() {
        return elapsed;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private Workspace workspace;
        private List<Diagnostic> reportedDiagnostics = new ArrayList<>();
        private boolean errorsReported;
        private List<String> appliedFixers = new ArrayList<>();
        private int failureCount;
        private boolean cancelled;
        private Duration elapsed = Duration.ZERO;

        public Builder workspace(Workspace workspace) {
            this.workspace = workspace;
            return this;
        }

        public Builder reportedDiagnostics(List<Diagnostic> diagnostics) {
            this.reportedDiagnostics = new ArrayList<>(diagnostics);
            return this;
        }

        public Builder errorsReported(boolean errorsReported) {
            this.errorsReported = errorsReported;
            return this;
        }

        public Builder addAppliedFixer(String fixerId) {
            this.appliedFixers.add(fixerId);
            return this;
        }

        public Builder failureCount(int failureCount) {
            this.failureCount = failureCount;
            return this;
        }

        public Builder addFailures(int failures) {
            this.failureCount += failures;
            return this;
        }

        public Builder cancelled(boolean cancelled) {
            this.cancelled = cancelled;
            return this;
        }

        public Builder elapsed(Duration elapsed) {
            this.elapsed = elapsed;
            return this;
        }

        public FormatterResult build() {
            return new FormatterResult(this);
        }
    }
}
