package com.codestyle.api.error;

/**
 * Failure of an analyzer batch for a single project.
 */
public class ProjectAnalysisException extends RuntimeException {
    private final String projectName;
    private final String analyzerId;

    public ProjectAnalysisException(String projectName, String analyzerId, Throwable cause) {
        super("Analyzer '" + analyzerId + "' failed for project '" + projectName + "': " + cause.getMessage(), cause);
        this.projectName = projectName;
        this.analyzerId = analyzerId;
    }

    public String getProjectName() {
        return projectName;
    }

    public String getAnalyzerId() {
        return analyzerId;
    }
}
