package com.codestyle.api.error;

public enum Severity {
    FATAL,   // Analysis could not run at all
    ERROR,   // Rule violations that must be fixed
    WARNING, // Style violations
    INFO     // Informational findings
}
