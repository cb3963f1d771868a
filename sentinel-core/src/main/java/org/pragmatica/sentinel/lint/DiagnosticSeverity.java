package org.pragmatica.sentinel.lint;

/**
 * Severity of a reported diagnostic.
 */
public enum DiagnosticSeverity {
    ERROR,
    WARNING,
    INFO;

    public String label() {
        return name().toLowerCase();
    }
}
