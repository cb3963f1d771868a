package org.pragmatica.sentinel.lint;

import io.vavr.control.Option;

import static io.vavr.control.Option.none;
import static io.vavr.control.Option.some;

/**
 * Rendered lint finding, ready for a console or CI report.
 *
 * @param ruleId   rule that produced the finding
 * @param severity configured severity
 * @param file     file name the finding belongs to
 * @param line     1-based line, 0 when unknown
 * @param column   1-based column, 0 when unknown
 * @param message  short message
 * @param detail   longer explanation
 * @param docLink  help link, if the rule has one
 */
public record Diagnostic(String ruleId,
                         DiagnosticSeverity severity,
                         String file,
                         int line,
                         int column,
                         String message,
                         String detail,
                         Option<String> docLink) {

    public static Diagnostic diagnostic(String ruleId,
                                        DiagnosticSeverity severity,
                                        String file,
                                        int line,
                                        int column,
                                        String message,
                                        String detail) {
        return new Diagnostic(ruleId, severity, file, line, column, message, detail, none());
    }

    public Diagnostic withDocLink(String link) {
        return new Diagnostic(ruleId, severity, file, line, column, message, detail, some(link));
    }

    public boolean isError() {
        return severity == DiagnosticSeverity.ERROR;
    }

    /**
     * One-line rendering: {@code file:line:column: severity [RULE] message}.
     */
    public String format() {
        return file + ":" + line + ":" + column + ": " + severity.label() + " [" + ruleId + "] " + message;
    }
}
