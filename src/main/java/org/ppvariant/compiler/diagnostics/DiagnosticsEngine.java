package org.ppvariant.compiler.diagnostics;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Collects errors and warnings reported by the lexer and the front end so that all
 * problems of one file can be shown together instead of stopping at the first.
 */
public class DiagnosticsEngine {

    private final List<Diagnostic> diagnostics = new ArrayList<>();

    /**
     * Reports an error.
     * @param message The error message.
     * @param fileName The file in which the error occurred.
     * @param line The line number.
     */
    public void reportError(String message, String fileName, int line) {
        diagnostics.add(new Diagnostic(Diagnostic.Severity.ERROR, message, fileName, line));
    }

    /**
     * Reports a warning.
     * @param message The warning message.
     * @param fileName The file in which the warning occurred.
     * @param line The line number.
     */
    public void reportWarning(String message, String fileName, int line) {
        diagnostics.add(new Diagnostic(Diagnostic.Severity.WARNING, message, fileName, line));
    }

    /**
     * @return true if at least one error was reported.
     */
    public boolean hasErrors() {
        return diagnostics.stream().anyMatch(d -> d.severity() == Diagnostic.Severity.ERROR);
    }

    /**
     * @return All reported diagnostics in reporting order.
     */
    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    /**
     * Formats all diagnostics, one per line.
     * @return The formatted summary, or an empty string if nothing was reported.
     */
    public String summary() {
        return diagnostics.stream().map(Diagnostic::toString).collect(Collectors.joining("\n"));
    }
}
