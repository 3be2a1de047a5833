package org.ppvariant.compiler.api;

import org.ppvariant.compiler.diagnostics.Diagnostic;

import java.util.List;

/**
 * Thrown when a source file cannot be analyzed: the lexer reported errors or the
 * conditional directives do not form a valid flow graph. The message contains every
 * reported problem, one per line.
 */
public class CompilationException extends Exception {

    private final List<Diagnostic> diagnostics;

    /**
     * @param message The formatted error messages
     * @param diagnostics The diagnostics that caused the failure
     */
    public CompilationException(String message, List<Diagnostic> diagnostics) {
        super(message);
        this.diagnostics = List.copyOf(diagnostics);
    }

    /**
     * @param message The error message
     * @param cause The structural error raised while building the flow graph
     */
    public CompilationException(String message, Throwable cause) {
        super(message, cause);
        this.diagnostics = List.of();
    }

    public List<Diagnostic> getDiagnostics() {
        return diagnostics;
    }
}
