package org.ppvariant.compiler.diagnostics;

/**
 * A single message reported while reading a source file.
 *
 * @param severity The severity.
 * @param message The human-readable message.
 * @param fileName The file the message refers to.
 * @param line The 1-based line, or 0 if unknown.
 */
public record Diagnostic(Severity severity, String message, String fileName, int line) {

    /**
     * Severity of a {@link Diagnostic}.
     */
    public enum Severity {
        ERROR,
        WARNING
    }

    @Override
    public String toString() {
        return "[" + severity + "] " + fileName + ":" + line + ": " + message;
    }
}
