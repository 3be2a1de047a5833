package org.ppvariant.compiler.frontend.preprocessor.flow;

import org.ppvariant.compiler.model.Token;

/**
 * Thrown when a token stream cannot be turned into a conditional flow graph.
 * <p>
 * Construction is a deterministic function of the input, so a failure is final for
 * that input. This is a RuntimeException because it describes malformed source that
 * the caller can only report, not recover from.
 */
public class FlowTreeException extends RuntimeException {

    private final transient Token token;

    /**
     * Creates a FlowTreeException that points at an offending token.
     *
     * @param message Description of the problem
     * @param token The token the problem was detected at, or null if there is none
     */
    public FlowTreeException(String message, Token token) {
        super(token == null ? message : message + " at " + token.location());
        this.token = token;
    }

    /**
     * @return The token the problem was detected at, or null if the problem has no single location.
     */
    public Token getToken() {
        return token;
    }
}
