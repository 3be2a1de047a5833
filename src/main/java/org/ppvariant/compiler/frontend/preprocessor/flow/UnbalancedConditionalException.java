package org.ppvariant.compiler.frontend.preprocessor.flow;

import org.ppvariant.compiler.model.Token;

/**
 * Thrown when conditional directives do not nest into complete blocks: a continuation
 * without an open block, a misplaced {@code `else} or {@code `elsif}, or a block that is
 * never closed.
 */
public class UnbalancedConditionalException extends FlowTreeException {

    /**
     * @param message Description of the imbalance
     * @param token The directive where it was detected
     */
    public UnbalancedConditionalException(String message, Token token) {
        super(message, token);
    }
}
