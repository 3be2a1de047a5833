package org.ppvariant.compiler.frontend.preprocessor.flow;

import org.ppvariant.compiler.model.Token;

/**
 * Thrown when {@code `ifdef}, {@code `ifndef} or {@code `elsif} is not followed by a macro name.
 */
public class MalformedConditionalException extends FlowTreeException {

    /**
     * @param directive The directive that lacks its macro name
     */
    public MalformedConditionalException(Token directive) {
        super("Expected macro name after '" + directive.text() + "'", directive);
    }
}
