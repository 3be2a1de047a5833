package org.ppvariant.compiler.frontend.preprocessor.flow;

import org.ppvariant.compiler.model.Token;

/**
 * Thrown when a file tests more distinct macros than the configured limit.
 */
public class MacroLimitExceededException extends FlowTreeException {

    private final int limit;

    /**
     * @param macroName The token naming the first macro over the limit
     * @param limit The maximum number of distinct conditional macros
     */
    public MacroLimitExceededException(Token macroName, int limit) {
        super("Too many distinct conditional macros (limit " + limit + "), '"
                + macroName.text() + "' would exceed it", macroName);
        this.limit = limit;
    }

    public int getLimit() {
        return limit;
    }
}
