package org.ppvariant.compiler.frontend.preprocessor.flow;

import java.util.List;

/**
 * A complete conditional block, given as token indices.
 *
 * @param openIndex Index of the opening {@code `ifdef} or {@code `ifndef}.
 * @param negated True if the block was opened by {@code `ifndef}.
 * @param elsifIndices Indices of the {@code `elsif} directives in source order.
 * @param elseIndex Index of the {@code `else}, or {@link #NONE}.
 * @param endifIndex Index of the closing {@code `endif}.
 */
public record ConditionalBlock(int openIndex, boolean negated, List<Integer> elsifIndices,
                               int elseIndex, int endifIndex) {

    /** Marker for an absent {@code `else}. */
    public static final int NONE = -1;

    public ConditionalBlock {
        elsifIndices = List.copyOf(elsifIndices);
    }

    public boolean hasElse() {
        return elseIndex != NONE;
    }

    /**
     * Returns where control goes when the branch directive at position {@code i} of the
     * chain is false: the next {@code `elsif}, else the {@code `else}, else the {@code `endif}.
     * Position -1 stands for the opening directive.
     * @param i Position in the elsif chain, or -1 for the opening directive.
     * @return The index of the false successor.
     */
    int falseSuccessorOf(int i) {
        if (i + 1 < elsifIndices.size()) {
            return elsifIndices.get(i + 1);
        }
        return hasElse() ? elseIndex : endifIndex;
    }
}
