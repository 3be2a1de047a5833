package org.ppvariant.compiler.frontend.preprocessor.flow;

import org.ppvariant.compiler.model.Token;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collections;
import java.util.List;

/**
 * Mutable state of one depth-first enumeration. Every change made on the way down is
 * undone on the way back up, so sibling paths see the state their common parent saw.
 * Owned by a single enumeration call and never shared.
 */
final class TraversalState {

    private final BitSet defined = new BitSet();
    private final BitSet assumed = new BitSet();
    private final List<Token> output = new ArrayList<>();
    private final List<Token> outputView = Collections.unmodifiableList(output);
    private int variantCount;

    boolean isAssumed(int macroId) {
        return assumed.get(macroId);
    }

    boolean isDefined(int macroId) {
        return defined.get(macroId);
    }

    /**
     * Fixes the truth value of a macro for the rest of the current path.
     */
    void assume(int macroId, boolean isDefined) {
        assumed.set(macroId);
        defined.set(macroId, isDefined);
    }

    /**
     * Restores a macro to the values it had before {@link #assume(int, boolean)}.
     */
    void restore(int macroId, boolean wasAssumed, boolean wasDefined) {
        assumed.set(macroId, wasAssumed);
        defined.set(macroId, wasDefined);
    }

    void push(Token token) {
        output.add(token);
    }

    void pop() {
        output.remove(output.size() - 1);
    }

    /**
     * @return A read-only live view of the output built so far.
     */
    List<Token> outputView() {
        return outputView;
    }

    /**
     * @return An immutable snapshot of the output built so far.
     */
    List<Token> snapshot() {
        return List.copyOf(output);
    }

    int variantCount() {
        return variantCount;
    }

    void countVariant() {
        variantCount++;
    }
}
