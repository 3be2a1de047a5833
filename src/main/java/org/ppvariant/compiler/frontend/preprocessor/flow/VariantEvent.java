package org.ppvariant.compiler.frontend.preprocessor.flow;

import org.ppvariant.compiler.model.Token;

import java.util.List;

/**
 * An event emitted to a {@link VariantReceiver} during enumeration.
 */
public sealed interface VariantEvent permits VariantEvent.Visiting, VariantEvent.Completed {

    /** The tokens materialized so far, directives excluded. */
    List<Token> tokens();

    /** The index the next (or this) completed variant carries. */
    int variantIndex();

    /**
     * A node is about to be explored.
     *
     * @param tokens Read-only live view of the current path's output, valid only during the callback.
     * @param variantIndex The number of variants completed so far.
     */
    record Visiting(List<Token> tokens, int variantIndex) implements VariantEvent {
    }

    /**
     * A path reached the last token and produced a variant.
     *
     * @param tokens The complete variant; immutable and safe to keep.
     * @param variantIndex The 0-based ordinal of this variant.
     */
    record Completed(List<Token> tokens, int variantIndex) implements VariantEvent {
    }
}
