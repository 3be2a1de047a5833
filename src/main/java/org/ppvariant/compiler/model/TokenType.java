package org.ppvariant.compiler.model;

/**
 * Defines the closed set of token kinds produced by the lexer and consumed by the
 * conditional flow analysis.
 * <p>
 * All {@code PP_*} kinds belong to the preprocessor layer and never appear in a
 * materialized variant.
 */
public enum TokenType {
    // Conditional directives
    PP_IFDEF, PP_IFNDEF, PP_ELSIF, PP_ELSE, PP_ENDIF,

    // Macro name following a directive
    PP_IDENTIFIER,

    // Macro definitions
    PP_DEFINE, PP_DEFINE_BODY,

    // Source text
    MACRO_CALL, IDENTIFIER, NUMBER, STRING, SYMBOL;

    /**
     * Checks whether this kind opens, continues or closes a conditional block.
     * @return true for {@code `ifdef}, {@code `ifndef}, {@code `elsif}, {@code `else} and {@code `endif}.
     */
    public boolean isConditional() {
        return switch (this) {
            case PP_IFDEF, PP_IFNDEF, PP_ELSIF, PP_ELSE, PP_ENDIF -> true;
            default -> false;
        };
    }

    /**
     * Checks whether this kind tests a macro and therefore splits the flow in two.
     * @return true for {@code `ifdef}, {@code `ifndef} and {@code `elsif}.
     */
    public boolean isBranching() {
        return this == PP_IFDEF || this == PP_IFNDEF || this == PP_ELSIF;
    }

    /**
     * Checks whether this kind continues or closes an open block. A plain fall-through
     * edge never leads into such a token; the block edges handle it.
     * @return true for {@code `elsif}, {@code `else} and {@code `endif}.
     */
    public boolean isBlockContinuation() {
        return this == PP_ELSIF || this == PP_ELSE || this == PP_ENDIF;
    }

    /**
     * Checks whether tokens of this kind are stripped from materialized variants.
     * @return true for every {@code PP_*} kind.
     */
    public boolean isPreprocessorOnly() {
        return switch (this) {
            case PP_IFDEF, PP_IFNDEF, PP_ELSIF, PP_ELSE, PP_ENDIF,
                 PP_IDENTIFIER, PP_DEFINE, PP_DEFINE_BODY -> true;
            default -> false;
        };
    }
}
