package org.ppvariant.cli.output;

import org.ppvariant.compiler.model.Token;

import java.io.IOException;
import java.util.List;

/**
 * Writes completed variants in one output format.
 */
public interface VariantWriter {

    /**
     * Called once before the first variant.
     * @param fileName The analyzed file.
     * @throws IOException if writing fails.
     */
    void begin(String fileName) throws IOException;

    /**
     * Writes one variant.
     * @param index The variant's 0-based ordinal.
     * @param tokens The variant's tokens.
     * @throws IOException if writing fails.
     */
    void write(int index, List<Token> tokens) throws IOException;

    /**
     * Called once after the last variant.
     * @param count The number of variants written.
     * @throws IOException if writing fails.
     */
    void end(int count) throws IOException;
}
