package org.ppvariant.cli.output;

import org.ppvariant.compiler.frontend.preprocessor.flow.VariantEvent;
import org.ppvariant.compiler.frontend.preprocessor.flow.VariantReceiver;

import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * Receiver that forwards completed variants to a {@link VariantWriter} and stops the
 * enumeration once a limit is reached.
 */
public class VariantSink implements VariantReceiver {

    private final VariantWriter writer;
    private final int limit;
    private int written;

    /**
     * @param writer The destination for completed variants.
     * @param limit The maximum number of variants to write, or 0 for no limit.
     */
    public VariantSink(VariantWriter writer, int limit) {
        if (limit < 0) {
            throw new IllegalArgumentException("limit must not be negative, got " + limit);
        }
        this.writer = writer;
        this.limit = limit;
    }

    @Override
    public boolean receive(VariantEvent event) {
        if (event instanceof VariantEvent.Completed completed) {
            if (isFull()) {
                return false;
            }
            try {
                writer.write(completed.variantIndex(), completed.tokens());
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to write variant " + completed.variantIndex(), e);
            }
            written++;
            return true;
        }
        return !isFull();
    }

    public int getWritten() {
        return written;
    }

    private boolean isFull() {
        return limit > 0 && written >= limit;
    }
}
