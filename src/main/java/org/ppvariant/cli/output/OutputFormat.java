package org.ppvariant.cli.output;

import java.io.Writer;
import java.util.Locale;

/**
 * Output formats for variants.
 */
public enum OutputFormat {
    TEXT,
    JSON;

    /**
     * Parses a format name case-insensitively.
     * @param name The format name, e.g. {@code "json"}.
     * @return The format.
     * @throws IllegalArgumentException if the name is unknown.
     */
    public static OutputFormat parse(String name) {
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown output format '" + name + "', expected text or json", e);
        }
    }

    /**
     * Creates a writer for this format.
     * @param out The destination.
     * @param separator The token separator used by the text format.
     * @return A new variant writer.
     */
    public VariantWriter createWriter(Writer out, String separator) {
        return switch (this) {
            case TEXT -> new TextVariantWriter(out, separator);
            case JSON -> new JsonVariantWriter(out);
        };
    }
}
