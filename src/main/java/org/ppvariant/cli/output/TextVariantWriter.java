package org.ppvariant.cli.output;

import org.ppvariant.compiler.model.Token;

import java.io.IOException;
import java.io.Writer;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Writes each variant as a {@code // variant <i>} header followed by its token texts on one line.
 */
public class TextVariantWriter implements VariantWriter {

    private final Writer out;
    private final String separator;

    public TextVariantWriter(Writer out, String separator) {
        this.out = out;
        this.separator = separator;
    }

    @Override
    public void begin(String fileName) {
        // No header; the text format lists variants only.
    }

    @Override
    public void write(int index, List<Token> tokens) throws IOException {
        out.write("// variant " + index + "\n");
        out.write(tokens.stream().map(Token::text).collect(Collectors.joining(separator)));
        out.write("\n");
    }

    @Override
    public void end(int count) throws IOException {
        out.flush();
    }
}
