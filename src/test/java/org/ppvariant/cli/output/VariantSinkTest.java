package org.ppvariant.cli.output;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.ppvariant.compiler.frontend.preprocessor.flow.VariantEvent;
import org.ppvariant.compiler.model.Token;
import org.ppvariant.compiler.model.TokenType;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@Tag("unit")
@ExtendWith(MockitoExtension.class)
class VariantSinkTest {

    private static final List<Token> VARIANT = List.of(Token.of(TokenType.IDENTIFIER, "x"));

    @Mock
    private VariantWriter writer;

    @Test
    void forwardsCompletedVariantsAndIgnoresVisits() throws IOException {
        VariantSink sink = new VariantSink(writer, 0);

        assertThat(sink.receive(new VariantEvent.Visiting(List.of(), 0))).isTrue();
        assertThat(sink.receive(new VariantEvent.Completed(VARIANT, 0))).isTrue();

        verify(writer).write(eq(0), eq(VARIANT));
        assertThat(sink.getWritten()).isEqualTo(1);
    }

    @Test
    void stopsAtLimit() throws IOException {
        VariantSink sink = new VariantSink(writer, 1);

        sink.receive(new VariantEvent.Completed(VARIANT, 0));

        assertThat(sink.receive(new VariantEvent.Visiting(List.of(), 1))).isFalse();
        assertThat(sink.receive(new VariantEvent.Completed(VARIANT, 1))).isFalse();
        verify(writer, never()).write(eq(1), anyList());
        assertThat(sink.getWritten()).isEqualTo(1);
    }

    @Test
    void writeFailuresAbortAsUncheckedIoException() throws IOException {
        doThrow(new IOException("disk full")).when(writer).write(anyInt(), anyList());
        VariantSink sink = new VariantSink(writer, 0);

        assertThatThrownBy(() -> sink.receive(new VariantEvent.Completed(VARIANT, 3)))
                .isInstanceOf(UncheckedIOException.class)
                .hasMessageContaining("variant 3")
                .hasRootCauseMessage("disk full");
    }

    @Test
    void negativeLimitIsRejected() {
        assertThatThrownBy(() -> new VariantSink(writer, -1)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void textWriterPrintsHeaderAndJoinedTokens() throws IOException {
        StringWriter out = new StringWriter();
        VariantWriter text = OutputFormat.parse("TEXT").createWriter(out, "|");

        text.begin("f.v");
        text.write(2, List.of(Token.of(TokenType.IDENTIFIER, "a"), Token.of(TokenType.SYMBOL, ";")));
        text.end(1);

        assertThat(out.toString()).isEqualTo("// variant 2\na|;\n");
    }

    @Test
    void unknownFormatIsRejected() {
        assertThatThrownBy(() -> OutputFormat.parse("xml"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("xml");
    }
}
