package org.ppvariant.cli.output;

import com.google.gson.stream.JsonWriter;
import org.ppvariant.compiler.model.Token;

import java.io.IOException;
import java.io.Writer;
import java.util.List;

/**
 * Streams variants as one JSON document:
 * <pre>
 * { "file": "...", "variants": [ { "index": 0, "tokens": ["module", "top", ...] } ], "count": 1 }
 * </pre>
 * Variants are written as they arrive, so memory use does not grow with the variant count.
 */
public class JsonVariantWriter implements VariantWriter {

    private final JsonWriter json;

    public JsonVariantWriter(Writer out) {
        this.json = new JsonWriter(out);
        this.json.setIndent("  ");
    }

    @Override
    public void begin(String fileName) throws IOException {
        json.beginObject();
        json.name("file").value(fileName);
        json.name("variants").beginArray();
    }

    @Override
    public void write(int index, List<Token> tokens) throws IOException {
        json.beginObject();
        json.name("index").value(index);
        json.name("tokens").beginArray();
        for (Token token : tokens) {
            json.value(token.text());
        }
        json.endArray();
        json.endObject();
    }

    @Override
    public void end(int count) throws IOException {
        json.endArray();
        json.name("count").value(count);
        json.endObject();
        json.flush();
    }
}
