package com.datalab.export;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonFactoryBuilder;
import com.fasterxml.jackson.core.JsonParseException;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;

/**
 * Writes one compact JSON document per line to a sink and flushes after every line.
 *
 * <p>Each record is fully encoded before its first byte reaches the sink, so an encoding problem never
 * leaves half a line behind. Failures of the sink itself surface as {@link SinkWriteException}.
 */
public class JsonLinesWriter {
    private static final byte NEWLINE = '\n';

    private final OutputStream sink;
    private final ObjectMapper objectMapper;

    public JsonLinesWriter(OutputStream sink) {
        this(sink, newMapper());
    }

    JsonLinesWriter(OutputStream sink, ObjectMapper objectMapper) {
        this.sink = sink;
        this.objectMapper = objectMapper;
    }

    public static ObjectMapper newMapper() {
        JsonFactory factory = new JsonFactoryBuilder()
                .characterEscapes(new NdjsonCharacterEscapes())
                .build();
        return JsonMapper.builder(factory).build();
    }

    public void writeValue(Object value) throws IOException {
        writeLine(objectMapper.writeValueAsString(value));
    }

    /**
     * Writes already-encoded JSON text as one line, unchanged.
     */
    public void writeRaw(String json) throws IOException {
        writeLine(json);
    }

    /**
     * Drops insignificant whitespace from a single JSON value. Everything else is kept as written, including
     * number spelling and string escapes; only markup characters and line separators get escaped.
     */
    public String compact(String json) throws IOException {
        try (JsonParser parser = objectMapper.createParser(json)) {
            if (parser.nextToken() == null) {
                throw new JsonParseException(parser, "Expected a JSON value");
            }
            parser.skipChildren();
            if (parser.nextToken() != null) {
                throw new JsonParseException(parser, "Trailing content after JSON value");
            }
        }
        StringBuilder out = new StringBuilder(json.length());
        boolean inString = false;
        for (int i = 0; i < json.length(); i++) {
            char ch = json.charAt(i);
            if (inString) {
                if (ch == '\\') {
                    out.append(ch).append(json.charAt(++i));
                    continue;
                }
                if (ch == '"') {
                    inString = false;
                }
            } else if (ch == ' ' || ch == '\t' || ch == '\n' || ch == '\r') {
                continue;
            } else if (ch == '"') {
                inString = true;
            }
            if (NdjsonCharacterEscapes.escapesInText(ch)) {
                out.append(NdjsonCharacterEscapes.unicodeEscape(ch));
            } else {
                out.append(ch);
            }
        }
        return out.toString();
    }

    private void writeLine(String json) throws IOException {
        byte[] bytes = json.getBytes(StandardCharsets.UTF_8);
        try {
            sink.write(bytes);
            sink.write(NEWLINE);
            sink.flush();
        } catch (IOException e) {
            throw new SinkWriteException(e);
        }
    }

    /**
     * The output sink rejected a write, typically because the consumer disconnected.
     */
    public static class SinkWriteException extends IOException {
        private static final long serialVersionUID = 1L;

        SinkWriteException(IOException cause) {
            super(cause.getMessage(), cause);
        }
    }
}
