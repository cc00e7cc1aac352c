package io.github.pyfuncs.util;

import com.fasterxml.jackson.core.JsonFactoryBuilder;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.SerializableString;
import com.fasterxml.jackson.core.io.CharacterEscapes;
import com.fasterxml.jackson.core.io.SerializedString;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.core.util.MinimalPrettyPrinter;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * JSON utility class for pyfuncs output.
 *
 * <p>Output mirrors the layout of Python's {@code json.dumps}: two-space indentation, {@code "key": value} pairs,
 * {@code []} for empty arrays and every character outside printable ASCII written as a lowercase hex escape, one per
 * UTF-16 unit.
 */
public final class Json {

    private static final ObjectMapper MAPPER = createMapper();

    private Json() {
        // Utility class - no instantiation
    }

    private static ObjectMapper createMapper() {
        var factory = new JsonFactoryBuilder().characterEscapes(new AsciiOnlyEscapes()).build();
        return JsonMapper.builder(factory)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .build();
    }

    /** Serializes an object to indented JSON. */
    public static String toJson(Object obj) {
        try {
            return MAPPER.writer(new IndentedPrinter()).writeValueAsString(obj);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to serialize object to JSON", e);
        }
    }

    /** Serializes an object to single-line JSON with {@code ": "} and {@code ", "} separators. */
    public static String toCompactJson(Object obj) {
        try {
            return MAPPER.writer(new SingleLinePrinter()).writeValueAsString(obj);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to serialize object to JSON", e);
        }
    }

    /** Gets the configured ObjectMapper instance for advanced usage. */
    public static ObjectMapper getMapper() {
        return MAPPER;
    }

    private static final class IndentedPrinter extends DefaultPrettyPrinter {
        private static final long serialVersionUID = 1L;

        IndentedPrinter() {
            var indenter = new DefaultIndenter("  ", "\n");
            indentArraysWith(indenter);
            indentObjectsWith(indenter);
        }

        @Override
        public DefaultPrettyPrinter createInstance() {
            return new IndentedPrinter();
        }

        @Override
        public void writeObjectFieldValueSeparator(JsonGenerator g) throws IOException {
            g.writeRaw(": ");
        }

        @Override
        public void writeEndArray(JsonGenerator g, int nrOfValues) throws IOException {
            if (!_arrayIndenter.isInline()) {
                --_nesting;
            }
            if (nrOfValues > 0) {
                _arrayIndenter.writeIndentation(g, _nesting);
            }
            g.writeRaw(']');
        }

        @Override
        public void writeEndObject(JsonGenerator g, int nrOfEntries) throws IOException {
            if (!_objectIndenter.isInline()) {
                --_nesting;
            }
            if (nrOfEntries > 0) {
                _objectIndenter.writeIndentation(g, _nesting);
            }
            g.writeRaw('}');
        }
    }

    private static final class SingleLinePrinter extends MinimalPrettyPrinter {
        private static final long serialVersionUID = 1L;

        @Override
        public void writeObjectFieldValueSeparator(JsonGenerator g) throws IOException {
            g.writeRaw(": ");
        }

        @Override
        public void writeObjectEntrySeparator(JsonGenerator g) throws IOException {
            g.writeRaw(", ");
        }

        @Override
        public void writeArrayValueSeparator(JsonGenerator g) throws IOException {
            g.writeRaw(", ");
        }
    }

    /** Escapes control characters, DEL and everything above it with lowercase hex digits. */
    private static final class AsciiOnlyEscapes extends CharacterEscapes {
        private static final long serialVersionUID = 1L;

        private final int[] asciiEscapes;

        AsciiOnlyEscapes() {
            asciiEscapes = CharacterEscapes.standardAsciiEscapesForJSON();
            for (int c = 0; c < asciiEscapes.length; c++) {
                if (asciiEscapes[c] == CharacterEscapes.ESCAPE_STANDARD) {
                    asciiEscapes[c] = CharacterEscapes.ESCAPE_CUSTOM;
                }
            }
            asciiEscapes[0x7F] = CharacterEscapes.ESCAPE_CUSTOM;
        }

        @Override
        public int[] getEscapeCodesForAscii() {
            return asciiEscapes;
        }

        @Override
        public SerializableString getEscapeSequence(int ch) {
            return new SerializedString(String.format("\\u%04x", ch));
        }
    }
}
