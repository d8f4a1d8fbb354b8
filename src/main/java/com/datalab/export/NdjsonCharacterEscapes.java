package com.datalab.export;

import com.fasterxml.jackson.core.SerializableString;
import com.fasterxml.jackson.core.io.CharacterEscapes;
import com.fasterxml.jackson.core.io.SerializedString;

/**
 * Escaping compatible with the NDJSON consumers of the export: {@code <}, {@code >}, {@code &}, U+2028 and
 * U+2029 are written as lowercase {@code \\uXXXX} sequences, as are control characters that have no short
 * escape. Everything else is written as plain UTF-8.
 */
final class NdjsonCharacterEscapes extends CharacterEscapes {
    private static final long serialVersionUID = 1L;

    private final int[] asciiEscapes;

    NdjsonCharacterEscapes() {
        int[] escapes = CharacterEscapes.standardAsciiEscapesForJSON();
        for (int ch = 0; ch < 0x20; ch++) {
            if (escapes[ch] == CharacterEscapes.ESCAPE_STANDARD) {
                escapes[ch] = CharacterEscapes.ESCAPE_CUSTOM;
            }
        }
        escapes['<'] = CharacterEscapes.ESCAPE_CUSTOM;
        escapes['>'] = CharacterEscapes.ESCAPE_CUSTOM;
        escapes['&'] = CharacterEscapes.ESCAPE_CUSTOM;
        this.asciiEscapes = escapes;
    }

    @Override
    public int[] getEscapeCodesForAscii() {
        return asciiEscapes;
    }

    @Override
    public SerializableString getEscapeSequence(int ch) {
        if (ch < 0x80 || ch == 0x2028 || ch == 0x2029) {
            return new SerializedString(unicodeEscape(ch));
        }
        return null;
    }

    /**
     * Characters that must be escaped even inside already-encoded JSON text.
     */
    static boolean escapesInText(int ch) {
        return ch == '<' || ch == '>' || ch == '&' || ch == 0x2028 || ch == 0x2029;
    }

    static String unicodeEscape(int ch) {
        return String.format("\\u%04x", ch);
    }
}
