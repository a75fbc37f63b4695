package com.vidnyan.xref.adapter.out.parser;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;

/**
 * Maps code point indices of the decoded text back to byte offsets in the file as stored.
 * Each code point is measured in the charset the file was decoded with, after the byte order
 * mark if there was one.
 */
final class SourceOffsets {

    private final int[] offsets;

    private SourceOffsets(int[] offsets) {
        this.offsets = offsets;
    }

    /**
     * @param text       decoded text, possibly with a newline appended past the end of the file
     * @param charset    charset the file was decoded with
     * @param prefix     bytes before the first character, such as a byte order mark
     * @param fileLength length of the file; offsets past it are clamped
     */
    static SourceOffsets of(String text, Charset charset, int prefix, int fileLength) {
        int[] offsets = new int[text.codePointCount(0, text.length()) + 1];
        boolean singleByte = charset.newEncoder().maxBytesPerChar() == 1.0f;
        int offset = prefix;
        int index = 0;
        for (int i = 0; i < text.length(); ) {
            int codePoint = text.codePointAt(i);
            offsets[index++] = Math.min(offset, fileLength);
            offset += singleByte ? 1 : encodedLength(codePoint, charset);
            i += Character.charCount(codePoint);
        }
        offsets[index] = Math.min(offset, fileLength);
        return new SourceOffsets(offsets);
    }

    /**
     * Byte offset of the code point at {@code index}; the length of the text maps to its end.
     */
    int byteAt(int index) {
        return offsets[Math.max(0, Math.min(index, offsets.length - 1))];
    }

    private static int encodedLength(int codePoint, Charset charset) {
        if (charset.equals(StandardCharsets.UTF_8)) {
            if (codePoint < 0x80) {
                return 1;
            }
            if (codePoint < 0x800) {
                return 2;
            }
            return codePoint < 0x10000 ? 3 : 4;
        }
        return new String(Character.toChars(codePoint)).getBytes(charset).length;
    }
}
