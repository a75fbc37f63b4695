package com.vidnyan.xref.adapter.out.parser;

import lombok.extern.slf4j.Slf4j;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.StandardCharsets;
import java.nio.charset.UnsupportedCharsetException;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Detects the encoding of a Python source file and decodes it (PEP 263).
 *
 * <p>A UTF-8 byte order mark wins; otherwise a {@code coding[:=]} cookie in a comment on the
 * first or second line; otherwise UTF-8. The second line is only examined when the first is
 * blank or a comment.
 */
@Slf4j
final class SourceDecoder {

    private static final byte[] UTF8_BOM = {(byte) 0xEF, (byte) 0xBB, (byte) 0xBF};
    private static final Pattern COOKIE = Pattern.compile("^[ \\t\\f]*#.*?coding[:=][ \\t]*([-\\w.]+)");
    private static final Pattern BLANK_OR_COMMENT = Pattern.compile("^[ \\t\\f]*(?:[#\\r\\n]|$)");

    private SourceDecoder() {
    }

    /**
     * @param byteOffset bytes of the file before the first decoded character
     */
    record DecodedSource(String text, Charset charset, int byteOffset) {}

    static DecodedSource decode(byte[] source) {
        boolean bom = startsWithBom(source);
        int offset = bom ? UTF8_BOM.length : 0;

        Charset charset = StandardCharsets.UTF_8;
        String first = asciiLine(source, offset);
        Charset cookie = cookie(first, 1);
        if (cookie == null && BLANK_OR_COMMENT.matcher(first).find()) {
            cookie = cookie(asciiLine(source, offset + first.length()), 2);
        }
        if (cookie != null) {
            if (bom && !cookie.equals(StandardCharsets.UTF_8)) {
                throw new PythonSyntaxException("Encoding cookie " + cookie + " conflicts with UTF-8 BOM", 1, 0);
            }
            charset = cookie;
        }
        log.debug("Source encoding: {}{}", charset, bom ? " (BOM)" : "");

        try {
            String text = charset.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(source, offset, source.length - offset))
                    .toString();
            return new DecodedSource(text, charset, offset);
        } catch (CharacterCodingException e) {
            throw new PythonSyntaxException("Source is not valid " + charset + ": " + e.getMessage(), 1, 0);
        }
    }

    private static boolean startsWithBom(byte[] source) {
        return source.length >= 3
                && source[0] == UTF8_BOM[0] && source[1] == UTF8_BOM[1] && source[2] == UTF8_BOM[2];
    }

    /**
     * One line (with its terminator) starting at {@code from}, read as ISO-8859-1 so that the
     * cookie can be found before the real encoding is known.
     */
    private static String asciiLine(byte[] source, int from) {
        int end = from;
        while (end < source.length && source[end] != '\n') {
            end++;
        }
        if (end < source.length) {
            end++;
        }
        return new String(source, from, end - from, StandardCharsets.ISO_8859_1);
    }

    private static Charset cookie(String line, int lineNumber) {
        Matcher matcher = COOKIE.matcher(line);
        if (!matcher.find()) {
            return null;
        }
        String name = normalName(matcher.group(1));
        try {
            return Charset.forName(name);
        } catch (IllegalCharsetNameException | UnsupportedCharsetException e) {
            throw new PythonSyntaxException("Unknown encoding: " + matcher.group(1), lineNumber, matcher.start(1));
        }
    }

    static String normalName(String encoding) {
        String name = encoding.toLowerCase(Locale.ROOT).replace('_', '-');
        if (name.equals("utf-8") || name.startsWith("utf-8-")) {
            return "UTF-8";
        }
        for (String latin1 : new String[] {"latin-1", "iso-8859-1", "iso-latin-1"}) {
            if (name.equals(latin1) || name.startsWith(latin1 + "-")) {
                return "ISO-8859-1";
            }
        }
        return encoding;
    }
}
