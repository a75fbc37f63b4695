package com.vidnyan.xref.domain.cst;

/**
 * Location of a token in the analyzed file.
 * Byte offsets index the file as stored, byte order mark included; line is 1-based, column 0-based
 * and counted in code points.
 */
public record SourceSpan(
    int startByte,
    int endByte,
    int line,
    int column
) {

    public static final SourceSpan NONE = new SourceSpan(0, 0, 0, 0);

    /**
     * Span covering both {@code this} and {@code other}, positioned at {@code this}.
     */
    public SourceSpan to(SourceSpan other) {
        return new SourceSpan(startByte, Math.max(endByte, other.endByte), line, column);
    }

    public String format() {
        return line + ":" + column;
    }
}
