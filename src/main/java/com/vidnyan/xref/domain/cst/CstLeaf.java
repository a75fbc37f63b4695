package com.vidnyan.xref.domain.cst;

/**
 * Token leaf of the CST.
 */
public record CstLeaf(
    TokenType type,
    String value,
    SourceSpan span
) implements CstNode {

    @Override
    public String toString() {
        return type + "(" + value + ")@" + span.format();
    }
}
