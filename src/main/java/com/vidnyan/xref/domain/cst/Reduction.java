package com.vidnyan.xref.domain.cst;

import java.util.List;

/**
 * A raw grammar reduction reported by the parser: the node type that was recognized, its literal
 * text (tokens only), its already-built children and the position where it starts.
 */
public record Reduction(
    NodeType type,
    String value,
    List<CstNode> children,
    SourceSpan context
) {

    public static Reduction token(TokenType type, String value, SourceSpan span) {
        return new Reduction(type, value, List.of(), span);
    }

    public static Reduction symbol(Symbol symbol, List<CstNode> children) {
        return new Reduction(symbol, null, children, SourceSpan.NONE);
    }
}
