package com.vidnyan.xref.domain.cst;

/**
 * Node of the concrete syntax tree: a {@link CstLeaf} or a {@link CstComposite}.
 * Read-only once built.
 */
public interface CstNode {

    NodeType type();

    SourceSpan span();

    /**
     * True if this is a leaf of the given token type.
     */
    default boolean is(TokenType tokenType) {
        return type() == tokenType;
    }

    /**
     * True if this is a composite node of the given symbol.
     */
    default boolean is(Symbol symbol) {
        return type() == symbol;
    }

    /**
     * True if this is a NAME leaf with exactly the given text (keywords are NAME tokens).
     */
    default boolean isKeyword(String keyword) {
        return this instanceof CstLeaf leaf
                && leaf.type() == TokenType.NAME
                && leaf.value().equals(keyword);
    }
}
