package com.vidnyan.xref.domain.cst;

/**
 * Type of a CST node: either a grammar symbol (composite) or a token kind (leaf).
 */
public interface NodeType {

    /**
     * Name as it appears in the grammar, e.g. {@code expr_stmt} or {@code NAME}.
     */
    String grammarName();

    boolean isToken();
}
