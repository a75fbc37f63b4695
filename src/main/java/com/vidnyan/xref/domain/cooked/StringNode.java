package com.vidnyan.xref.domain.cooked;

import com.vidnyan.xref.domain.cst.CstLeaf;

import java.util.List;

/**
 * One or more adjacent string literals (implicit concatenation).
 */
public record StringNode(List<CstLeaf> tokens) implements CookedNode {

    public StringNode {
        tokens = List.copyOf(tokens);
    }
}
