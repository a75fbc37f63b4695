package com.vidnyan.xref.domain.cooked;

import com.vidnyan.xref.domain.cst.CstLeaf;

import java.util.List;

/**
 * A comparison operator; {@code not in} and {@code is not} have two tokens.
 */
public record CompOpNode(List<CstLeaf> ops) implements CookedNode {

    public CompOpNode {
        ops = List.copyOf(ops);
    }
}
