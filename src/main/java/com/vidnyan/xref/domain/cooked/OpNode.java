package com.vidnyan.xref.domain.cooked;

import com.vidnyan.xref.domain.cst.CstLeaf;

import java.util.List;

/**
 * Unary (one argument) or binary (two arguments) operator application.
 * Chains such as {@code a + b - c} nest to the left.
 */
public record OpNode(
    CstLeaf op,
    List<CookedNode> args
) implements CookedNode {

    public OpNode {
        args = List.copyOf(args);
    }

    @Override
    public List<CookedNode> children() {
        return List.copyOf(args);
    }
}
