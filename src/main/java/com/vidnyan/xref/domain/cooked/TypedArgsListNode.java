package com.vidnyan.xref.domain.cooked;

import java.util.List;

/**
 * Parameters of a function or lambda; empty when there are none.
 */
public record TypedArgsListNode(List<TypedArgNode> args) implements CookedNode {

    public TypedArgsListNode {
        args = List.copyOf(args);
    }

    public static TypedArgsListNode empty() {
        return new TypedArgsListNode(List.of());
    }

    @Override
    public List<CookedNode> children() {
        return List.copyOf(args);
    }
}
