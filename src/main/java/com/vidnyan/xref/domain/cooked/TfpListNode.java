package com.vidnyan.xref.domain.cooked;

import java.util.List;

/**
 * Python 2 tuple parameter {@code def f((a, b)): ...}.
 */
public record TfpListNode(List<CookedNode> items) implements CookedNode {

    public TfpListNode {
        items = List.copyOf(items);
    }

    @Override
    public List<CookedNode> children() {
        return List.copyOf(items);
    }
}
