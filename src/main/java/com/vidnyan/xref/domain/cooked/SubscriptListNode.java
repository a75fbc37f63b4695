package com.vidnyan.xref.domain.cooked;

import java.util.List;

public record SubscriptListNode(List<SubscriptNode> subscripts) implements CookedNode {

    public SubscriptListNode {
        subscripts = List.copyOf(subscripts);
    }

    @Override
    public List<CookedNode> children() {
        return List.copyOf(subscripts);
    }
}
