package com.vidnyan.xref.domain.cooked;

import java.util.List;

public record ArgListNode(List<ArgNode> arguments) implements CookedNode {

    public ArgListNode {
        arguments = List.copyOf(arguments);
    }

    @Override
    public List<CookedNode> children() {
        return List.copyOf(arguments);
    }
}
