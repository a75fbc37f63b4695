package com.vidnyan.xref.domain.cooked;

import java.util.List;

public record DottedAsNamesNode(List<DottedAsNameNode> names) implements CookedNode {

    public DottedAsNamesNode {
        names = List.copyOf(names);
    }

    @Override
    public List<CookedNode> children() {
        return List.copyOf(names);
    }
}
