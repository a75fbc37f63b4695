package com.vidnyan.xref.domain.cooked;

import java.util.List;

public record ImportAsNamesNode(List<AsNameNode> names) implements CookedNode {

    public ImportAsNamesNode {
        names = List.copyOf(names);
    }

    @Override
    public List<CookedNode> children() {
        return List.copyOf(names);
    }
}
