package com.vidnyan.xref.domain.cooked;

import java.util.List;

public record NonlocalStmt(List<NameNode> names) implements CookedNode {

    public NonlocalStmt {
        names = List.copyOf(names);
    }

    @Override
    public List<CookedNode> children() {
        return List.copyOf(names);
    }
}
