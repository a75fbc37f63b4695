package com.vidnyan.xref.domain.cooked;

import java.util.List;

public record GlobalStmt(List<NameNode> names) implements CookedNode {

    public GlobalStmt {
        names = List.copyOf(names);
    }

    @Override
    public List<CookedNode> children() {
        return List.copyOf(names);
    }
}
