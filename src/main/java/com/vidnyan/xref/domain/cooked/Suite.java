package com.vidnyan.xref.domain.cooked;

import java.util.List;

public record Suite(List<CookedNode> stmts) implements CookedNode {

    public Suite {
        stmts = List.copyOf(stmts);
    }

    @Override
    public List<CookedNode> children() {
        return List.copyOf(stmts);
    }
}
