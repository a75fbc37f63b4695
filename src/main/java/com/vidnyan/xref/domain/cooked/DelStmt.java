package com.vidnyan.xref.domain.cooked;

import java.util.List;

public record DelStmt(CookedNode exprs) implements CookedNode {

    @Override
    public List<CookedNode> children() {
        return List.of(exprs);
    }
}
