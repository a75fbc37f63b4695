package com.vidnyan.xref.domain.cooked;

import java.util.List;

public record ReturnStmt(CookedNode value) implements CookedNode {

    @Override
    public List<CookedNode> children() {
        return List.of(value);
    }
}
