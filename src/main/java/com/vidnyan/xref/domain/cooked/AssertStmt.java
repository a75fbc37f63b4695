package com.vidnyan.xref.domain.cooked;

import java.util.List;

public record AssertStmt(
    CookedNode test,
    CookedNode message
) implements CookedNode {

    @Override
    public List<CookedNode> children() {
        return List.of(test, message);
    }
}
