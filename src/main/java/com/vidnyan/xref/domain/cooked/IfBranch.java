package com.vidnyan.xref.domain.cooked;

import java.util.List;

public record IfBranch(
    CookedNode test,
    CookedNode suite
) implements CookedNode {

    @Override
    public List<CookedNode> children() {
        return List.of(test, suite);
    }
}
