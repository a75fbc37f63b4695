package com.vidnyan.xref.domain.cooked;

import java.util.List;

public record CompIfNode(
    CookedNode test,
    CookedNode compIter
) implements CookedNode {

    @Override
    public List<CookedNode> children() {
        return List.of(test, compIter);
    }
}
