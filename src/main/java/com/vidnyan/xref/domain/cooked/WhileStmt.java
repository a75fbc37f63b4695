package com.vidnyan.xref.domain.cooked;

import java.util.List;

public record WhileStmt(
    CookedNode test,
    CookedNode suite,
    CookedNode elseSuite
) implements CookedNode {

    @Override
    public List<CookedNode> children() {
        return List.of(test, suite, elseSuite);
    }
}
