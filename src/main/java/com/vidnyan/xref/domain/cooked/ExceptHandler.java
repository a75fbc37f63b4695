package com.vidnyan.xref.domain.cooked;

import java.util.List;

public record ExceptHandler(
    ExceptClauseNode clause,
    CookedNode suite
) implements CookedNode {

    @Override
    public List<CookedNode> children() {
        return List.of(clause, suite);
    }
}
