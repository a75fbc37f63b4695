package com.vidnyan.xref.domain.cooked;

import java.util.List;

/**
 * {@code then if test else orElse}.
 */
public record ConditionalExprNode(
    CookedNode then,
    CookedNode test,
    CookedNode orElse
) implements CookedNode {

    @Override
    public List<CookedNode> children() {
        return List.of(then, test, orElse);
    }
}
