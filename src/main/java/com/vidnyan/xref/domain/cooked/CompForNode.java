package com.vidnyan.xref.domain.cooked;

import java.util.List;

/**
 * {@code for forExprlist in inTestlist [compIter]} inside a comprehension.
 * The loop target binds in the enclosing scope.
 */
public record CompForNode(
    CookedNode forExprlist,
    CookedNode inTestlist,
    CookedNode compIter
) implements CookedNode {

    @Override
    public List<CookedNode> children() {
        return List.of(forExprlist, inTestlist, compIter);
    }
}
