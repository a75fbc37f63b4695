package com.vidnyan.xref.domain.cooked;

import java.util.List;

/**
 * {@code *expr}, in a call or as an unpacking target.
 */
public record StarExprNode(CookedNode expr) implements CookedNode {

    @Override
    public List<CookedNode> children() {
        return List.of(expr);
    }
}
