package com.vidnyan.xref.domain.cooked;

import java.util.List;

/**
 * {@code **expr}, in a call or a dict display.
 */
public record StarStarExprNode(CookedNode expr) implements CookedNode {

    @Override
    public List<CookedNode> children() {
        return List.of(expr);
    }
}
