package com.vidnyan.xref.domain.cooked;

import java.util.List;

/**
 * An index {@code [expr1]} or a slice {@code [expr1:expr2:expr3]}; absent bounds are omitted.
 */
public record SubscriptNode(
    CookedNode expr1,
    CookedNode expr2,
    CookedNode expr3,
    boolean slice
) implements CookedNode {

    public static SubscriptNode index(CookedNode expr) {
        return new SubscriptNode(expr, OmittedNode.INSTANCE, OmittedNode.INSTANCE, false);
    }

    @Override
    public List<CookedNode> children() {
        return List.of(expr1, expr2, expr3);
    }
}
