package com.vidnyan.xref.domain.cooked;

import java.util.List;

/**
 * A comma-separated sequence. The kind records which production it came from; for
 * {@link Kind#DICTSETMAKER} the items are {@link KeyValueNode}s, {@link StarStarExprNode}s or
 * plain set elements.
 */
public record ListNode(
    Kind kind,
    List<CookedNode> items
) implements CookedNode {

    public ListNode {
        items = List.copyOf(items);
    }

    public enum Kind {
        EXPRLIST,
        TESTLIST,
        TESTLIST1,
        TESTLIST_GEXP,
        TESTLIST_SAFE,
        TESTLIST_STAR_EXPR,
        LISTMAKER,
        DICTSETMAKER
    }

    @Override
    public List<CookedNode> children() {
        return List.copyOf(items);
    }
}
