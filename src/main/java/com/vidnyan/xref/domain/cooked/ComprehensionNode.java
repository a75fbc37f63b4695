package com.vidnyan.xref.domain.cooked;

import java.util.List;

/**
 * A list, set, dict or generator comprehension. For dicts the element is a
 * {@link KeyValueNode} or a {@link StarStarExprNode}.
 */
public record ComprehensionNode(
    Kind kind,
    CookedNode element,
    CompForNode compFor
) implements CookedNode {

    public enum Kind {
        GENERATOR,
        LIST,
        SET,
        DICT
    }

    @Override
    public List<CookedNode> children() {
        return List.of(element, compFor);
    }
}
