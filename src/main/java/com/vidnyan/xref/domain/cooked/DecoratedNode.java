package com.vidnyan.xref.domain.cooked;

import java.util.ArrayList;
import java.util.List;

/**
 * Decorators followed by the {@link FuncDefStmt} or {@link ClassDefStmt} they apply to.
 */
public record DecoratedNode(
    List<DecoratorNode> decorators,
    CookedNode definition
) implements CookedNode {

    public DecoratedNode {
        decorators = List.copyOf(decorators);
    }

    @Override
    public List<CookedNode> children() {
        List<CookedNode> children = new ArrayList<>(decorators);
        children.add(definition);
        return children;
    }
}
