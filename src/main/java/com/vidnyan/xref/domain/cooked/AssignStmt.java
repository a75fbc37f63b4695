package com.vidnyan.xref.domain.cooked;

import java.util.ArrayList;
import java.util.List;

/**
 * {@code t1 = t2 = ... = expr}. Every target was converted in a binding context.
 */
public record AssignStmt(
    List<CookedNode> targets,
    CookedNode expr
) implements CookedNode {

    public AssignStmt {
        targets = List.copyOf(targets);
    }

    @Override
    public List<CookedNode> children() {
        List<CookedNode> children = new ArrayList<>(targets);
        children.add(expr);
        return children;
    }
}
