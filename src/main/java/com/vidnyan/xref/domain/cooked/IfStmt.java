package com.vidnyan.xref.domain.cooked;

import java.util.ArrayList;
import java.util.List;

/**
 * {@code if} with its {@code elif} branches in source order.
 */
public record IfStmt(
    List<IfBranch> branches,
    CookedNode elseSuite
) implements CookedNode {

    public IfStmt {
        branches = List.copyOf(branches);
    }

    @Override
    public List<CookedNode> children() {
        List<CookedNode> children = new ArrayList<>(branches);
        children.add(elseSuite);
        return children;
    }
}
