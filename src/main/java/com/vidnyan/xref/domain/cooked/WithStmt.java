package com.vidnyan.xref.domain.cooked;

import java.util.ArrayList;
import java.util.List;

public record WithStmt(
    List<WithItemNode> items,
    CookedNode suite
) implements CookedNode {

    public WithStmt {
        items = List.copyOf(items);
    }

    @Override
    public List<CookedNode> children() {
        List<CookedNode> children = new ArrayList<>(items);
        children.add(suite);
        return children;
    }
}
