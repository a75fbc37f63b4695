package com.vidnyan.xref.domain.cooked;

import java.util.ArrayList;
import java.util.List;

/**
 * Python 2 {@code print [>> dest,] items}.
 */
public record PrintStmt(
    CookedNode dest,
    List<CookedNode> items
) implements CookedNode {

    public PrintStmt {
        items = List.copyOf(items);
    }

    @Override
    public List<CookedNode> children() {
        List<CookedNode> children = new ArrayList<>();
        children.add(dest);
        children.addAll(items);
        return children;
    }
}
