package com.vidnyan.xref.domain.cooked;

import java.util.ArrayList;
import java.util.List;

public record TryStmt(
    CookedNode body,
    List<ExceptHandler> handlers,
    CookedNode elseSuite,
    CookedNode finallySuite
) implements CookedNode {

    public TryStmt {
        handlers = List.copyOf(handlers);
    }

    @Override
    public List<CookedNode> children() {
        List<CookedNode> children = new ArrayList<>();
        children.add(body);
        children.addAll(handlers);
        children.add(elseSuite);
        children.add(finallySuite);
        return children;
    }
}
