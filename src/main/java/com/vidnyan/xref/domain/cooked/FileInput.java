package com.vidnyan.xref.domain.cooked;

import java.util.List;

/**
 * Root of a converted module, with the bindings of the module scope.
 */
public record FileInput(
    List<CookedNode> stmts,
    ScopeBindings scope
) implements CookedNode {

    public FileInput {
        stmts = List.copyOf(stmts);
    }

    @Override
    public List<CookedNode> children() {
        return List.copyOf(stmts);
    }
}
