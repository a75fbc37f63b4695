package com.vidnyan.xref.domain.cooked;

import java.util.List;

/**
 * {@code class name(bases): suite}. The bases are references of the enclosing scope; the
 * class body has a scope of its own.
 */
public record ClassDefStmt(
    NameNode name,
    CookedNode bases,
    CookedNode suite,
    ScopeBindings scope
) implements CookedNode {

    @Override
    public List<CookedNode> children() {
        return List.of(name, bases, suite);
    }
}
