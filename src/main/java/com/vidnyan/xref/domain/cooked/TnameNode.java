package com.vidnyan.xref.domain.cooked;

import java.util.List;

/**
 * A parameter name with its optional annotation.
 */
public record TnameNode(
    NameNode name,
    CookedNode typeExpr
) implements CookedNode {

    @Override
    public List<CookedNode> children() {
        return List.of(name, typeExpr);
    }
}
