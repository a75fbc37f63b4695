package com.vidnyan.xref.domain.cooked;

import java.util.List;

/**
 * {@code lambda parameters: body}. Opens a scope but binds no name of its own.
 */
public record LambdaNode(
    TypedArgsListNode parameters,
    CookedNode body,
    ScopeBindings scope
) implements CookedNode {

    @Override
    public List<CookedNode> children() {
        return List.of(parameters, body);
    }
}
