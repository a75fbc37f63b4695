package com.vidnyan.xref.domain.cooked;

import java.util.List;

/**
 * {@code def name(parameters) [-> returnType]: suite}.
 *
 * @param name       bound in the enclosing scope
 * @param parameters parameter names bound in this function's scope
 * @param returnType annotation converted in the enclosing scope, or omitted
 * @param scope      bindings of the function body, parameters included
 */
public record FuncDefStmt(
    NameNode name,
    TypedArgsListNode parameters,
    CookedNode returnType,
    CookedNode suite,
    ScopeBindings scope
) implements CookedNode {

    @Override
    public List<CookedNode> children() {
        return List.of(name, parameters, returnType, suite);
    }
}
