package com.vidnyan.xref.domain.cooked;

import java.util.List;

/**
 * One parameter.
 *
 * @param name         a {@link TnameNode}, or a {@link TfpListNode} for a Python 2 tuple parameter
 * @param defaultValue default converted in the enclosing scope, or omitted
 * @param kind         {@code *args}, {@code **kwargs} or a plain (positional or keyword-only) name
 */
public record TypedArgNode(
    CookedNode name,
    CookedNode defaultValue,
    ParamKind kind
) implements CookedNode {

    public enum ParamKind {
        PLAIN,
        VARARGS,
        KWARGS
    }

    @Override
    public List<CookedNode> children() {
        return List.of(name, defaultValue);
    }
}
