package com.vidnyan.xref.domain.cooked;

import java.util.List;

/**
 * {@code import a.b.c [as d]}: the module path and the name it binds ({@code d}, or {@code a}
 * when there is no alias).
 */
public record DottedAsNameNode(
    DottedNameNode dottedName,
    NameNode asName
) implements CookedNode {

    @Override
    public List<CookedNode> children() {
        return List.of(dottedName, asName);
    }
}
