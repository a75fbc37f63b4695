package com.vidnyan.xref.domain.cooked;

import java.util.List;

/**
 * {@code name [as asName]} in a from-import: {@code name} refers into the imported module,
 * {@code asName} binds locally (the same token as {@code name} when there is no alias).
 */
public record AsNameNode(
    NameNode name,
    NameNode asName
) implements CookedNode {

    @Override
    public List<CookedNode> children() {
        return List.of(name, asName);
    }
}
