package com.vidnyan.xref.domain.cooked;

import java.util.List;

/**
 * Attribute access {@code .name}. The attribute is never a binding of the enclosing scope;
 * {@code assigned} marks the last trailer of an assignment target such as {@code self.x = 1}.
 */
public record DotNameTrailerNode(
    NameNode name,
    boolean assigned
) implements CookedNode {

    @Override
    public List<CookedNode> children() {
        return List.of(name);
    }
}
