package com.vidnyan.xref.domain.cooked;

import java.util.List;

/**
 * {@code @name[(arglist)]}. A bare decorator has an omitted arglist; {@code @name()} has an
 * empty pair.
 */
public record DecoratorNode(
    DottedNameNode name,
    CookedNode arglist
) implements CookedNode {

    @Override
    public List<CookedNode> children() {
        return List.of(name, arglist);
    }
}
