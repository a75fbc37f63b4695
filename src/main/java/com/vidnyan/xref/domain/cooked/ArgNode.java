package com.vidnyan.xref.domain.cooked;

import java.util.List;

/**
 * One call argument.
 *
 * @param name    keyword for {@code name=value}, otherwise omitted
 * @param arg     the argument value
 * @param compFor generator clause for {@code f(x for x in y)}, otherwise omitted
 */
public record ArgNode(
    CookedNode name,
    CookedNode arg,
    CookedNode compFor
) implements CookedNode {

    @Override
    public List<CookedNode> children() {
        return List.of(name, arg, compFor);
    }
}
