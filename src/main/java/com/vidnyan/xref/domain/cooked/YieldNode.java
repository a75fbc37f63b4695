package com.vidnyan.xref.domain.cooked;

import java.util.List;

/**
 * {@code yield [value]} or {@code yield from value}.
 */
public record YieldNode(
    CookedNode value,
    boolean from
) implements CookedNode {

    @Override
    public List<CookedNode> children() {
        return List.of(value);
    }
}
