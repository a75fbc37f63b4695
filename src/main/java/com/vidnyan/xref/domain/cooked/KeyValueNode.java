package com.vidnyan.xref.domain.cooked;

import java.util.List;

/**
 * {@code key: value} in a dict display.
 */
public record KeyValueNode(
    CookedNode key,
    CookedNode value
) implements CookedNode {

    @Override
    public List<CookedNode> children() {
        return List.of(key, value);
    }
}
