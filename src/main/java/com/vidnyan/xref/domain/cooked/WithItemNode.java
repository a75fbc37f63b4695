package com.vidnyan.xref.domain.cooked;

import java.util.List;

/**
 * {@code item [as asItem]}; {@code asItem} is a binding target.
 */
public record WithItemNode(
    CookedNode item,
    CookedNode asItem
) implements CookedNode {

    @Override
    public List<CookedNode> children() {
        return List.of(item, asItem);
    }
}
