package com.vidnyan.xref.domain.cooked;

import java.util.List;

/**
 * {@code except [exc [as target]]}; Python 2 writes {@code except exc, target}.
 */
public record ExceptClauseNode(
    CookedNode exc,
    CookedNode target
) implements CookedNode {

    @Override
    public List<CookedNode> children() {
        return List.of(exc, target);
    }
}
