package com.vidnyan.xref.domain.cooked;

import java.util.List;

/**
 * {@code raise [exc [from cause]]}, or the Python 2 form {@code raise exc, value, traceback}.
 */
public record RaiseStmt(
    CookedNode exc,
    CookedNode value,
    CookedNode traceback,
    CookedNode cause
) implements CookedNode {

    @Override
    public List<CookedNode> children() {
        return List.of(exc, value, traceback, cause);
    }
}
