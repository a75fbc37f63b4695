package com.vidnyan.xref.domain.cooked;

import java.util.List;

/**
 * {@code target: exprType [= expr]}. The target binds even without a value.
 */
public record AnnAssignStmt(
    CookedNode target,
    CookedNode exprType,
    CookedNode expr
) implements CookedNode {

    @Override
    public List<CookedNode> children() {
        return List.of(target, exprType, expr);
    }
}
