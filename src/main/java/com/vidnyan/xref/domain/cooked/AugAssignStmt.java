package com.vidnyan.xref.domain.cooked;

import com.vidnyan.xref.domain.cst.CstLeaf;

import java.util.List;

/**
 * {@code target op= expr}. The target is a reference: it must already exist.
 */
public record AugAssignStmt(
    CookedNode target,
    CstLeaf op,
    CookedNode expr
) implements CookedNode {

    @Override
    public List<CookedNode> children() {
        return List.of(target, expr);
    }
}
