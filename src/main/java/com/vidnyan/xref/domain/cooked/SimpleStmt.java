package com.vidnyan.xref.domain.cooked;

import java.util.List;

/**
 * One logical line: small statements separated by {@code ;}.
 */
public record SimpleStmt(List<CookedNode> stmts) implements CookedNode {

    public SimpleStmt {
        stmts = List.copyOf(stmts);
    }

    @Override
    public List<CookedNode> children() {
        return List.copyOf(stmts);
    }
}
