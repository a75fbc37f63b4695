package com.vidnyan.xref.domain.cooked;

import java.util.List;

/**
 * {@code for exprlist in testlist: suite [else: elseSuite]}. The loop target binds in the
 * enclosing scope.
 */
public record ForStmt(
    CookedNode exprlist,
    CookedNode testlist,
    CookedNode suite,
    CookedNode elseSuite
) implements CookedNode {

    @Override
    public List<CookedNode> children() {
        return List.of(exprlist, testlist, suite, elseSuite);
    }
}
