package com.vidnyan.xref.domain.cooked;

import java.util.List;

/**
 * Python 2 {@code exec code [in globals [, locals]]}.
 */
public record ExecStmt(
    CookedNode code,
    CookedNode globals,
    CookedNode locals
) implements CookedNode {

    @Override
    public List<CookedNode> children() {
        return List.of(code, globals, locals);
    }
}
