package com.vidnyan.xref.domain.cooked;

import java.util.List;

/**
 * {@code import a.b as c, d}.
 */
public record ImportNameStmt(DottedAsNamesNode dottedAsNames) implements CookedNode {

    @Override
    public List<CookedNode> children() {
        return List.of(dottedAsNames);
    }
}
