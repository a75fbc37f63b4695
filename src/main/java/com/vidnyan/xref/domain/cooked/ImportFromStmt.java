package com.vidnyan.xref.domain.cooked;

import java.util.ArrayList;
import java.util.List;

/**
 * {@code from ..pkg.mod import names}.
 *
 * @param fromName   leading {@link DotNode}s for a relative import, then the module's
 *                   {@link DottedNameNode} if any
 * @param importPart a {@link StarNode} or an {@link ImportAsNamesNode}
 */
public record ImportFromStmt(
    List<CookedNode> fromName,
    CookedNode importPart
) implements CookedNode {

    public ImportFromStmt {
        fromName = List.copyOf(fromName);
    }

    @Override
    public List<CookedNode> children() {
        List<CookedNode> children = new ArrayList<>(fromName);
        children.add(importPart);
        return children;
    }
}
