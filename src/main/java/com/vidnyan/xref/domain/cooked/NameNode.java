package com.vidnyan.xref.domain.cooked;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.vidnyan.xref.domain.cst.CstLeaf;

/**
 * An identifier occurrence.
 *
 * @param binds true if the occurrence introduced a binding in its enclosing scope,
 *              false if it is a reference to be resolved later
 * @param token the NAME token, for anchors
 * @param fqn   fully qualified name; null until a resolver fills it in
 */
public record NameNode(
    boolean binds,
    CstLeaf token,
    @JsonInclude(JsonInclude.Include.NON_NULL) String fqn
) implements CookedNode {

    public static NameNode binding(CstLeaf token) {
        return new NameNode(true, token, null);
    }

    public static NameNode reference(CstLeaf token) {
        return new NameNode(false, token, null);
    }

    public String name() {
        return token.value();
    }
}
