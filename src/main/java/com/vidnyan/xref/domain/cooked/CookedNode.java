package com.vidnyan.xref.domain.cooked;

import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.List;

/**
 * Node of the cooked AST: the simplified, binding-annotated tree handed to the FQN resolver.
 *
 * <p>Every implementation is an immutable record. Optional grammar slots hold either a real
 * subtree or {@link OmittedNode#INSTANCE}; no component is ever null (the unresolved
 * {@link NameNode#fqn()} is the only exception).
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind")
public interface CookedNode {

    /**
     * True for the omitted-slot sentinel.
     */
    default boolean omitted() {
        return false;
    }

    /**
     * Direct subtrees in component order, list elements in place. Tokens, flags and scope
     * bindings are not children.
     */
    default List<CookedNode> children() {
        return List.of();
    }
}
