package com.vidnyan.xref.domain.cooked;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;
import java.util.stream.Stream;

/**
 * Generic traversal of a cooked AST over {@link CookedNode#children()}.
 */
public final class CookedTree {

    private CookedTree() {
    }

    /**
     * Visits {@code root} and all its descendants, parents before children.
     */
    public static void walk(CookedNode root, Consumer<CookedNode> visitor) {
        visitor.accept(root);
        for (CookedNode child : root.children()) {
            walk(child, visitor);
        }
    }

    public static Stream<CookedNode> stream(CookedNode root) {
        List<CookedNode> nodes = new ArrayList<>();
        walk(root, nodes::add);
        return nodes.stream();
    }

    /**
     * All name occurrences below {@code root}, in source order.
     */
    public static List<NameNode> names(CookedNode root) {
        return stream(root)
                .filter(NameNode.class::isInstance)
                .map(NameNode.class::cast)
                .toList();
    }
}
