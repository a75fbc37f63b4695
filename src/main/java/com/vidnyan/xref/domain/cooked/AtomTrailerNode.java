package com.vidnyan.xref.domain.cooked;

import java.util.ArrayList;
import java.util.List;

/**
 * An atom followed by calls, subscripts and attribute accesses, e.g. {@code a.b(c)[d]}.
 */
public record AtomTrailerNode(
    CookedNode atom,
    List<CookedNode> trailers
) implements CookedNode {

    public AtomTrailerNode {
        trailers = List.copyOf(trailers);
    }

    @Override
    public List<CookedNode> children() {
        List<CookedNode> children = new ArrayList<>();
        children.add(atom);
        children.addAll(trailers);
        return children;
    }
}
