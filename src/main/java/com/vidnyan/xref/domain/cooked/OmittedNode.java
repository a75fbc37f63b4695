package com.vidnyan.xref.domain.cooked;

/**
 * Sentinel for an optional grammar slot that is absent in the source
 * (missing else-suite, return annotation, slice bound, ...).
 */
public record OmittedNode() implements CookedNode {

    public static final OmittedNode INSTANCE = new OmittedNode();

    @Override
    public boolean omitted() {
        return true;
    }
}
