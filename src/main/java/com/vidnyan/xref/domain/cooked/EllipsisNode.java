package com.vidnyan.xref.domain.cooked;

/**
 * The {@code ...} atom.
 */
public record EllipsisNode() implements CookedNode {
}
