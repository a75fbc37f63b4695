package com.vidnyan.xref.domain.cooked;

/**
 * One leading dot of a relative import.
 */
public record DotNode() implements CookedNode {
}
