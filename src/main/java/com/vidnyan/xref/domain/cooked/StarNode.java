package com.vidnyan.xref.domain.cooked;

/**
 * {@code from m import *}.
 */
public record StarNode() implements CookedNode {
}
