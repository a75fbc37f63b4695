package com.vidnyan.xref.domain.cooked;

public record BreakStmt() implements CookedNode {
}
