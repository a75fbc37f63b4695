package com.vidnyan.xref.domain.cooked;

public record ContinueStmt() implements CookedNode {
}
