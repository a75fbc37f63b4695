package com.vidnyan.xref.domain.cooked;

public record PassStmt() implements CookedNode {
}
