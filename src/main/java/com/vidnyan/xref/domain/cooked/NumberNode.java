package com.vidnyan.xref.domain.cooked;

import com.vidnyan.xref.domain.cst.CstLeaf;

public record NumberNode(CstLeaf token) implements CookedNode {
}
