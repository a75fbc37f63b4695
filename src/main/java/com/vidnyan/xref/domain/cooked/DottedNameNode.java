package com.vidnyan.xref.domain.cooked;

import java.util.List;
import java.util.stream.Collectors;

public record DottedNameNode(List<NameNode> names) implements CookedNode {

    public DottedNameNode {
        names = List.copyOf(names);
    }

    public String dotted() {
        return names.stream().map(NameNode::name).collect(Collectors.joining("."));
    }

    @Override
    public List<CookedNode> children() {
        return List.copyOf(names);
    }
}
