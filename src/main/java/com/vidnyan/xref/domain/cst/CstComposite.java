package com.vidnyan.xref.domain.cst;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Interior CST node: a grammar symbol with its ordered children.
 */
public record CstComposite(
    Symbol type,
    List<CstNode> children,
    SourceSpan span
) implements CstNode {

    public CstComposite {
        children = List.copyOf(children);
    }

    public static CstComposite of(Symbol symbol, List<CstNode> children) {
        SourceSpan span = children.isEmpty()
                ? SourceSpan.NONE
                : children.get(0).span().to(children.get(children.size() - 1).span());
        return new CstComposite(symbol, children, span);
    }

    public CstNode child(int index) {
        return children.get(index);
    }

    public int size() {
        return children.size();
    }

    public CstNode last() {
        return children.get(children.size() - 1);
    }

    @Override
    public String toString() {
        return type.grammarName() + children.stream()
                .map(CstNode::toString)
                .collect(Collectors.joining(", ", "[", "]"));
    }
}
