package com.vidnyan.xref.domain.cooked;

import java.util.ArrayList;
import java.util.List;

/**
 * A comparison chain such as {@code a < b <= c}: operands in source order and the
 * {@code operands.size() - 1} operators between them.
 */
public record ComparisonNode(
    List<CookedNode> operands,
    List<CompOpNode> ops
) implements CookedNode {

    public ComparisonNode {
        operands = List.copyOf(operands);
        ops = List.copyOf(ops);
        if (operands.size() != ops.size() + 1) {
            throw new IllegalArgumentException(
                    "Comparison with " + operands.size() + " operands and " + ops.size() + " operators");
        }
    }

    @Override
    public List<CookedNode> children() {
        List<CookedNode> children = new ArrayList<>(operands);
        children.addAll(ops);
        return children;
    }
}
