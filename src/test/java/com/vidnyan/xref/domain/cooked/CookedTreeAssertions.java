package com.vidnyan.xref.domain.cooked;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.RecordComponent;
import java.util.ArrayList;
import java.util.List;

/**
 * Checks on whole cooked trees that read record components reflectively, so that every
 * component is seen whether or not {@link CookedNode#children()} lists it.
 */
public final class CookedTreeAssertions {

    private CookedTreeAssertions() {
    }

    /**
     * Null components of any node below {@code root}, as {@code Type.component} strings.
     * The unresolved {@link NameNode#fqn()} is allowed to be null and is not reported.
     */
    public static List<String> nullSlots(CookedNode root) {
        List<String> nulls = new ArrayList<>();
        CookedTree.walk(root, node -> {
            for (RecordComponent component : node.getClass().getRecordComponents()) {
                if (node instanceof NameNode && component.getName().equals("fqn")) {
                    continue;
                }
                if (read(node, component) == null) {
                    nulls.add(node.getClass().getSimpleName() + "." + component.getName());
                }
            }
        });
        return nulls;
    }

    /**
     * Nodes below {@code root} whose {@link CookedNode#children()} differ from the cooked
     * values of their record components, in component order.
     */
    public static List<String> childrenMismatches(CookedNode root) {
        List<String> mismatches = new ArrayList<>();
        CookedTree.walk(root, node -> {
            List<CookedNode> expected = componentChildren(node);
            if (!expected.equals(node.children())) {
                mismatches.add(node.getClass().getSimpleName());
            }
        });
        return mismatches;
    }

    private static List<CookedNode> componentChildren(CookedNode node) {
        List<CookedNode> children = new ArrayList<>();
        for (RecordComponent component : node.getClass().getRecordComponents()) {
            Object value = read(node, component);
            if (value instanceof CookedNode child) {
                children.add(child);
            } else if (value instanceof List<?> list) {
                for (Object element : list) {
                    if (element instanceof CookedNode child) {
                        children.add(child);
                    }
                }
            }
        }
        return children;
    }

    private static Object read(CookedNode node, RecordComponent component) {
        try {
            return component.getAccessor().invoke(node);
        } catch (IllegalAccessException | InvocationTargetException e) {
            throw new IllegalStateException(
                    "Cannot read " + component.getName() + " of " + node.getClass().getSimpleName(), e);
        }
    }
}
