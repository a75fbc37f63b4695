package com.vidnyan.xref.domain.cooked;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Names recorded for one scope (module, function, lambda or class body) when it closed.
 * All three sets keep insertion order.
 */
public record ScopeBindings(
    Set<String> bindings,
    Set<String> globalVars,
    Set<String> nonlocalVars
) {

    public ScopeBindings {
        bindings = Collections.unmodifiableSet(new LinkedHashSet<>(bindings));
        globalVars = Collections.unmodifiableSet(new LinkedHashSet<>(globalVars));
        nonlocalVars = Collections.unmodifiableSet(new LinkedHashSet<>(nonlocalVars));
    }

    public static ScopeBindings empty() {
        return new ScopeBindings(Set.of(), Set.of(), Set.of());
    }
}
