package com.vidnyan.xref.domain.convert;

import com.vidnyan.xref.domain.cooked.ScopeBindings;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Names accumulated for one lexical scope while its body is converted.
 * Mutable and owned by exactly one scope; a nested scope gets a new binder.
 */
public class ScopeBinder {

    private final Set<String> bindings = new LinkedHashSet<>();
    private final Set<String> globalVars = new LinkedHashSet<>();
    private final Set<String> nonlocalVars = new LinkedHashSet<>();

    /**
     * Records {@code name} as bound here unless a {@code global} or {@code nonlocal}
     * declaration redirects it.
     *
     * @return true if the occurrence binds in this scope
     */
    public boolean bind(String name) {
        if (globalVars.contains(name) || nonlocalVars.contains(name)) {
            return false;
        }
        bindings.add(name);
        return true;
    }

    public void declareGlobal(String name) {
        globalVars.add(name);
    }

    public void declareNonlocal(String name) {
        nonlocalVars.add(name);
    }

    public ScopeBindings snapshot() {
        return new ScopeBindings(bindings, globalVars, nonlocalVars);
    }
}
