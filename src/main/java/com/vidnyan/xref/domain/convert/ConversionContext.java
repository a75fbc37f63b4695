package com.vidnyan.xref.domain.convert;

/**
 * State threaded through the conversion of one node.
 *
 * @param lhsBinds true if the node is in a binding position (assignment target, parameter,
 *                 loop variable, ...)
 * @param binder   accumulator of the enclosing scope, shared by all contexts of that scope
 */
public record ConversionContext(
    boolean lhsBinds,
    ScopeBinder binder
) {

    /**
     * Context for the top of a new scope.
     */
    public static ConversionContext newScope() {
        return new ConversionContext(false, new ScopeBinder());
    }

    public ConversionContext withLhsBinds(boolean binds) {
        return binds == lhsBinds ? this : new ConversionContext(binds, binder);
    }

    public ConversionContext binding() {
        return withLhsBinds(true);
    }

    public ConversionContext reference() {
        return withLhsBinds(false);
    }
}
