package com.vidnyan.xref.domain.convert;

import com.vidnyan.xref.domain.cst.CstNode;

/**
 * The CST does not have the shape its production promises, a node kind has no conversion rule,
 * or a node was reached in a binding position that cannot bind.
 */
public class StructuralInvariantException extends ConversionException {

    public StructuralInvariantException(String message, CstNode node) {
        super(message, node);
    }
}
