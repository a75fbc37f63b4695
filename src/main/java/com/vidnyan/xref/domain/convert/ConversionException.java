package com.vidnyan.xref.domain.convert;

import com.vidnyan.xref.domain.cst.CstNode;

/**
 * Fatal error while converting a CST. Conversion of the file stops; nothing is recovered.
 */
public class ConversionException extends RuntimeException {

    private final transient CstNode node;

    public ConversionException(String message, CstNode node) {
        super(message + " at " + (node == null ? "?" : node.span().format()) + ": " + node);
        this.node = node;
    }

    public CstNode getNode() {
        return node;
    }
}
