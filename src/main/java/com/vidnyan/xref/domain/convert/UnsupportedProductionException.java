package com.vidnyan.xref.domain.convert;

import com.vidnyan.xref.domain.cst.CstNode;

/**
 * A production of the grammar that is deliberately not converted.
 */
public class UnsupportedProductionException extends ConversionException {

    public UnsupportedProductionException(String production, CstNode node) {
        super("Unsupported production " + production, node);
    }
}
