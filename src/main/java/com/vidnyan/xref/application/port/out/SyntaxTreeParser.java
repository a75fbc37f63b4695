package com.vidnyan.xref.application.port.out;

import com.vidnyan.xref.domain.cst.CstNode;
import com.vidnyan.xref.domain.cst.PythonDialect;

import java.nio.charset.Charset;

/**
 * Port for turning Python source bytes into a concrete syntax tree.
 * Implemented by adapters (e.g., the ANTLR parser adapter).
 */
public interface SyntaxTreeParser {

    /**
     * Parse one file.
     * @param source raw file contents; the encoding is detected from a BOM or coding cookie
     * @param dialect grammar dialect
     * @return the tree rooted at {@code file_input}, and the encoding that was used
     */
    ParsedSource parse(byte[] source, PythonDialect dialect);

    /**
     * Parser output.
     */
    record ParsedSource(
        CstNode root,
        Charset encoding
    ) {}
}
