package com.vidnyan.xref.adapter.out.parser;

/**
 * The source is not valid Python for the selected dialect.
 */
public class PythonSyntaxException extends RuntimeException {

    private final int line;
    private final int column;

    public PythonSyntaxException(String message, int line, int column) {
        super(message + " (line " + line + ", column " + column + ")");
        this.line = line;
        this.column = column;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }
}
