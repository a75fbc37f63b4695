package com.vidnyan.xref.domain.cst;

/**
 * Grammar dialect of the analyzed source.
 */
public enum PythonDialect {
    /** {@code print} and {@code exec} are statements. */
    PY2(2),
    /** {@code print} and {@code exec} are ordinary names. */
    PY3(3);

    private final int majorVersion;

    PythonDialect(int majorVersion) {
        this.majorVersion = majorVersion;
    }

    public int majorVersion() {
        return majorVersion;
    }

    public boolean hasPrintStatement() {
        return this == PY2;
    }

    public static PythonDialect forVersion(int majorVersion) {
        return switch (majorVersion) {
            case 2 -> PY2;
            case 3 -> PY3;
            default -> throw new IllegalArgumentException(
                    "Unsupported Python version: " + majorVersion + " (expected 2 or 3)");
        };
    }
}
