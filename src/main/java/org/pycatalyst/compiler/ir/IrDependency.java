package org.pycatalyst.compiler.ir;

/**
 * External headers the generated code may require.
 */
public enum IrDependency {
    /** String support. */
    STRING("string"),
    /** Vector-like collections. */
    VECTOR("vector"),
    /** Tuple-like collections. */
    TUPLE("tuple"),
    /** Set-like collections. */
    SET("unordered_set"),
    /** Stream I/O. */
    IOSTREAM("iostream"),
    /** Math functions. */
    MATH("cmath");

    private final String header;

    IrDependency(String header) {
        this.header = header;
    }

    /**
     * @return The header name as used in an include directive.
     */
    public String header() {
        return header;
    }
}
