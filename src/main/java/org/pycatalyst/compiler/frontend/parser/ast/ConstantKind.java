package org.pycatalyst.compiler.frontend.parser.ast;

/**
 * The runtime type of a literal.
 */
public enum ConstantKind {
    STR("str"),
    INT("int"),
    FLOAT("float"),
    BOOL("bool"),
    NONE("NoneType"),
    BYTES("bytes"),
    ELLIPSIS("ellipsis");

    private final String typeName;

    ConstantKind(String typeName) {
        this.typeName = typeName;
    }

    /**
     * @return The runtime type name in the source language.
     */
    public String typeName() {
        return typeName;
    }
}
