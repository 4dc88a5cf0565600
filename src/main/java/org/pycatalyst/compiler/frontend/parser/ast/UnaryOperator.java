package org.pycatalyst.compiler.frontend.parser.ast;

/**
 * Prefix operators.
 */
public enum UnaryOperator {
    NOT("not"),
    INVERT("~"),
    UADD("+"),
    USUB("-");

    private final String symbol;

    UnaryOperator(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }
}
