package org.pycatalyst.compiler.frontend.parser.ast;

/**
 * Comparison operators, including membership and identity tests.
 */
public enum CompareOperator {
    EQ("=="),
    NOT_EQ("!="),
    LT("<"),
    LT_E("<="),
    GT(">"),
    GT_E(">="),
    IN("in"),
    NOT_IN("not in"),
    IS("is"),
    IS_NOT("is not");

    private final String symbol;

    CompareOperator(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    /**
     * @return {@code true} for the six relational operators.
     */
    public boolean isRelational() {
        return ordinal() <= GT_E.ordinal();
    }
}
