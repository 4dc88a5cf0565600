package org.pycatalyst.compiler.frontend.parser.ast;

/**
 * Short-circuit operators.
 */
public enum BoolOperator {
    AND("and"),
    OR("or");

    private final String keyword;

    BoolOperator(String keyword) {
        this.keyword = keyword;
    }

    public String keyword() {
        return keyword;
    }
}
