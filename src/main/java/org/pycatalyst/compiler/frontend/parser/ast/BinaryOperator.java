package org.pycatalyst.compiler.frontend.parser.ast;

/**
 * Arithmetic, bitwise and shift operators.
 */
public enum BinaryOperator {
    ADD("+"),
    SUB("-"),
    MULT("*"),
    DIV("/"),
    FLOOR_DIV("//"),
    MOD("%"),
    POW("**"),
    LSHIFT("<<"),
    RSHIFT(">>"),
    BIT_OR("|"),
    BIT_AND("&"),
    BIT_XOR("^"),
    MAT_MULT("@");

    private final String symbol;

    BinaryOperator(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    /**
     * @param symbol An operator token, without a trailing {@code =}.
     * @return The operator, or {@code null} if the symbol is not a binary operator.
     */
    public static BinaryOperator fromSymbol(String symbol) {
        for (BinaryOperator op : values()) {
            if (op.symbol.equals(symbol)) return op;
        }
        return null;
    }
}
