package com.challenges.lsparse.ast;

/**
 * Binary boolean connectives. Higher precedence binds tighter; all levels are left-associative.
 */
public enum BooleanOperator {
    AND("and", 3),
    NAND("nand", 3),
    XOR("xor", 2),
    OR("or", 1);

    private final String symbol;
    private final int precedence;

    BooleanOperator(String symbol, int precedence) {
        this.symbol = symbol;
        this.precedence = precedence;
    }

    public String symbol() {
        return symbol;
    }

    public int precedence() {
        return precedence;
    }

    public static BooleanOperator fromSymbol(String symbol) {
        for (BooleanOperator op : values()) {
            if (op.symbol.equals(symbol)) {
                return op;
            }
        }
        throw new IllegalArgumentException("Unknown boolean operator: " + symbol);
    }
}
