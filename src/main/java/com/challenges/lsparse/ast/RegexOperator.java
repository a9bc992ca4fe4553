package com.challenges.lsparse.ast;

public enum RegexOperator {
    MATCH("=~"),
    NOT_MATCH("!~");

    private final String symbol;

    RegexOperator(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    public static RegexOperator fromSymbol(String symbol) {
        for (RegexOperator op : values()) {
            if (op.symbol.equals(symbol)) {
                return op;
            }
        }
        throw new IllegalArgumentException("Unknown regex operator: " + symbol);
    }
}
