package com.challenges.lsparse.ast;

public enum MembershipOperator {
    IN("in"),
    NOT_IN("not in");

    private final String symbol;

    MembershipOperator(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    public static MembershipOperator fromSymbol(String symbol) {
        for (MembershipOperator op : values()) {
            if (op.symbol.equals(symbol)) {
                return op;
            }
        }
        throw new IllegalArgumentException("Unknown membership operator: " + symbol);
    }
}
