package com.formula.ast;

public enum ComparisonOperator {
    EQ("=="),
    NE("!="),
    LT("<"),
    LTE("<="),
    GT(">"),
    GTE(">=");

    private final String symbol;

    ComparisonOperator(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    /**
     * Whether this is {@code ==} or {@code !=}, which accept operands of any type.
     */
    public boolean isEquality() {
        return this == EQ || this == NE;
    }
}
