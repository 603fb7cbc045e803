package com.spreadsheet.formula.ast;

/**
 * Binary operators with their binding strength (higher binds tighter).
 * All of them are left-associative, '^' included.
 */
public enum BinaryOperator {
    EQUAL("=", 0),
    NOT_EQUAL("<>", 0),
    LESS("<", 0),
    GREATER(">", 0),
    LESS_EQUAL("<=", 0),
    GREATER_EQUAL(">=", 0),
    CONCAT("&", 1),
    ADD("+", 2),
    SUBTRACT("-", 2),
    MULTIPLY("*", 3),
    DIVIDE("/", 3),
    POWER("^", 4);

    private final String symbol;
    private final int precedence;

    BinaryOperator(String symbol, int precedence) {
        this.symbol = symbol;
        this.precedence = precedence;
    }

    public String getSymbol() {
        return symbol;
    }

    public int getPrecedence() {
        return precedence;
    }

    public boolean isComparison() {
        return precedence == 0;
    }

    public static BinaryOperator fromSymbol(String symbol) {
        for (BinaryOperator op : values()) {
            if (op.symbol.equals(symbol)) {
                return op;
            }
        }
        return null;
    }
}
