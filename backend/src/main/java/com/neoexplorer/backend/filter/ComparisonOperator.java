package com.neoexplorer.backend.filter;

/**
 * Binary comparison applied as {@code attribute OP reference}.
 * <p>
 * Numeric comparisons use primitive semantics, so any comparison involving
 * {@code NaN} is false.
 */
public enum ComparisonOperator {

    EQUAL("=="),
    LESS_OR_EQUAL("<="),
    GREATER_OR_EQUAL(">=");

    private final String symbol;

    ComparisonOperator(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }

    public boolean test(double left, double right) {
        switch (this) {
            case EQUAL:
                return left == right;
            case LESS_OR_EQUAL:
                return left <= right;
            case GREATER_OR_EQUAL:
                return left >= right;
            default:
                throw new IllegalStateException("unknown operator " + this);
        }
    }

    // comparison is attribute.compareTo(reference)
    public boolean accepts(int comparison) {
        switch (this) {
            case EQUAL:
                return comparison == 0;
            case LESS_OR_EQUAL:
                return comparison <= 0;
            case GREATER_OR_EQUAL:
                return comparison >= 0;
            default:
                throw new IllegalStateException("unknown operator " + this);
        }
    }
}
