package com.spreadsheet.formula.functions;

/**
 * How many arguments a function accepts.
 */
public final class Arity {

    private final int min;
    private final int max;

    private Arity(int min, int max) {
        if (min < 0 || max < min) {
            throw new IllegalArgumentException("Bad arity " + min + ".." + max);
        }
        this.min = min;
        this.max = max;
    }

    public static Arity exactly(int count) {
        return new Arity(count, count);
    }

    public static Arity between(int min, int max) {
        return new Arity(min, max);
    }

    public static Arity atLeast(int min) {
        return new Arity(min, Integer.MAX_VALUE);
    }

    public boolean accepts(int count) {
        return count >= min && count <= max;
    }

    @Override
    public String toString() {
        if (min == max) {
            return String.valueOf(min);
        }
        return min + ".." + (max == Integer.MAX_VALUE ? "n" : String.valueOf(max));
    }
}
