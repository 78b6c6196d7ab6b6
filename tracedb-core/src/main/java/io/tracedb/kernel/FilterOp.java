package io.tracedb.kernel;

/**
 * Filter operators a storage can evaluate against a single column.
 */
public enum FilterOp {
    EQ,
    NE,
    LT,
    LE,
    GT,
    GE,
    IS_NULL,
    IS_NOT_NULL;

    /**
     * @return true for the operators that compare a row against an operand
     */
    public boolean isComparison() {
        return this != IS_NULL && this != IS_NOT_NULL;
    }

    /**
     * Evaluates this comparison for two already-ordered values.
     *
     * @param compare the sign of {@code row <=> operand}
     * @return whether a row with that ordering matches
     */
    public boolean matches(int compare) {
        return switch (this) {
            case EQ -> compare == 0;
            case NE -> compare != 0;
            case LT -> compare < 0;
            case LE -> compare <= 0;
            case GT -> compare > 0;
            case GE -> compare >= 0;
            case IS_NULL, IS_NOT_NULL -> throw new IllegalStateException("not a comparison: " + this);
        };
    }
}
