package io.tracedb.storage;

import io.tracedb.kernel.FilterOp;
import io.tracedb.kernel.SqlValue;

/**
 * Resolves a comparison operand against the unsigned 32-bit domain.
 * <p>
 * An operand that no unsigned value can equal (null, negative, too large, fractional,
 * NaN or a string) is either decided outright ({@link Outcome#NONE} or
 * {@link Outcome#ALL}) or rewritten to an equivalent comparison on an integral
 * operand.
 */
public record UIntComparison(Outcome outcome, FilterOp op, long operand) {

    public static final long MAX_UINT = 0xFFFF_FFFFL;

    private static final UIntComparison NONE = new UIntComparison(Outcome.NONE, null, 0);
    private static final UIntComparison ALL = new UIntComparison(Outcome.ALL, null, 0);

    public enum Outcome {
        /** No value matches. */
        NONE,
        /** Every value matches. */
        ALL,
        /** Compare values against {@link #operand()} with {@link #op()}. */
        COMPARE
    }

    /**
     * @param op    a comparison operator ({@link FilterOp#isComparison()})
     * @param value the operand
     */
    public static UIntComparison resolve(FilterOp op, SqlValue value) {
        if (op == null || !op.isComparison()) {
            throw new IllegalArgumentException("comparison operator required: " + op);
        }
        if (value == null) {
            throw new IllegalArgumentException("value required");
        }
        return switch (value.type()) {
            case NULL -> NONE;
            case STRING -> resolveString(op);
            case LONG -> resolveLong(op, ((SqlValue.LongValue) value).value());
            case DOUBLE -> resolveDouble(op, ((SqlValue.DoubleValue) value).value());
        };
    }

    public boolean matches(int rawValue) {
        return switch (outcome) {
            case NONE -> false;
            case ALL -> true;
            case COMPARE -> op.matches(Long.compare(Integer.toUnsignedLong(rawValue), operand));
        };
    }

    // Strings order after every number.
    private static UIntComparison resolveString(FilterOp op) {
        return switch (op) {
            case EQ, GT, GE -> NONE;
            default -> ALL;
        };
    }

    private static UIntComparison resolveLong(FilterOp op, long operand) {
        if (operand < 0) {
            return switch (op) {
                case EQ, LT, LE -> NONE;
                default -> ALL;
            };
        }
        if (operand > MAX_UINT) {
            return switch (op) {
                case EQ, GT, GE -> NONE;
                default -> ALL;
            };
        }
        return new UIntComparison(Outcome.COMPARE, op, operand);
    }

    private static UIntComparison resolveDouble(FilterOp op, double operand) {
        if (Double.isNaN(operand)) {
            return NONE;
        }
        double floor = Math.floor(operand);
        if (floor == operand) {
            return resolveLong(op, clampToLong(operand));
        }
        return switch (op) {
            case EQ -> NONE;
            case NE -> ALL;
            case LT -> resolveLong(FilterOp.LT, clampToLong(Math.ceil(operand)));
            case LE -> resolveLong(FilterOp.LE, clampToLong(floor));
            case GT -> resolveLong(FilterOp.GT, clampToLong(floor));
            case GE -> resolveLong(FilterOp.GE, clampToLong(Math.ceil(operand)));
            default -> throw new IllegalArgumentException("comparison operator required: " + op);
        };
    }

    // Saturating conversion; anything past the unsigned domain is decided by range checks.
    private static long clampToLong(double operand) {
        if (operand <= Long.MIN_VALUE) {
            return Long.MIN_VALUE;
        }
        if (operand >= Long.MAX_VALUE) {
            return Long.MAX_VALUE;
        }
        return (long) operand;
    }
}
