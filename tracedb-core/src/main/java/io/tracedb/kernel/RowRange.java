package io.tracedb.kernel;

/**
 * Half-open span {@code [begin, end)} of row positions.
 */
public record RowRange(int begin, int end) {

    private static final RowRange EMPTY = new RowRange(0, 0);

    public RowRange {
        if (begin < 0) {
            throw new IllegalArgumentException("begin must be non-negative: " + begin);
        }
        if (end < begin) {
            throw new IllegalArgumentException("end must not precede begin: [" + begin + ", " + end + ")");
        }
    }

    public static RowRange empty() {
        return EMPTY;
    }

    public static RowRange of(int begin, int end) {
        return new RowRange(begin, end);
    }

    public int size() {
        return end - begin;
    }

    public boolean isEmpty() {
        return begin == end;
    }

    public boolean contains(int position) {
        return position >= begin && position < end;
    }

    @Override
    public String toString() {
        return "[" + begin + ", " + end + ")";
    }
}
