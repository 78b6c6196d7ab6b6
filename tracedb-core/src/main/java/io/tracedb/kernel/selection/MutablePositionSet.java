package io.tracedb.kernel.selection;

/**
 * Position set under construction. add() is idempotent and accepts positions in any order.
 */
public interface MutablePositionSet extends PositionSet {
    void add(int position);

    /**
     * Adds every position of {@code [begin, end)}.
     */
    default void addRange(int begin, int end) {
        for (int position = begin; position < end; position++) {
            add(position);
        }
    }
}
