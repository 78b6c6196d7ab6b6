package io.tracedb.kernel.selection;

/**
 * Immutable view of an explicit set of row positions.
 * <p>
 * <b>Contract:</b>
 * <ul>
 *   <li>This is a <b>set</b> - no duplicate positions.</li>
 *   <li>size() returns the cardinality.</li>
 *   <li>toIntArray() and enumerator() yield positions in ascending order.</li>
 * </ul>
 */
public interface PositionSet {
    int size();

    boolean contains(int position);

    /**
     * Returns a snapshot array of all positions, ascending.
     * <p>
     * The returned array is a copy and safe to modify.
     * @return snapshot array of positions
     */
    int[] toIntArray();

    IntEnumerator enumerator();

    default boolean isEmpty() {
        return size() == 0;
    }
}
