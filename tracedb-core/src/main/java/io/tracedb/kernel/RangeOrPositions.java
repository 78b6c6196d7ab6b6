package io.tracedb.kernel;

import io.tracedb.kernel.selection.IntEnumerator;
import io.tracedb.kernel.selection.PositionSet;

/**
 * Result of a storage search: either one contiguous range of matching rows or an
 * explicit ascending set of them.
 * <p>
 * Ranges are produced whenever the matches are contiguous; only searches whose
 * matches are scattered pay for an explicit set.
 */
public sealed interface RangeOrPositions permits RangeOrPositions.Range, RangeOrPositions.Positions {

    static RangeOrPositions of(RowRange range) {
        return new Range(range);
    }

    static RangeOrPositions of(PositionSet positions) {
        return new Positions(positions);
    }

    /**
     * @return the number of matching rows
     */
    int size();

    boolean contains(int position);

    /**
     * @return matching rows in ascending order
     */
    int[] toIntArray();

    IntEnumerator enumerator();

    default boolean isEmpty() {
        return size() == 0;
    }

    default boolean isRange() {
        return this instanceof Range;
    }

    default RowRange asRange() {
        if (this instanceof Range range) {
            return range.range();
        }
        throw new IllegalStateException("result is an explicit position set");
    }

    default PositionSet asPositions() {
        if (this instanceof Positions positions) {
            return positions.positions();
        }
        throw new IllegalStateException("result is a contiguous range");
    }

    record Range(RowRange range) implements RangeOrPositions {
        public Range {
            if (range == null) {
                throw new IllegalArgumentException("range required");
            }
        }

        @Override
        public int size() {
            return range.size();
        }

        @Override
        public boolean contains(int position) {
            return range.contains(position);
        }

        @Override
        public int[] toIntArray() {
            int[] values = new int[range.size()];
            for (int i = 0; i < values.length; i++) {
                values[i] = range.begin() + i;
            }
            return values;
        }

        @Override
        public IntEnumerator enumerator() {
            return IntEnumerator.ofRange(range.begin(), range.end());
        }
    }

    record Positions(PositionSet positions) implements RangeOrPositions {
        public Positions {
            if (positions == null) {
                throw new IllegalArgumentException("positions required");
            }
        }

        @Override
        public int size() {
            return positions.size();
        }

        @Override
        public boolean contains(int position) {
            return positions.contains(position);
        }

        @Override
        public int[] toIntArray() {
            return positions.toIntArray();
        }

        @Override
        public IntEnumerator enumerator() {
            return positions.enumerator();
        }
    }
}
