package io.tracedb.kernel.selection;

import java.util.BitSet;
import java.util.NoSuchElementException;

/**
 * Bitset-backed position set for dense or large results.
 */
public final class BitsetPositions implements MutablePositionSet {
    private final BitSet bitSet;
    private int size;

    public BitsetPositions() {
        this.bitSet = new BitSet();
    }

    public BitsetPositions(int expectedMaxPosition) {
        this.bitSet = new BitSet(Math.max(expectedMaxPosition, 0));
    }

    @Override
    public void add(int position) {
        if (position < 0) {
            throw new IllegalArgumentException("position must be non-negative");
        }
        if (!bitSet.get(position)) {
            bitSet.set(position);
            size++;
        }
    }

    @Override
    public void addRange(int begin, int end) {
        if (begin >= end) {
            return;
        }
        if (begin < 0) {
            throw new IllegalArgumentException("position must be non-negative");
        }
        size += (end - begin) - bitSet.get(begin, end).cardinality();
        bitSet.set(begin, end);
    }

    @Override
    public int size() {
        return size;
    }

    @Override
    public boolean contains(int position) {
        return position >= 0 && bitSet.get(position);
    }

    @Override
    public int[] toIntArray() {
        return bitSet.stream().toArray();
    }

    @Override
    public IntEnumerator enumerator() {
        return new IntEnumerator() {
            private int current = bitSet.nextSetBit(0);

            @Override
            public boolean hasNext() {
                return current >= 0;
            }

            @Override
            public int nextInt() {
                if (current < 0) {
                    throw new NoSuchElementException();
                }
                int value = current;
                current = bitSet.nextSetBit(current + 1);
                return value;
            }
        };
    }
}
