package io.tracedb.kernel.selection;

import java.util.Arrays;
import java.util.NoSuchElementException;

/**
 * Array-backed position set for small cardinalities.
 * <p>
 * Appending in ascending order is O(1). Out-of-order or duplicate positions are
 * accepted and normalized (sorted, de-duplicated) once, on the first read.
 */
public final class IntPositions implements MutablePositionSet {
    private static final int DEFAULT_CAPACITY = 16;

    private int[] values;
    private int size;
    private boolean normalized = true;

    public IntPositions() {
        this.values = new int[DEFAULT_CAPACITY];
    }

    public IntPositions(int initialCapacity) {
        if (initialCapacity < 0) {
            throw new IllegalArgumentException("initialCapacity must be non-negative");
        }
        this.values = new int[Math.max(DEFAULT_CAPACITY, initialCapacity)];
    }

    @Override
    public void add(int position) {
        if (position < 0) {
            throw new IllegalArgumentException("position must be non-negative");
        }
        if (normalized && size > 0) {
            int last = values[size - 1];
            if (last == position) {
                return;
            }
            normalized = last < position;
        }
        ensureCapacity(size + 1);
        values[size++] = position;
    }

    @Override
    public void addRange(int begin, int end) {
        if (begin >= end) {
            return;
        }
        if (begin < 0) {
            throw new IllegalArgumentException("position must be non-negative");
        }
        if (normalized && size > 0 && values[size - 1] >= begin) {
            normalized = false;
        }
        ensureCapacity(size + (end - begin));
        for (int position = begin; position < end; position++) {
            values[size++] = position;
        }
    }

    @Override
    public int size() {
        normalize();
        return size;
    }

    @Override
    public boolean contains(int position) {
        if (position < 0) {
            return false;
        }
        normalize();
        return Arrays.binarySearch(values, 0, size, position) >= 0;
    }

    @Override
    public int[] toIntArray() {
        normalize();
        return Arrays.copyOf(values, size);
    }

    @Override
    public IntEnumerator enumerator() {
        normalize();
        return new IntEnumerator() {
            private int index;

            @Override
            public boolean hasNext() {
                return index < size;
            }

            @Override
            public int nextInt() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                return values[index++];
            }
        };
    }

    private void normalize() {
        if (normalized) {
            return;
        }
        Arrays.sort(values, 0, size);
        int unique = 0;
        for (int i = 0; i < size; i++) {
            if (unique == 0 || values[unique - 1] != values[i]) {
                values[unique++] = values[i];
            }
        }
        size = unique;
        normalized = true;
    }

    private void ensureCapacity(int desired) {
        if (desired <= values.length) {
            return;
        }
        int newCapacity = Math.max(values.length * 2, desired);
        values = Arrays.copyOf(values, newCapacity);
    }
}
