package io.tracedb.kernel.selection;

import java.util.NoSuchElementException;

/**
 * Primitive iterator over row positions.
 */
public interface IntEnumerator {

    boolean hasNext();

    int nextInt();

    static IntEnumerator ofRange(int begin, int end) {
        return new IntEnumerator() {
            private int current = begin;

            @Override
            public boolean hasNext() {
                return current < end;
            }

            @Override
            public int nextInt() {
                if (current >= end) {
                    throw new NoSuchElementException();
                }
                return current++;
            }
        };
    }
}
