package io.tracedb.kernel.selection;

import java.util.NoSuchElementException;

public final class PositionSets {
    private static final PositionSet EMPTY = new PositionSet() {
        @Override
        public int size() {
            return 0;
        }

        @Override
        public boolean contains(int position) {
            return false;
        }

        @Override
        public int[] toIntArray() {
            return new int[0];
        }

        @Override
        public IntEnumerator enumerator() {
            return new IntEnumerator() {
                @Override
                public boolean hasNext() {
                    return false;
                }

                @Override
                public int nextInt() {
                    throw new NoSuchElementException();
                }
            };
        }
    };

    private PositionSets() {
    }

    public static PositionSet empty() {
        return EMPTY;
    }
}
