package io.tracedb.storage;

/**
 * Read-only view over an ordered sequence of unsigned 32-bit values, one per row.
 * <p>
 * Values are held in Java {@code int}s and read with {@link Integer#toUnsignedLong(int)}
 * semantics. The view does not own the values; its size never changes.
 */
public interface UIntSequence {

    int size();

    /**
     * @param index row position in {@code [0, size())}
     * @return the raw value bits at {@code index}
     */
    int get(int index);

    default long getUnsigned(int index) {
        return Integer.toUnsignedLong(get(index));
    }

    /**
     * Wraps {@code values} without copying. The caller must not modify the array while
     * the view is in use.
     */
    static UIntSequence wrap(int[] values) {
        if (values == null) {
            throw new IllegalArgumentException("values required");
        }
        return new UIntSequence() {
            @Override
            public int size() {
                return values.length;
            }

            @Override
            public int get(int index) {
                return values[index];
            }
        };
    }
}
