package io.tracedb.storage;

import java.io.DataOutput;
import java.io.IOException;

/**
 * Writes columns to a {@link DataOutput}.
 * <p>
 * Layout per column: magic {@code int}, kind ordinal {@code byte}, size {@code int},
 * then {@code size} big-endian {@code int} values. Read back with
 * {@link SerializedColumnReader}.
 */
public final class DataOutputColumnSink implements ColumnSink {

    static final int MAGIC = 0x54434F4C;

    private final DataOutput out;
    private int remaining = -1;

    public DataOutputColumnSink(DataOutput out) {
        if (out == null) {
            throw new IllegalArgumentException("out required");
        }
        this.out = out;
    }

    @Override
    public void beginColumn(StorageKind kind, int size) throws IOException {
        if (kind == null) {
            throw new IllegalArgumentException("kind required");
        }
        if (size < 0) {
            throw new IllegalArgumentException("size must be non-negative: " + size);
        }
        if (remaining >= 0) {
            throw new IllegalStateException("column already open");
        }
        out.writeInt(MAGIC);
        out.writeByte(kind.ordinal());
        out.writeInt(size);
        remaining = size;
    }

    @Override
    public void writeUInt(int value) throws IOException {
        if (remaining <= 0) {
            throw new IllegalStateException(remaining < 0 ? "no column open" : "column already complete");
        }
        out.writeInt(value);
        remaining--;
    }

    @Override
    public void endColumn() {
        if (remaining != 0) {
            throw new IllegalStateException(remaining < 0
                    ? "no column open"
                    : "column incomplete, " + remaining + " values missing");
        }
        remaining = -1;
    }
}
