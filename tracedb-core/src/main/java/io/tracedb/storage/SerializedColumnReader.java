package io.tracedb.storage;

import io.tracedb.core.TraceDbException;

import java.io.DataInput;
import java.io.IOException;
import java.util.Arrays;

/**
 * Reads columns written by {@link DataOutputColumnSink}.
 */
public final class SerializedColumnReader {

    private static final StorageKind[] KINDS = StorageKind.values();
    private static final int CHUNK_SIZE = 1 << 16;

    private SerializedColumnReader() {
    }

    /**
     * @throws java.io.EOFException if the input ends inside a column
     * @throws TraceDbException if the input is not a serialized column
     */
    public static SerializedColumn read(DataInput in) throws IOException {
        if (in == null) {
            throw new IllegalArgumentException("in required");
        }
        int magic = in.readInt();
        if (magic != DataOutputColumnSink.MAGIC) {
            throw new TraceDbException("not a serialized column, magic: 0x" + Integer.toHexString(magic));
        }
        int ordinal = in.readUnsignedByte();
        if (ordinal >= KINDS.length) {
            throw new TraceDbException("unknown storage kind: " + ordinal);
        }
        int size = in.readInt();
        if (size < 0) {
            throw new TraceDbException("negative column size: " + size);
        }
        // Size header is untrusted; grow as values arrive.
        int[] values = new int[Math.min(size, CHUNK_SIZE)];
        for (int i = 0; i < size; i++) {
            if (i == values.length) {
                values = Arrays.copyOf(values, (int) Math.min(size, (long) values.length * 2));
            }
            values[i] = in.readInt();
        }
        return new SerializedColumn(KINDS[ordinal], values);
    }
}
