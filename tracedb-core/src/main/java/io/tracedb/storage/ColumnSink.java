package io.tracedb.storage;

import java.io.IOException;

/**
 * Append-only destination for a serialized column.
 * <p>
 * A column is written as {@code beginColumn}, exactly {@code size} calls to
 * {@code writeUInt} in row order, then {@code endColumn}.
 */
public interface ColumnSink {

    void beginColumn(StorageKind kind, int size) throws IOException;

    void writeUInt(int value) throws IOException;

    void endColumn() throws IOException;
}
