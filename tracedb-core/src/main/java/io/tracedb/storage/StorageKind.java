package io.tracedb.storage;

/**
 * Column encodings known to the serialization layer.
 */
public enum StorageKind {
    /**
     * Non-decreasing grouping ids where every value is at most its row position.
     */
    SET_ID
}
