package io.tracedb.storage;

/**
 * A column read back from its serialized form.
 */
public record SerializedColumn(StorageKind kind, int[] values) {

    public SerializedColumn {
        if (kind == null) {
            throw new IllegalArgumentException("kind required");
        }
        if (values == null) {
            throw new IllegalArgumentException("values required");
        }
    }

    public int size() {
        return values.length;
    }

    public UIntSequence asSequence() {
        return UIntSequence.wrap(values);
    }
}
