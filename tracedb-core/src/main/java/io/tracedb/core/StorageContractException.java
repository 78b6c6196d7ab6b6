package io.tracedb.core;

/**
 * Raised when a caller breaks the storage contract: an out-of-bounds row range,
 * a position outside the column, an untrue {@code sorted} hint or a value sequence
 * that does not satisfy the invariant of its column kind.
 * <p>
 * Only thrown when invariant validation is enabled in {@link TraceDbConfiguration};
 * otherwise the result of such a call is undefined.
 */
public class StorageContractException extends TraceDbException {

    public StorageContractException(String message) {
        super(message);
    }
}
