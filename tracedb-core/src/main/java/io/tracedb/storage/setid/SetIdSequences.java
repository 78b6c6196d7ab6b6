package io.tracedb.storage.setid;

import io.tracedb.core.StorageContractException;
import io.tracedb.storage.UIntSequence;

/**
 * Checks for the grouping-id invariant: every value is at most its row position,
 * and values never decrease.
 */
public final class SetIdSequences {

    private SetIdSequences() {
    }

    public static boolean isValid(UIntSequence values) {
        return firstViolation(values) < 0;
    }

    /**
     * @throws StorageContractException naming the first row that breaks the invariant
     */
    public static void validate(UIntSequence values) {
        int row = firstViolation(values);
        if (row < 0) {
            return;
        }
        long value = values.getUnsigned(row);
        if (value > row) {
            throw new StorageContractException("set id " + value + " at row " + row + " exceeds its row position");
        }
        throw new StorageContractException("set id " + value + " at row " + row
                + " is smaller than the previous id " + values.getUnsigned(row - 1));
    }

    /**
     * @return the first offending row, or -1 if the sequence is a valid grouping-id sequence
     */
    static int firstViolation(UIntSequence values) {
        if (values == null) {
            throw new IllegalArgumentException("values required");
        }
        long previous = 0;
        for (int row = 0; row < values.size(); row++) {
            long value = values.getUnsigned(row);
            if (value > row || value < previous) {
                return row;
            }
            previous = value;
        }
        return -1;
    }
}
