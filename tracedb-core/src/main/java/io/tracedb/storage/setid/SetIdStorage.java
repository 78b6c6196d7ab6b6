package io.tracedb.storage.setid;

import io.tracedb.core.StorageContractException;
import io.tracedb.core.TraceDbConfiguration;
import io.tracedb.kernel.FilterOp;
import io.tracedb.kernel.RangeOrPositions;
import io.tracedb.kernel.RowRange;
import io.tracedb.kernel.SqlValue;
import io.tracedb.kernel.selection.BitsetPositions;
import io.tracedb.kernel.selection.IntPositions;
import io.tracedb.kernel.selection.MutablePositionSet;
import io.tracedb.kernel.selection.PositionSets;
import io.tracedb.storage.ColumnSink;
import io.tracedb.storage.Storage;
import io.tracedb.storage.StorageKind;
import io.tracedb.storage.UIntComparison;
import io.tracedb.storage.UIntSequence;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Arrays;

/**
 * Storage for grouping-id columns.
 * <p>
 * A grouping id names the run of rows a row belongs to; the id of a run is the
 * position of its first row. Values therefore never decrease and never exceed their
 * row position ({@code value[i] <= i}). Searches use both properties: matches of any
 * comparison form one contiguous block found by binary search, and a search for
 * value {@code v} never needs to look below position {@code v}.
 * <p>
 * The storage holds a reference to the values only; the owner of the column keeps
 * them unchanged while the storage is in use. Instances are not thread-safe.
 */
public final class SetIdStorage implements Storage {

    private static final Logger LOGGER = LoggerFactory.getLogger(SetIdStorage.class);

    private final UIntSequence values;
    private final TraceDbConfiguration configuration;
    private final boolean validating;

    public SetIdStorage(UIntSequence values) {
        this(values, TraceDbConfiguration.defaults());
    }

    public SetIdStorage(UIntSequence values, TraceDbConfiguration configuration) {
        if (values == null) {
            throw new IllegalArgumentException("values required");
        }
        if (configuration == null) {
            throw new IllegalArgumentException("configuration required");
        }
        this.values = values;
        this.configuration = configuration;
        this.validating = configuration.validateInvariants();
        if (validating) {
            SetIdSequences.validate(values);
            LOGGER.debug("Validated set id column of {} rows", values.size());
        }
    }

    @Override
    public RangeOrPositions search(FilterOp op, SqlValue value, RowRange range) {
        requireArguments(op, value);
        if (range == null) {
            throw new IllegalArgumentException("range required");
        }
        if (validating && range.end() > values.size()) {
            throw new StorageContractException("range " + range + " exceeds column size " + values.size());
        }
        switch (op) {
            case IS_NULL:
                return RangeOrPositions.of(RowRange.empty());
            case IS_NOT_NULL:
                return RangeOrPositions.of(range);
            default:
                break;
        }

        UIntComparison comparison = UIntComparison.resolve(op, value);
        switch (comparison.outcome()) {
            case NONE:
                return RangeOrPositions.of(RowRange.empty());
            case ALL:
                return RangeOrPositions.of(range);
            default:
                break;
        }

        if (comparison.op() == FilterOp.NE) {
            RowRange equal = binarySearchIntrinsic(FilterOp.EQ, comparison.operand(), range);
            MutablePositionSet result = newPositionSet(range.size() - equal.size());
            result.addRange(range.begin(), equal.begin());
            result.addRange(equal.end(), range.end());
            return RangeOrPositions.of(result);
        }
        return RangeOrPositions.of(binarySearchIntrinsic(comparison.op(), comparison.operand(), range));
    }

    @Override
    public RangeOrPositions indexSearch(FilterOp op, SqlValue value, int[] indices, boolean sorted) {
        requireArguments(op, value);
        if (indices == null) {
            throw new IllegalArgumentException("indices required");
        }
        if (validating) {
            checkIndices(indices, sorted);
        }
        if (indices.length == 0 || op == FilterOp.IS_NULL) {
            return RangeOrPositions.of(PositionSets.empty());
        }
        if (op == FilterOp.IS_NOT_NULL) {
            return RangeOrPositions.of(allOf(indices));
        }

        UIntComparison comparison = UIntComparison.resolve(op, value);
        switch (comparison.outcome()) {
            case NONE:
                return RangeOrPositions.of(PositionSets.empty());
            case ALL:
                return RangeOrPositions.of(allOf(indices));
            default:
                break;
        }
        if (!sorted) {
            return RangeOrPositions.of(linearIndexSearch(comparison, indices));
        }

        if (comparison.op() == FilterOp.NE) {
            int lower = lowerBound(indices, 0, indices.length, comparison.operand());
            int upper = upperBound(indices, lower, indices.length, comparison.operand());
            MutablePositionSet result = newPositionSet(indices.length - (upper - lower));
            addIndices(result, indices, 0, lower);
            addIndices(result, indices, upper, indices.length);
            return RangeOrPositions.of(result);
        }
        RowRange matching = binarySearchIndices(comparison.op(), comparison.operand(), indices);
        MutablePositionSet result = newPositionSet(matching.size());
        addIndices(result, indices, matching.begin(), matching.end());
        return RangeOrPositions.of(result);
    }

    @Override
    public void sort(int[] rows) {
        if (rows == null) {
            throw new IllegalArgumentException("rows required");
        }
        if (validating) {
            checkIndices(rows, false);
        }
        if (rows.length < 2) {
            return;
        }
        int[] keys = new int[rows.length];
        for (int i = 0; i < rows.length; i++) {
            keys[i] = values.get(rows[i]);
        }
        quickSort(rows, keys, 0, rows.length - 1);
    }

    @Override
    public void stableSort(int[] rows) {
        if (rows == null) {
            throw new IllegalArgumentException("rows required");
        }
        if (validating) {
            checkIndices(rows, false);
        }
        if (rows.length < 2) {
            return;
        }
        // High half holds the value, low half the original slot: every key is distinct,
        // so any sort of the keys keeps ties in slot order.
        long[] keys = new long[rows.length];
        for (int i = 0; i < rows.length; i++) {
            keys[i] = (values.getUnsigned(rows[i]) << 32) | i;
        }
        if (configuration.enableParallelSorting() && rows.length > configuration.parallelSortThreshold()) {
            Arrays.parallelSort(keys);
        } else {
            Arrays.sort(keys);
        }
        int[] original = rows.clone();
        for (int i = 0; i < keys.length; i++) {
            rows[i] = original[(int) keys[i]];
        }
    }

    @Override
    public void serialize(ColumnSink sink) throws IOException {
        if (sink == null) {
            throw new IllegalArgumentException("sink required");
        }
        int size = values.size();
        sink.beginColumn(StorageKind.SET_ID, size);
        for (int row = 0; row < size; row++) {
            sink.writeUInt(values.get(row));
        }
        sink.endColumn();
        LOGGER.debug("Serialized set id column of {} rows", size);
    }

    @Override
    public int size() {
        return values.size();
    }

    @Override
    public StorageKind kind() {
        return StorageKind.SET_ID;
    }

    /**
     * Range of rows within {@code range} satisfying {@code op operand}, for a comparison
     * operator other than NE and an operand inside the unsigned domain.
     */
    private RowRange binarySearchIntrinsic(FilterOp op, long operand, RowRange range) {
        int begin = range.begin();
        int end = range.end();
        switch (op) {
            case EQ: {
                int lower = lowerBound(begin, end, operand);
                return new RowRange(lower, upperBound(lower, end, operand));
            }
            case LT:
                return new RowRange(begin, lowerBound(begin, end, operand));
            case LE:
                return new RowRange(begin, upperBound(begin, end, operand));
            case GT:
                return new RowRange(upperBound(begin, end, operand), end);
            case GE:
                return new RowRange(lowerBound(begin, end, operand), end);
            default:
                throw new IllegalArgumentException("unexpected operator: " + op);
        }
    }

    /**
     * First row in {@code [begin, end)} whose value is at least {@code operand}, or {@code end}.
     */
    private int lowerBound(int begin, int end, long operand) {
        // Rows below the operand hold values below it.
        int first = (int) Math.max(begin, Math.min(operand, end));
        int count = end - first;
        while (count > 0) {
            int step = count >>> 1;
            int mid = first + step;
            if (values.getUnsigned(mid) < operand) {
                first = mid + 1;
                count -= step + 1;
            } else {
                count = step;
            }
        }
        return first;
    }

    /**
     * First row in {@code [begin, end)} whose value is greater than {@code operand}, or {@code end}.
     */
    private int upperBound(int begin, int end, long operand) {
        // Rows up to the operand hold values no greater than it.
        int first = (int) Math.max(begin, Math.min(operand + 1, end));
        int count = end - first;
        while (count > 0) {
            int step = count >>> 1;
            int mid = first + step;
            if (values.getUnsigned(mid) <= operand) {
                first = mid + 1;
                count -= step + 1;
            } else {
                count = step;
            }
        }
        return first;
    }

    private RowRange binarySearchIndices(FilterOp op, long operand, int[] indices) {
        int size = indices.length;
        switch (op) {
            case EQ: {
                int lower = lowerBound(indices, 0, size, operand);
                return new RowRange(lower, upperBound(indices, lower, size, operand));
            }
            case LT:
                return new RowRange(0, lowerBound(indices, 0, size, operand));
            case LE:
                return new RowRange(0, upperBound(indices, 0, size, operand));
            case GT:
                return new RowRange(upperBound(indices, 0, size, operand), size);
            case GE:
                return new RowRange(lowerBound(indices, 0, size, operand), size);
            default:
                throw new IllegalArgumentException("unexpected operator: " + op);
        }
    }

    private int lowerBound(int[] indices, int begin, int end, long operand) {
        int first = begin;
        int count = end - begin;
        while (count > 0) {
            int step = count >>> 1;
            int mid = first + step;
            if (values.getUnsigned(indices[mid]) < operand) {
                first = mid + 1;
                count -= step + 1;
            } else {
                count = step;
            }
        }
        return first;
    }

    private int upperBound(int[] indices, int begin, int end, long operand) {
        int first = begin;
        int count = end - begin;
        while (count > 0) {
            int step = count >>> 1;
            int mid = first + step;
            if (values.getUnsigned(indices[mid]) <= operand) {
                first = mid + 1;
                count -= step + 1;
            } else {
                count = step;
            }
        }
        return first;
    }

    private MutablePositionSet linearIndexSearch(UIntComparison comparison, int[] indices) {
        MutablePositionSet result = newPositionSet(indices.length);
        for (int index : indices) {
            if (comparison.matches(values.get(index))) {
                result.add(index);
            }
        }
        return result;
    }

    private MutablePositionSet allOf(int[] indices) {
        MutablePositionSet result = newPositionSet(indices.length);
        addIndices(result, indices, 0, indices.length);
        return result;
    }

    private static void addIndices(MutablePositionSet result, int[] indices, int from, int to) {
        for (int k = from; k < to; k++) {
            result.add(indices[k]);
        }
    }

    private static void quickSort(int[] rows, int[] keys, int low, int high) {
        while (low < high) {
            int i = low;
            int j = high;
            int pivot = keys[low + ((high - low) >>> 1)];
            while (i <= j) {
                while (keys[i] < pivot) {
                    i++;
                }
                while (keys[j] > pivot) {
                    j--;
                }
                if (i <= j) {
                    swap(rows, i, j);
                    swap(keys, i, j);
                    i++;
                    j--;
                }
            }
            // Recurse into the smaller side, loop on the larger one.
            if (j - low < high - i) {
                if (low < j) {
                    quickSort(rows, keys, low, j);
                }
                low = i;
            } else {
                if (i < high) {
                    quickSort(rows, keys, i, high);
                }
                high = j;
            }
        }
    }

    private static void swap(int[] values, int i, int j) {
        int tmp = values[i];
        values[i] = values[j];
        values[j] = tmp;
    }

    // Bitsets above the configured threshold, sorted arrays below it.
    private MutablePositionSet newPositionSet(int expectedSize) {
        if (expectedSize >= configuration.bitSetThreshold()) {
            return new BitsetPositions();
        }
        return new IntPositions(Math.max(expectedSize, 16));
    }

    private static void requireArguments(FilterOp op, SqlValue value) {
        if (op == null) {
            throw new IllegalArgumentException("op required");
        }
        if (value == null) {
            throw new IllegalArgumentException("value required");
        }
    }

    private void checkIndices(int[] indices, boolean sorted) {
        int size = values.size();
        for (int k = 0; k < indices.length; k++) {
            int index = indices[k];
            if (index < 0 || index >= size) {
                throw new StorageContractException("position " + index + " outside column of " + size + " rows");
            }
            if (sorted && k > 0 && values.getUnsigned(indices[k - 1]) > values.getUnsigned(index)) {
                throw new StorageContractException("indices claimed sorted but value at slot " + k + " decreases");
            }
        }
    }
}
