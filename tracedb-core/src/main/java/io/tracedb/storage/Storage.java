package io.tracedb.storage;

import io.tracedb.kernel.FilterOp;
import io.tracedb.kernel.RangeOrPositions;
import io.tracedb.kernel.RowRange;
import io.tracedb.kernel.SqlValue;

import java.io.IOException;

/**
 * Filter, sort and serialize operations over one column, independent of how the
 * column is encoded.
 * <p>
 * <b>Contract:</b>
 * <ul>
 *   <li>All operations are read-only with respect to the column values.</li>
 *   <li>An instance is driven by one thread at a time; distinct instances over the
 *       same values may be used concurrently.</li>
 *   <li>Arguments outside the contract (ranges past {@link #size()}, positions outside
 *       the column, untrue sortedness hints) give undefined results unless contract
 *       validation is enabled.</li>
 * </ul>
 */
public interface Storage {

    /**
     * Finds the rows of {@code range} whose value satisfies {@code op value}.
     *
     * @param op    the filter operator
     * @param value the operand, ignored by the null checks
     * @param range rows to consider, within {@code [0, size())}
     * @return matching rows; a contiguous range whenever the matches are contiguous
     */
    RangeOrPositions search(FilterOp op, SqlValue value, RowRange range);

    /**
     * Finds which of the given row positions satisfy {@code op value}.
     *
     * @param op      the filter operator
     * @param value   the operand, ignored by the null checks
     * @param indices row positions in any order; never modified
     * @param sorted  asserts that the values at {@code indices} are non-decreasing
     * @return the matching positions taken from {@code indices}, as an explicit set
     */
    RangeOrPositions indexSearch(FilterOp op, SqlValue value, int[] indices, boolean sorted);

    /**
     * Reorders {@code rows} in place so that their values are non-decreasing.
     * Rows with equal values end up in an unspecified order.
     *
     * @param rows row positions to reorder
     */
    void sort(int[] rows);

    /**
     * Reorders {@code rows} in place so that their values are non-decreasing,
     * keeping rows with equal values in their original relative order.
     *
     * @param rows row positions to reorder
     */
    void stableSort(int[] rows);

    /**
     * Writes every value of the column, in row order, to {@code sink}.
     *
     * @param sink the destination
     * @throws IOException if the sink fails; the failure is not retried
     */
    void serialize(ColumnSink sink) throws IOException;

    /**
     * @return the number of rows in the column
     */
    int size();

    StorageKind kind();
}
