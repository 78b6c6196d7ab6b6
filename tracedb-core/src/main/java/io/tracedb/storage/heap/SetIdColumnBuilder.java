package io.tracedb.storage.heap;

import io.tracedb.core.TraceDbConfiguration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds grouping-id columns row by row.
 * <p>
 * Rows either start a new set, taking their own position as id, or join the set
 * of the previous row. Any column built this way satisfies the grouping-id invariant.
 */
public final class SetIdColumnBuilder {

    private static final Logger LOGGER = LoggerFactory.getLogger(SetIdColumnBuilder.class);

    private final PagedUIntColumn column;
    private int currentSetId = -1;
    private int setCount;

    public SetIdColumnBuilder() {
        this(TraceDbConfiguration.defaults());
    }

    public SetIdColumnBuilder(TraceDbConfiguration configuration) {
        if (configuration == null) {
            throw new IllegalArgumentException("configuration required");
        }
        this.column = new PagedUIntColumn(configuration.pageSize(), configuration.maxPages());
    }

    /**
     * Append a row that opens a new set.
     *
     * @return the id of the new set, equal to the row position
     */
    public int startSet() {
        int row = column.appendedCount();
        column.append(row);
        currentSetId = row;
        setCount++;
        return row;
    }

    /**
     * Append a row to the set of the previous row.
     *
     * @return the row position
     * @throws IllegalStateException if no set was started
     */
    public int appendToSet() {
        if (currentSetId < 0) {
            throw new IllegalStateException("no set started");
        }
        return column.append(currentSetId);
    }

    /**
     * Append a set of {@code rows} rows.
     *
     * @return the id of the new set
     */
    public int addSet(int rows) {
        if (rows <= 0) {
            throw new IllegalArgumentException("rows must be positive: " + rows);
        }
        int setId = startSet();
        for (int i = 1; i < rows; i++) {
            appendToSet();
        }
        return setId;
    }

    public int rowCount() {
        return column.appendedCount();
    }

    public int setCount() {
        return setCount;
    }

    /**
     * Publish every appended row and return the column.
     */
    public PagedUIntColumn build() {
        int rows = column.publish();
        LOGGER.debug("Published set id column with {} rows in {} sets", rows, setCount);
        return column;
    }
}
