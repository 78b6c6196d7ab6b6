package io.tracedb.storage.heap;

import io.tracedb.storage.UIntSequence;

/**
 * Append-only paged column of unsigned 32-bit values.
 * <p>
 * Pages are allocated on demand. Appended rows become visible to readers once
 * published; {@link #view()} captures the published prefix as a fixed-size
 * {@link UIntSequence}.
 * <p>
 * <b>Thread-safety:</b>
 * <ul>
 *   <li>Writers: single writer (or external synchronization)</li>
 *   <li>Readers: many concurrent readers via volatile published semantics</li>
 *   <li>Publish: monotonic increment (never decreases)</li>
 * </ul>
 */
public final class PagedUIntColumn {

    private static final long MAX_UINT = 0xFFFF_FFFFL;

    private final int pageSize;
    private final int maxPages;
    private final int capacity;
    private final int[][] dataPages;
    private int appended;
    private volatile int published;

    public PagedUIntColumn(int pageSize, int maxPages) {
        if (pageSize <= 0) {
            throw new IllegalArgumentException("pageSize must be positive: " + pageSize);
        }
        if (maxPages <= 0) {
            throw new IllegalArgumentException("maxPages must be positive: " + maxPages);
        }
        long total = (long) pageSize * (long) maxPages;
        if (total > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("capacity exceeds Integer.MAX_VALUE: " + total);
        }
        this.pageSize = pageSize;
        this.maxPages = maxPages;
        this.capacity = (int) total;
        this.dataPages = new int[maxPages][];
    }

    /**
     * Append a value given as its raw 32 bits.
     *
     * @param value the value bits
     * @return the row position of the appended value
     */
    public int append(int value) {
        if (appended >= capacity) {
            throw new IndexOutOfBoundsException("column full: capacity " + capacity);
        }
        int offset = appended;
        int pageId = offset / pageSize;
        if (dataPages[pageId] == null) {
            dataPages[pageId] = new int[pageSize];
        }
        dataPages[pageId][offset % pageSize] = value;
        appended = offset + 1;
        return offset;
    }

    /**
     * Append a value from the unsigned 32-bit domain.
     *
     * @param value the value, in {@code [0, 2^32)}
     * @return the row position of the appended value
     */
    public int appendUnsigned(long value) {
        if (value < 0 || value > MAX_UINT) {
            throw new IllegalArgumentException("value outside unsigned 32-bit range: " + value);
        }
        return append((int) value);
    }

    /**
     * Get the raw value bits at offset.
     *
     * @param offset the offset, below the published count
     * @return the value bits
     */
    public int get(int offset) {
        if (offset < 0 || offset >= published) {
            throw new IndexOutOfBoundsException("offset out of range: " + offset);
        }
        return dataPages[offset / pageSize][offset % pageSize];
    }

    /**
     * Publish every appended row.
     *
     * @return the published count
     */
    public int publish() {
        publish(appended);
        return published;
    }

    /**
     * Publish slots up to the given offset.
     * <p>
     * Published count is monotonic - never decreases.
     *
     * @param newPublished the new published count
     */
    public void publish(int newPublished) {
        if (newPublished < 0 || newPublished > appended) {
            throw new IndexOutOfBoundsException("newPublished out of range: " + newPublished);
        }
        if (newPublished > published) {
            published = newPublished;
        }
    }

    public int publishedCount() {
        return published;
    }

    public int appendedCount() {
        return appended;
    }

    public int capacity() {
        return capacity;
    }

    public int pageCount() {
        int pages = 0;
        for (int pageId = 0; pageId < maxPages; pageId++) {
            if (dataPages[pageId] != null) {
                pages++;
            }
        }
        return pages;
    }

    /**
     * Read-only view of the rows published at the time of the call. Rows appended or
     * published later are not part of the view.
     */
    public UIntSequence view() {
        int size = published;
        return new UIntSequence() {
            @Override
            public int size() {
                return size;
            }

            @Override
            public int get(int index) {
                if (index < 0 || index >= size) {
                    throw new IndexOutOfBoundsException("index out of range: " + index);
                }
                return dataPages[index / pageSize][index % pageSize];
            }
        };
    }
}
