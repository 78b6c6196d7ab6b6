package io.tracedb.core;

/**
 * Immutable configuration for column storage.
 * <p>
 * Use the builder pattern to create custom configurations:
 * <pre>
 * TraceDbConfiguration config = TraceDbConfiguration.builder()
 *     .validateInvariants(true)
 *     .parallelSortThreshold(100_000)
 *     .build();
 * </pre>
 * <p>
 * All configuration is immutable once built.
 */
public final class TraceDbConfiguration {

    private static final TraceDbConfiguration DEFAULTS = builder().build();

    // Contract checking
    private final boolean validateInvariants;

    // Sorting configuration
    private final boolean enableParallelSorting;
    private final int parallelSortThreshold;

    // Position set representation
    private final int bitSetThreshold;

    // Column paging
    private final int pageSize;
    private final int maxPages;

    private TraceDbConfiguration(Builder builder) {
        this.validateInvariants = builder.validateInvariants;
        this.enableParallelSorting = builder.enableParallelSorting;
        this.parallelSortThreshold = builder.parallelSortThreshold;
        this.bitSetThreshold = builder.bitSetThreshold;
        this.pageSize = builder.pageSize;
        this.maxPages = builder.maxPages;
    }

    /**
     * Create a new builder for TraceDbConfiguration.
     *
     * @return a new Builder instance
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Get the shared default configuration.
     *
     * @return the default configuration
     */
    public static TraceDbConfiguration defaults() {
        return DEFAULTS;
    }

    /**
     * Check if storage contract checks are enabled.
     * <p>
     * When enabled, storages validate their value sequence on construction and
     * check ranges, positions and sortedness hints on every call, raising
     * {@link StorageContractException} on violation.
     *
     * @return true if validation is enabled (default: false)
     */
    public boolean validateInvariants() {
        return validateInvariants;
    }

    /**
     * Check if parallel sorting is enabled.
     *
     * @return true if parallel sorting is enabled
     */
    public boolean enableParallelSorting() {
        return enableParallelSorting;
    }

    /**
     * Get the threshold for parallel sorting.
     * Stable sorts use {@link java.util.Arrays#parallelSort(long[])} when the
     * permutation buffer exceeds this threshold.
     *
     * @return parallel sort threshold
     */
    public int parallelSortThreshold() {
        return parallelSortThreshold;
    }

    /**
     * Get the expected size at which explicit position sets switch to a bitset.
     *
     * @return bitset threshold
     */
    public int bitSetThreshold() {
        return bitSetThreshold;
    }

    /**
     * Get the page size for new columns.
     *
     * @return page size (number of rows per page)
     */
    public int pageSize() {
        return pageSize;
    }

    /**
     * Get the maximum number of pages for new columns.
     *
     * @return max pages
     */
    public int maxPages() {
        return maxPages;
    }

    /**
     * Builder for TraceDbConfiguration.
     * <p>
     * Provides a fluent API for building configuration instances.
     */
    public static class Builder {
        private boolean validateInvariants = false;
        private boolean enableParallelSorting = true;
        private int parallelSortThreshold = 1 << 16;
        private int bitSetThreshold = 4096;
        private int pageSize = 1024;
        private int maxPages = 1024;

        private Builder() {
        }

        /**
         * Enable or disable storage contract checks.
         *
         * @param validateInvariants true to validate
         * @return this builder for method chaining
         */
        public Builder validateInvariants(boolean validateInvariants) {
            this.validateInvariants = validateInvariants;
            return this;
        }

        /**
         * Enable or disable parallel sorting.
         *
         * @param enableParallelSorting true to enable parallel sorting
         * @return this builder for method chaining
         */
        public Builder enableParallelSorting(boolean enableParallelSorting) {
            this.enableParallelSorting = enableParallelSorting;
            return this;
        }

        /**
         * Set the threshold for using parallel sorting.
         *
         * @param parallelSortThreshold the threshold in number of rows
         * @return this builder for method chaining
         */
        public Builder parallelSortThreshold(int parallelSortThreshold) {
            this.parallelSortThreshold = parallelSortThreshold;
            return this;
        }

        /**
         * Set the expected size at which position sets use a bitset.
         *
         * @param bitSetThreshold the threshold in number of positions
         * @return this builder for method chaining
         */
        public Builder bitSetThreshold(int bitSetThreshold) {
            this.bitSetThreshold = bitSetThreshold;
            return this;
        }

        /**
         * Set the page size for new columns.
         *
         * @param pageSize the page size (number of rows per page)
         * @return this builder for method chaining
         */
        public Builder pageSize(int pageSize) {
            this.pageSize = pageSize;
            return this;
        }

        /**
         * Set the maximum number of pages for new columns.
         *
         * @param maxPages the maximum number of pages
         * @return this builder for method chaining
         */
        public Builder maxPages(int maxPages) {
            this.maxPages = maxPages;
            return this;
        }

        /**
         * Build the configuration.
         *
         * @return a new immutable TraceDbConfiguration
         * @throws IllegalArgumentException if a sizing option is not positive
         */
        public TraceDbConfiguration build() {
            if (parallelSortThreshold <= 0) {
                throw new IllegalArgumentException("parallelSortThreshold must be positive: " + parallelSortThreshold);
            }
            if (bitSetThreshold <= 0) {
                throw new IllegalArgumentException("bitSetThreshold must be positive: " + bitSetThreshold);
            }
            if (pageSize <= 0) {
                throw new IllegalArgumentException("pageSize must be positive: " + pageSize);
            }
            if (maxPages <= 0) {
                throw new IllegalArgumentException("maxPages must be positive: " + maxPages);
            }
            return new TraceDbConfiguration(this);
        }
    }
}
