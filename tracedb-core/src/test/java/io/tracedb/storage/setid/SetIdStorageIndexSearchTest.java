package io.tracedb.storage.setid;

import io.tracedb.core.StorageContractException;
import io.tracedb.core.TraceDbConfiguration;
import io.tracedb.kernel.FilterOp;
import io.tracedb.kernel.RangeOrPositions;
import io.tracedb.kernel.SqlValue;
import io.tracedb.kernel.selection.BitsetPositions;
import io.tracedb.kernel.selection.IntPositions;
import io.tracedb.storage.UIntSequence;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SetIdStorageIndexSearchTest {

    private static final int[] VALUES = {0, 0, 1, 1, 1, 4};

    private final SetIdStorage storage = new SetIdStorage(UIntSequence.wrap(VALUES));

    @Test
    @DisplayName("unsorted EQ reports matching original positions regardless of input order")
    void unsortedEqIgnoresInputOrder() {
        int[] indices = {5, 4, 3, 2, 1, 0};

        RangeOrPositions result = storage.indexSearch(FilterOp.EQ, SqlValue.ofLong(1), indices, false);

        assertThat(result.isRange()).isFalse();
        assertThat(result.toIntArray()).containsExactly(2, 3, 4);
        assertThat(indices).containsExactly(5, 4, 3, 2, 1, 0);
    }

    @Test
    void unsortedComparisons() {
        int[] indices = {3, 5, 0};

        assertThat(storage.indexSearch(FilterOp.NE, SqlValue.ofLong(1), indices, false).toIntArray())
                .containsExactly(0, 5);
        assertThat(storage.indexSearch(FilterOp.GT, SqlValue.ofLong(0), indices, false).toIntArray())
                .containsExactly(3, 5);
        assertThat(storage.indexSearch(FilterOp.LE, SqlValue.ofLong(1), indices, false).toIntArray())
                .containsExactly(0, 3);
    }

    @Test
    void sortedSearchMapsBoundariesBackToPositions() {
        int[] indices = {0, 2, 3, 5};

        assertThat(storage.indexSearch(FilterOp.EQ, SqlValue.ofLong(1), indices, true).toIntArray())
                .containsExactly(2, 3);
        assertThat(storage.indexSearch(FilterOp.NE, SqlValue.ofLong(1), indices, true).toIntArray())
                .containsExactly(0, 5);
        assertThat(storage.indexSearch(FilterOp.GE, SqlValue.ofLong(1), indices, true).toIntArray())
                .containsExactly(2, 3, 5);
        assertThat(storage.indexSearch(FilterOp.LT, SqlValue.ofLong(1), indices, true).toIntArray())
                .containsExactly(0);
        assertThat(storage.indexSearch(FilterOp.GT, SqlValue.ofLong(4), indices, true).isEmpty())
                .isTrue();
    }

    @Test
    @DisplayName("sorted search accepts equal values at descending positions")
    void sortedSearchWithTiesInAnyPositionOrder() {
        int[] indices = {1, 0, 4, 2, 3, 5};

        RangeOrPositions result = storage.indexSearch(FilterOp.EQ, SqlValue.ofLong(1), indices, true);

        assertThat(result.toIntArray()).containsExactly(2, 3, 4);
    }

    @Test
    void duplicatePositionsAreReportedOnce() {
        int[] indices = {2, 2, 4, 2};

        assertThat(storage.indexSearch(FilterOp.EQ, SqlValue.ofLong(1), indices, false).toIntArray())
                .containsExactly(2, 4);
    }

    @ParameterizedTest
    @ValueSource(booleans = {true, false})
    void emptyInputYieldsEmptyResult(boolean sorted) {
        assertThat(storage.indexSearch(FilterOp.EQ, SqlValue.ofLong(1), new int[0], sorted).isEmpty()).isTrue();
        assertThat(storage.indexSearch(FilterOp.IS_NOT_NULL, SqlValue.ofNull(), new int[0], sorted).isEmpty()).isTrue();
    }

    @ParameterizedTest
    @ValueSource(booleans = {true, false})
    void nullChecks(boolean sorted) {
        int[] indices = {1, 3, 4};

        assertThat(storage.indexSearch(FilterOp.IS_NULL, SqlValue.ofNull(), indices, sorted).isEmpty()).isTrue();
        assertThat(storage.indexSearch(FilterOp.IS_NOT_NULL, SqlValue.ofNull(), indices, sorted).toIntArray())
                .containsExactly(1, 3, 4);
    }

    @ParameterizedTest
    @ValueSource(booleans = {true, false})
    void outOfDomainOperands(boolean sorted) {
        int[] indices = {0, 1, 2};

        assertThat(storage.indexSearch(FilterOp.GT, SqlValue.ofLong(-1), indices, sorted).toIntArray())
                .containsExactly(0, 1, 2);
        assertThat(storage.indexSearch(FilterOp.EQ, SqlValue.ofString("a"), indices, sorted).isEmpty())
                .isTrue();
        assertThat(storage.indexSearch(FilterOp.LT, SqlValue.ofNull(), indices, sorted).isEmpty())
                .isTrue();
    }

    @Test
    void largeResultsUseBitset() {
        var config = TraceDbConfiguration.builder().bitSetThreshold(4).build();
        var bitsetStorage = new SetIdStorage(UIntSequence.wrap(VALUES), config);

        RangeOrPositions result = bitsetStorage.indexSearch(FilterOp.GE, SqlValue.ofLong(0),
                new int[]{5, 1, 2, 0, 3}, false);

        assertThat(result.asPositions()).isInstanceOf(BitsetPositions.class);
        assertThat(result.toIntArray()).containsExactly(0, 1, 2, 3, 5);
    }

    @Test
    void resultsBelowThresholdUseSortedArray() {
        var config = TraceDbConfiguration.builder().bitSetThreshold(6).build();
        var arrayStorage = new SetIdStorage(UIntSequence.wrap(VALUES), config);

        RangeOrPositions result = arrayStorage.indexSearch(FilterOp.GE, SqlValue.ofLong(0),
                new int[]{5, 1, 2, 0, 3}, false);

        assertThat(result.asPositions()).isInstanceOf(IntPositions.class);
        assertThat(result.toIntArray()).containsExactly(0, 1, 2, 3, 5);
    }

    @Test
    void validatingStorageRejectsUntrueSortedHint() {
        var config = TraceDbConfiguration.builder().validateInvariants(true).build();
        var validating = new SetIdStorage(UIntSequence.wrap(VALUES), config);

        assertThatThrownBy(() -> validating.indexSearch(FilterOp.EQ, SqlValue.ofLong(1), new int[]{5, 0}, true))
                .isInstanceOf(StorageContractException.class)
                .hasMessageContaining("sorted");
        assertThat(validating.indexSearch(FilterOp.EQ, SqlValue.ofLong(1), new int[]{5, 2}, false).toIntArray())
                .containsExactly(2);
    }

    @Test
    void validatingStorageRejectsPositionOutsideColumn() {
        var config = TraceDbConfiguration.builder().validateInvariants(true).build();
        var validating = new SetIdStorage(UIntSequence.wrap(VALUES), config);

        assertThatThrownBy(() -> validating.indexSearch(FilterOp.EQ, SqlValue.ofLong(1), new int[]{6}, false))
                .isInstanceOf(StorageContractException.class)
                .hasMessageContaining("position 6");
    }
}
