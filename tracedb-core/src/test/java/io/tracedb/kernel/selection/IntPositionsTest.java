package io.tracedb.kernel.selection;

import org.junit.jupiter.api.Test;

import java.util.NoSuchElementException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class IntPositionsTest {

    @Test
    void shouldStartEmpty() {
        var set = new IntPositions();
        assertThat(set.size()).isZero();
        assertThat(set.isEmpty()).isTrue();
    }

    @Test
    void shouldRejectNegativePosition() {
        var set = new IntPositions();
        assertThatThrownBy(() -> set.add(-1))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldSortAndDeduplicateOutOfOrderAdds() {
        var set = new IntPositions();
        set.add(5);
        set.add(2);
        set.add(5);
        set.add(9);
        set.add(2);

        assertThat(set.size()).isEqualTo(3);
        assertThat(set.toIntArray()).containsExactly(2, 5, 9);
        assertThat(set.contains(5)).isTrue();
        assertThat(set.contains(4)).isFalse();
    }

    @Test
    void shouldBeIdempotentForAscendingDuplicates() {
        var set = new IntPositions();
        set.add(1);
        set.add(1);
        set.add(1);
        assertThat(set.toIntArray()).containsExactly(1);
    }

    @Test
    void shouldGrowBeyondInitialCapacity() {
        var set = new IntPositions(0);
        for (int i = 0; i < 100; i++) {
            set.add(i * 2);
        }
        assertThat(set.size()).isEqualTo(100);
        assertThat(set.contains(198)).isTrue();
    }

    @Test
    void addRangeMergesWithExistingPositions() {
        var set = new IntPositions();
        set.add(10);
        set.addRange(8, 12);
        set.addRange(20, 20);

        assertThat(set.toIntArray()).containsExactly(8, 9, 10, 11);
    }

    @Test
    void enumeratorIsExhaustible() {
        var set = new IntPositions();
        set.add(3);
        IntEnumerator enumerator = set.enumerator();

        assertThat(enumerator.nextInt()).isEqualTo(3);
        assertThat(enumerator.hasNext()).isFalse();
        assertThatThrownBy(enumerator::nextInt).isInstanceOf(NoSuchElementException.class);
    }

    @Test
    void emptySetIsShared() {
        assertThat(PositionSets.empty().size()).isZero();
        assertThat(PositionSets.empty().enumerator().hasNext()).isFalse();
        assertThat(PositionSets.empty()).isSameAs(PositionSets.empty());
    }
}
