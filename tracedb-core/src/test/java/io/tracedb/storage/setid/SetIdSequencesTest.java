package io.tracedb.storage.setid;

import io.tracedb.core.StorageContractException;
import io.tracedb.storage.UIntSequence;
import io.tracedb.testutil.SetIdSequenceGenerator;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SetIdSequencesTest {

    @Test
    void acceptsConformingSequences() {
        assertThat(SetIdSequences.isValid(UIntSequence.wrap(new int[]{0, 0, 1, 1, 1, 4}))).isTrue();
        assertThat(SetIdSequences.isValid(UIntSequence.wrap(new int[0]))).isTrue();
        assertThatCode(() -> SetIdSequences.validate(UIntSequence.wrap(new int[]{0, 1, 2, 3})))
                .doesNotThrowAnyException();
    }

    @Test
    void generatedSequencesConform() {
        var generator = new SetIdSequenceGenerator(7);
        for (int round = 0; round < 20; round++) {
            int[] values = generator.generate(200, round / 20.0);
            int[] lagging = generator.generateLagging(200, round / 20.0);
            assertThat(SetIdSequences.isValid(UIntSequence.wrap(values))).isTrue();
            assertThat(SetIdSequences.isValid(UIntSequence.wrap(lagging))).isTrue();
        }
    }

    @Test
    void rejectsValueAboveRowPosition() {
        assertThatThrownBy(() -> SetIdSequences.validate(UIntSequence.wrap(new int[]{0, 2, 2})))
                .isInstanceOf(StorageContractException.class)
                .hasMessageContaining("row 1")
                .hasMessageContaining("exceeds");
    }

    @Test
    void rejectsDecreasingValue() {
        assertThatThrownBy(() -> SetIdSequences.validate(UIntSequence.wrap(new int[]{0, 1, 2, 1})))
                .isInstanceOf(StorageContractException.class)
                .hasMessageContaining("row 3")
                .hasMessageContaining("smaller");
    }

    @Test
    void firstRowMustBeZero() {
        assertThat(SetIdSequences.firstViolation(UIntSequence.wrap(new int[]{1}))).isZero();
    }
}
