package it.aw.readingqueue.provider;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class OnnxCrossEncoderScoringModelTest {

    @Test
    @DisplayName("padding: righe allineate alla più lunga, completate con zeri")
    void pad() {
        long[][] padded = OnnxCrossEncoderScoringModel.pad(List.of(new long[]{101, 7, 102}, new long[]{101, 102}));

        assertThat(padded[0]).containsExactly(101, 7, 102);
        assertThat(padded[1]).containsExactly(101, 102, 0);
    }

    @Test
    @DisplayName("logit singolo: sigmoide")
    void singleLogit() {
        assertThat(OnnxCrossEncoderScoringModel.relevance(new float[]{0f})).isCloseTo(0.5, within(1e-12));
        assertThat(OnnxCrossEncoderScoringModel.relevance(new float[]{4f})).isGreaterThan(0.98);
        assertThat(OnnxCrossEncoderScoringModel.relevance(new float[]{-4f})).isLessThan(0.02);
    }

    @Test
    @DisplayName("più classi: probabilità softmax dell'ultima")
    void softmaxHead() {
        assertThat(OnnxCrossEncoderScoringModel.relevance(new float[]{1f, 1f})).isCloseTo(0.5, within(1e-12));
        assertThat(OnnxCrossEncoderScoringModel.relevance(new float[]{-2f, 3f}))
                .isCloseTo(Math.exp(5) / (1 + Math.exp(5)), within(1e-9));
    }

    @Test
    @DisplayName("uscita [batch, 1] e uscita appiattita danno gli stessi punteggi")
    void outputShapes() {
        List<Double> matrix = OnnxCrossEncoderScoringModel.scores(new float[][]{{0f}, {2f}});
        List<Double> flat = OnnxCrossEncoderScoringModel.scores(new float[]{0f, 2f});

        assertThat(matrix).hasSize(2).isEqualTo(flat);
        assertThat(matrix.get(1)).isGreaterThan(matrix.get(0));
        assertThatThrownBy(() -> OnnxCrossEncoderScoringModel.scores(new long[]{1}))
                .isInstanceOf(IllegalStateException.class);
    }
}
