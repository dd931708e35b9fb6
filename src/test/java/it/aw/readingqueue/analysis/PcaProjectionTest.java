package it.aw.readingqueue.analysis;

import it.aw.readingqueue.model.AnalysisParams;
import it.aw.readingqueue.model.ItemVector;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class PcaProjectionTest {

    private final PcaProjection pca = new PcaProjection();

    @Test
    @DisplayName("punti allineati: tutta la varianza sulla prima componente")
    void collinearPoints() {
        double[][] rows = {{0, 0, 0}, {1, 1, 0}, {2, 2, 0}, {3, 3, 0}};
        double[][] xy = pca.project(rows, AnalysisParams.defaults());

        for (double[] p : xy) {
            assertThat(p[1]).isCloseTo(0.0, within(1e-6));
        }
        // distanze preservate lungo la componente principale
        assertThat(Math.abs(xy[3][0] - xy[0][0])).isCloseTo(3 * Math.sqrt(2), within(1e-6));
        // coordinate centrate
        double sum = 0;
        for (double[] p : xy) sum += p[0];
        assertThat(sum).isCloseTo(0.0, within(1e-9));
    }

    @Test
    @DisplayName("deterministica: due chiamate danno lo stesso layout")
    void deterministic() {
        double[][] rows = Vectors.rows(Vectors.groups(3, 4, 2L));
        assertThat(pca.project(rows, AnalysisParams.defaults()))
                .isDeepEqualTo(pca.project(rows, AnalysisParams.defaults()));
    }

    @Test
    @DisplayName("segno fissato: la componente di modulo massimo è positiva")
    void signConvention() {
        double[][] rows = {{0, 0}, {0, 0}, {10, 0}};
        double[][] xy = pca.project(rows, 1);
        assertThat(xy[2][0]).isPositive();
    }

    @Test
    @DisplayName("gruppi separati restano separati nel piano")
    void separatesGroups() {
        List<ItemVector> items = Vectors.groups(3, 5, 4L);
        double[][] xy = pca.project(Vectors.rows(items), AnalysisParams.defaults());
        assertThat(Layouts.separation(items, xy)).isGreaterThan(5.0);
    }

    @Test
    @DisplayName("componenti in ordine di varianza decrescente")
    void componentsOrderedByVariance() {
        // varianza lungo z molto maggiore che lungo x
        double[][] rows = {{1, 0, -10}, {-1, 0, 10}, {0.5, 0, 5}, {-0.5, 0, -5}};
        double[][] xy = pca.project(rows, AnalysisParams.defaults());

        double var0 = 0;
        double var1 = 0;
        for (double[] p : xy) {
            var0 += p[0] * p[0];
            var1 += p[1] * p[1];
        }
        assertThat(var0).isGreaterThan(var1);
        assertThat(var0 + var1).isCloseTo(1 + 1 + 0.25 + 0.25 + 100 + 100 + 25 + 25, within(1e-6));
    }

    @Test
    @DisplayName("input identici: coordinate nulle invece di NaN")
    void degenerateInput() {
        double[][] rows = {{1, 0}, {1, 0}};
        double[][] xy = pca.project(rows, AnalysisParams.defaults());
        assertThat(xy[0]).containsExactly(0.0, 0.0);
        assertThat(xy[1]).containsExactly(0.0, 0.0);
    }
}
