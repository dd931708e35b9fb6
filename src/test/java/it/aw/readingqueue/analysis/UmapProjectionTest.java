package it.aw.readingqueue.analysis;

import it.aw.readingqueue.model.AnalysisParams;
import it.aw.readingqueue.model.ItemVector;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class UmapProjectionTest {

    private final TsneProjection tsne = new TsneProjection();
    private final UmapProjection umap = new UmapProjection(new PcaProjection(), tsne);

    @Test
    @DisplayName("neighbors: default min(15, n-1), sempre in [2, n-1]")
    void neighbors() {
        assertThat(UmapProjection.neighborsFor(100, null)).isEqualTo(15);
        assertThat(UmapProjection.neighborsFor(6, null)).isEqualTo(5);
        assertThat(UmapProjection.neighborsFor(6, 40)).isEqualTo(5);
        assertThat(UmapProjection.neighborsFor(3, null)).isEqualTo(2);
    }

    @Test
    @DisplayName("curva con minDist 0.1: a e b vicini ai valori di riferimento (1.58, 0.90)")
    void curveFit() {
        double[] ab = UmapProjection.fitCurve(1.0, 0.1);
        assertThat(ab[0]).isCloseTo(1.58, within(0.15));
        assertThat(ab[1]).isCloseTo(0.90, within(0.05));
    }

    @Test
    @DisplayName("grafo fuzzy simmetrico con pesi in [0, 1]")
    void fuzzyGraph() {
        double[][] dist = VectorMath.cosineDistances(Vectors.rows(Vectors.groups(2, 4, 5L)));
        double[][] graph = UmapProjection.fuzzyGraph(dist, 3);
        for (int i = 0; i < graph.length; i++) {
            for (int j = 0; j < graph.length; j++) {
                assertThat(graph[i][j]).isBetween(0.0, 1.0).isCloseTo(graph[j][i], within(1e-12));
            }
        }
    }

    @Test
    @DisplayName("meno di 3 item: stesso risultato di t-SNE")
    void fallsBackToTsne() {
        double[][] rows = {{1, 0}, {0, 1}};
        AnalysisParams params = AnalysisParams.defaults().seeded(1L);
        assertThat(umap.project(rows, params)).isDeepEqualTo(tsne.project(rows, params));
    }

    @Test
    @DisplayName("con seme fissato il layout è riproducibile e separa i gruppi")
    void seededLayout() {
        List<ItemVector> items = Vectors.groups(3, 5, 21L);
        double[][] rows = Vectors.rows(items);
        AnalysisParams params = AnalysisParams.defaults().seeded(99L);

        double[][] first = umap.project(rows, params);
        assertThat(first).isDeepEqualTo(umap.project(rows, params));
        assertThat(Layouts.allFinite(first)).isTrue();
        assertThat(Layouts.separation(items, first)).isGreaterThan(1.5);
    }
}
