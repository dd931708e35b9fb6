package it.aw.readingqueue.analysis;

import it.aw.readingqueue.model.AnalysisParams;
import it.aw.readingqueue.model.ProjectionMethod;
import org.ejml.data.DMatrixRMaj;
import org.ejml.dense.row.decomposition.svd.SafeSvd_DDRM;
import org.ejml.dense.row.factory.DecompositionFactory_DDRM;
import org.ejml.interfaces.decomposition.SingularValueDecomposition_F64;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.stream.IntStream;

/**
 * PCA deterministica sulle prime due componenti principali.
 * <p>
 * SVD compatta (EJML) della matrice n×d dei vettori centrati: le coordinate sono
 * le colonne di U moltiplicate per il valore singolare corrispondente. Segno fissato
 * come svd_flip: in ogni colonna di U la componente di modulo massimo è positiva.
 */
@Component
public class PcaProjection implements Projection {

    private static final double SINGULAR_EPSILON = 1e-9;

    @Override
    public ProjectionMethod method() {
        return ProjectionMethod.PCA;
    }

    @Override
    public double[][] project(double[][] rows, AnalysisParams params) {
        return project(rows, 2);
    }

    public double[][] project(double[][] rows, int components) {
        int n = rows.length;
        DMatrixRMaj centered = center(rows);
        double[][] out = new double[n][components];

        SingularValueDecomposition_F64<DMatrixRMaj> svd =
                new SafeSvd_DDRM(DecompositionFactory_DDRM.svd(true, false, true));
        if (!svd.decompose(centered)) {
            throw new IllegalStateException("SVD non convergente su " + n + " vettori");
        }
        DMatrixRMaj u = svd.getU(null, false);
        double[] singular = svd.getSingularValues();
        int[] order = IntStream.range(0, svd.numberOfSingularValues())
                .boxed()
                .sorted(Comparator.comparingDouble((Integer k) -> singular[k]).reversed())
                .mapToInt(Integer::intValue)
                .toArray();

        for (int c = 0; c < Math.min(components, order.length); c++) {
            int k = order[c];
            double s = singular[k];
            if (s <= SINGULAR_EPSILON) {
                break;
            }
            double sign = flipSign(u, k);
            for (int i = 0; i < n; i++) {
                out[i][c] = sign * u.get(i, k) * s;
            }
        }
        return out;
    }

    private static DMatrixRMaj center(double[][] rows) {
        int n = rows.length;
        int d = rows[0].length;
        double[] mean = new double[d];
        for (double[] row : rows) {
            for (int k = 0; k < d; k++) mean[k] += row[k] / n;
        }
        DMatrixRMaj centered = new DMatrixRMaj(n, d);
        for (int i = 0; i < n; i++) {
            for (int k = 0; k < d; k++) centered.set(i, k, rows[i][k] - mean[k]);
        }
        return centered;
    }

    /** -1 se la componente di modulo massimo della colonna è negativa. */
    private static double flipSign(DMatrixRMaj u, int column) {
        int maxRow = 0;
        for (int i = 1; i < u.numRows; i++) {
            if (Math.abs(u.get(i, column)) > Math.abs(u.get(maxRow, column))) maxRow = i;
        }
        return u.get(maxRow, column) < 0 ? -1.0 : 1.0;
    }
}
