package it.aw.readingqueue.analysis;

import it.aw.readingqueue.model.ItemVector;

import java.util.List;

final class Layouts {

    private Layouts() {
    }

    /** Rapporto tra distanza media fra gruppi diversi e distanza media nello stesso gruppo. */
    static double separation(List<ItemVector> items, double[][] xy) {
        double intra = 0, inter = 0;
        int nIntra = 0, nInter = 0;
        for (int i = 0; i < xy.length; i++) {
            for (int j = i + 1; j < xy.length; j++) {
                double d = Math.hypot(xy[i][0] - xy[j][0], xy[i][1] - xy[j][1]);
                if (Vectors.groupOf(items.get(i).itemId()) == Vectors.groupOf(items.get(j).itemId())) {
                    intra += d;
                    nIntra++;
                } else {
                    inter += d;
                    nInter++;
                }
            }
        }
        return (inter / nInter) / (intra / nIntra);
    }

    static boolean allFinite(double[][] xy) {
        for (double[] p : xy) {
            if (!Double.isFinite(p[0]) || !Double.isFinite(p[1])) return false;
        }
        return true;
    }
}
