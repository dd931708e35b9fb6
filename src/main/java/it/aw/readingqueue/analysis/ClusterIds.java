package it.aw.readingqueue.analysis;

import it.aw.readingqueue.model.ClusterAssignment;

import java.util.HashMap;
import java.util.Map;

final class ClusterIds {

    private ClusterIds() {
    }

    /**
     * Rinumera le etichette in id compatti da 0, in ordine di prima apparizione.
     * Il rumore resta {@link ClusterAssignment#UNCLUSTERED}; i cluster vuoti spariscono.
     */
    static int[] compact(int[] labels) {
        Map<Integer, Integer> mapping = new HashMap<>();
        int[] out = new int[labels.length];
        for (int i = 0; i < labels.length; i++) {
            if (labels[i] == ClusterAssignment.UNCLUSTERED) {
                out[i] = ClusterAssignment.UNCLUSTERED;
            } else {
                out[i] = mapping.computeIfAbsent(labels[i], l -> mapping.size());
            }
        }
        return out;
    }
}
