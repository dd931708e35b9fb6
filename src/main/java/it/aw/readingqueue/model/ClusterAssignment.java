package it.aw.readingqueue.model;

/**
 * Cluster di appartenenza di un item. Gli id sono validi solo nella richiesta
 * che li ha prodotti: non identificano un tema stabile tra ricalcoli successivi.
 */
public record ClusterAssignment(String itemId, int clusterId) {

    public static final int UNCLUSTERED = -1;

    public boolean isClustered() {
        return clusterId != UNCLUSTERED;
    }
}
