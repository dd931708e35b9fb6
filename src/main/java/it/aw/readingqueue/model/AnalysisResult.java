package it.aw.readingqueue.model;

import java.util.List;

/**
 * Layout e partizione calcolati sullo stesso insieme di item, nello stesso ordine.
 */
public record AnalysisResult(
        ProjectionMethod        projection,
        ClusteringMethod        clustering,
        List<Coordinate>        coordinates,
        List<ClusterAssignment> assignments
) {
    public long clusterCount() {
        return assignments.stream()
                .filter(ClusterAssignment::isClustered)
                .map(ClusterAssignment::clusterId)
                .distinct()
                .count();
    }
}
