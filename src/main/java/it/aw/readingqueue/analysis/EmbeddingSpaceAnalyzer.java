package it.aw.readingqueue.analysis;

import it.aw.readingqueue.error.InsufficientDataException;
import it.aw.readingqueue.error.ValidationException;
import it.aw.readingqueue.model.AnalysisParams;
import it.aw.readingqueue.model.AnalysisResult;
import it.aw.readingqueue.model.ClusterAssignment;
import it.aw.readingqueue.model.ClusteringMethod;
import it.aw.readingqueue.model.Coordinate;
import it.aw.readingqueue.model.ItemVector;
import it.aw.readingqueue.model.ProjectionMethod;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Analisi dello spazio degli embedding: layout 2D e partizione dello stesso
 * insieme di item.
 * <p>
 * Valida parametri e dimensione dell'input, normalizza L2 i vettori e delega
 * agli algoritmi. Ogni chiamata ricalcola da zero: nessuno stato tra richieste.
 */
@Component
public class EmbeddingSpaceAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(EmbeddingSpaceAnalyzer.class);

    public static final int    MIN_CLUSTERS = 2;
    public static final int    MAX_CLUSTERS = 24;
    public static final int    DEFAULT_CLUSTERS = 5;
    public static final double MIN_EPS = DbscanClustering.MIN_EPS;
    public static final double MAX_EPS = DbscanClustering.MAX_EPS;

    private final Map<ProjectionMethod, Projection> projections = new EnumMap<>(ProjectionMethod.class);
    private final Map<ClusteringMethod, Clusterer> clusterers = new EnumMap<>(ClusteringMethod.class);

    public EmbeddingSpaceAnalyzer(List<Projection> projections, List<Clusterer> clusterers) {
        projections.forEach(p -> this.projections.put(p.method(), p));
        clusterers.forEach(c -> this.clusterers.put(c.method(), c));
    }

    public AnalysisResult analyze(List<ItemVector> items, ProjectionMethod projection,
                                  ClusteringMethod clustering, AnalysisParams params) {
        AnalysisParams resolved = resolve(items.size(), clustering, params);
        double[][] rows = normalize(items);
        List<Coordinate> coordinates = toCoordinates(items, projectionFor(projection).project(rows, resolved));
        List<ClusterAssignment> assignments = toAssignments(items, clustererFor(clustering).cluster(rows, resolved));
        log.info("Analisi {} + {} su {} item", projection, clustering, items.size());
        return new AnalysisResult(projection, clustering, coordinates, assignments);
    }

    public List<Coordinate> project(List<ItemVector> items, ProjectionMethod projection, AnalysisParams params) {
        AnalysisParams resolved = resolve(items.size(), null, params);
        double[][] rows = normalize(items);
        return toCoordinates(items, projectionFor(projection).project(rows, resolved));
    }

    public List<ClusterAssignment> cluster(List<ItemVector> items, ClusteringMethod clustering, AnalysisParams params) {
        AnalysisParams resolved = resolve(items.size(), clustering, params);
        double[][] rows = normalize(items);
        return toAssignments(items, clustererFor(clustering).cluster(rows, resolved));
    }

    /** Valida i parametri e risolve il numero di cluster in base alla dimensione dell'input. */
    AnalysisParams resolve(int n, ClusteringMethod clustering, AnalysisParams params) {
        AnalysisParams p = params != null ? params : AnalysisParams.defaults();
        if (p.clusterCount() != null && (p.clusterCount() < MIN_CLUSTERS || p.clusterCount() > MAX_CLUSTERS)) {
            throw new ValidationException("Numero di cluster fuori da [" + MIN_CLUSTERS + ", " + MAX_CLUSTERS
                    + "]: " + p.clusterCount());
        }
        if (p.eps() != null && (p.eps().isNaN() || p.eps() < MIN_EPS || p.eps() > MAX_EPS)) {
            throw new ValidationException("eps fuori da [" + MIN_EPS + ", " + MAX_EPS + "]: " + p.eps());
        }
        if (p.minSamples() != null && p.minSamples() < 1) {
            throw new ValidationException("minSamples deve essere >= 1: " + p.minSamples());
        }
        if (p.perplexity() != null && !(p.perplexity() > 0)) {
            throw new ValidationException("perplexity deve essere > 0: " + p.perplexity());
        }
        if (p.neighbors() != null && p.neighbors() < 2) {
            throw new ValidationException("neighbors deve essere >= 2: " + p.neighbors());
        }
        if (p.minDist() != null && !(p.minDist() >= 0 && p.minDist() <= 1)) {
            throw new ValidationException("minDist fuori da [0, 1]: " + p.minDist());
        }

        if (n < 2) {
            throw new InsufficientDataException("Servono almeno 2 item per l'analisi, ricevuti " + n);
        }
        boolean countBased = clustering == ClusteringMethod.KMEANS || clustering == ClusteringMethod.HIERARCHICAL;
        if (!countBased) {
            return p;
        }
        if (p.clusterCount() == null) {
            int k = Math.max(MIN_CLUSTERS, Math.min(DEFAULT_CLUSTERS, n));
            return new AnalysisParams(k, p.eps(), p.minSamples(), p.perplexity(), p.neighbors(), p.minDist(), p.seed());
        }
        if (n < p.clusterCount()) {
            throw new InsufficientDataException("Richiesti " + p.clusterCount() + " cluster ma ci sono solo "
                    + n + " item");
        }
        return p;
    }

    private Projection projectionFor(ProjectionMethod method) {
        Projection projection = projections.get(method);
        if (projection == null) {
            throw new ValidationException("Proiezione non supportata: " + method);
        }
        return projection;
    }

    private Clusterer clustererFor(ClusteringMethod method) {
        Clusterer clusterer = clusterers.get(method);
        if (clusterer == null) {
            throw new ValidationException("Clustering non supportato: " + method);
        }
        return clusterer;
    }

    private static double[][] normalize(List<ItemVector> items) {
        List<float[]> vectors = new ArrayList<>(items.size());
        for (ItemVector item : items) {
            if (item.vector() == null || item.vector().length == 0) {
                throw new ValidationException("Item senza embedding: " + item.itemId());
            }
            if (!vectors.isEmpty() && vectors.get(0).length != item.vector().length) {
                throw new ValidationException("Embedding di dimensione diversa per l'item " + item.itemId());
            }
            vectors.add(item.vector());
        }
        return VectorMath.normalizeRows(vectors);
    }

    private static List<Coordinate> toCoordinates(List<ItemVector> items, double[][] xy) {
        List<Coordinate> out = new ArrayList<>(items.size());
        for (int i = 0; i < items.size(); i++) {
            out.add(Coordinate.of(items.get(i).itemId(), xy[i][0], xy[i][1]));
        }
        return out;
    }

    private static List<ClusterAssignment> toAssignments(List<ItemVector> items, int[] labels) {
        List<ClusterAssignment> out = new ArrayList<>(items.size());
        for (int i = 0; i < items.size(); i++) {
            out.add(new ClusterAssignment(items.get(i).itemId(), labels[i]));
        }
        return out;
    }
}
