package it.aw.readingqueue.service;

import it.aw.readingqueue.analysis.EmbeddingSpaceAnalyzer;
import it.aw.readingqueue.model.AnalysisParams;
import it.aw.readingqueue.model.AnalysisResult;
import it.aw.readingqueue.model.ClientStatus;
import it.aw.readingqueue.model.ClusterAssignment;
import it.aw.readingqueue.model.ClusterLabel;
import it.aw.readingqueue.model.ClusterMembers;
import it.aw.readingqueue.model.ClusteringMethod;
import it.aw.readingqueue.model.ItemFilter;
import it.aw.readingqueue.model.ItemSummary;
import it.aw.readingqueue.model.ItemVector;
import it.aw.readingqueue.model.ProjectionMethod;
import it.aw.readingqueue.registry.ItemStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.TimeoutException;

/**
 * Vista a grafo della coda: analisi dello spazio degli embedding sugli item
 * filtrati ed etichettatura dei cluster risultanti.
 * <p>
 * Niente cache: layout e cluster cambiano con l'appartenenza al filtro e si
 * ricalcolano a ogni richiesta.
 */
@Service
public class GraphService {

    private static final Logger log = LoggerFactory.getLogger(GraphService.class);

    private final ItemStore store;
    private final EmbeddingSpaceAnalyzer analyzer;
    private final ClusterLabeler labeler;
    private final Duration labelWait;

    public GraphService(ItemStore store,
                        EmbeddingSpaceAnalyzer analyzer,
                        ClusterLabeler labeler,
                        @Value("${app.labels.wait:PT20S}") Duration labelWait) {
        this.store = store;
        this.analyzer = analyzer;
        this.labeler = labeler;
        this.labelWait = labelWait;
    }

    public AnalysisResult analyze(String userId, Set<ClientStatus> statuses,
                                  ProjectionMethod projection, ClusteringMethod clustering,
                                  AnalysisParams params) {
        List<ItemVector> vectors = store.getItemVectors(userId, new ItemFilter(statuses, List.of()));
        return analyzer.analyze(vectors, projection, clustering, params);
    }

    /** Avvia l'etichettatura dei cluster (il rumore è escluso). */
    public LabelingJob startLabeling(String userId, List<ClusterAssignment> assignments) {
        return labeler.start(membersOf(userId, assignments));
    }

    /**
     * Etichetta i cluster attendendo al massimo {@code app.labels.wait}: i cluster
     * non ancora pronti tornano in stato PENDING.
     */
    public List<ClusterLabel> labels(String userId, List<ClusterAssignment> assignments) {
        LabelingJob job = startLabeling(userId, assignments);
        try {
            return job.await(labelWait);
        } catch (TimeoutException e) {
            log.warn("Etichettatura non completata entro {}: restituisco lo stato parziale", labelWait);
            return job.snapshot();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return job.snapshot();
        }
    }

    List<ClusterMembers> membersOf(String userId, List<ClusterAssignment> assignments) {
        Map<String, Integer> clusterOf = new HashMap<>();
        for (ClusterAssignment a : assignments) {
            if (a.isClustered()) clusterOf.put(a.itemId(), a.clusterId());
        }
        Map<Integer, List<String>> summaries = new TreeMap<>();
        for (int clusterId : clusterOf.values()) {
            summaries.putIfAbsent(clusterId, new ArrayList<>());
        }
        // le sintesi arrivano dalla più recente
        for (ItemSummary s : store.getItemSummaries(userId, clusterOf.keySet())) {
            summaries.get(clusterOf.get(s.itemId())).add(s.summary());
        }
        List<ClusterMembers> members = new ArrayList<>(summaries.size());
        summaries.forEach((id, list) -> members.add(new ClusterMembers(id, List.copyOf(list))));
        return members;
    }
}
