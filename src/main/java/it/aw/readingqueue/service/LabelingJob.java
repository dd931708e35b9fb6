package it.aw.readingqueue.service;

import it.aw.readingqueue.model.ClusterLabel;
import it.aw.readingqueue.model.LabelState;

import java.time.Duration;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Etichettatura in corso di un insieme di cluster.
 * <p>
 * {@link #snapshot()} è consultabile in qualsiasi momento: i cluster non ancora
 * etichettati compaiono in stato {@link LabelState#PENDING}.
 */
public class LabelingJob {

    private final Map<Integer, ClusterLabel> labels = new ConcurrentHashMap<>();
    private final CompletableFuture<Void> completion;

    LabelingJob(List<Integer> clusterIds, List<CompletableFuture<ClusterLabel>> tasks) {
        for (Integer id : clusterIds) {
            labels.put(id, new ClusterLabel(id, null, null, LabelState.PENDING));
        }
        CompletableFuture<?>[] recorded = tasks.stream()
                .map(task -> task.thenAccept(label -> labels.put(label.clusterId(), label)))
                .toArray(CompletableFuture[]::new);
        this.completion = CompletableFuture.allOf(recorded);
    }

    public List<ClusterLabel> snapshot() {
        return labels.values().stream()
                .sorted(Comparator.comparingInt(ClusterLabel::clusterId))
                .toList();
    }

    public boolean isDone() {
        return completion.isDone();
    }

    /** Attende la fine di tutte le etichettature (i singoli fallimenti sono già ripiegati). */
    public List<ClusterLabel> await(Duration timeout) throws InterruptedException, TimeoutException {
        try {
            completion.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Etichettatura interrotta in modo inatteso", e.getCause());
        }
        return snapshot();
    }

    CompletableFuture<Void> completion() {
        return completion;
    }
}
