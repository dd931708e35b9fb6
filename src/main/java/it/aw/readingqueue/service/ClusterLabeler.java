package it.aw.readingqueue.service;

import dev.langchain4j.model.chat.request.json.JsonObjectSchema;
import dev.langchain4j.model.chat.request.json.JsonSchema;
import it.aw.readingqueue.config.MdcAwareExecutor;
import it.aw.readingqueue.error.ValidationException;
import it.aw.readingqueue.model.ClusterLabel;
import it.aw.readingqueue.model.ClusterMembers;
import it.aw.readingqueue.model.LabelData;
import it.aw.readingqueue.model.LabelState;
import it.aw.readingqueue.provider.CompletionProvider;
import it.aw.readingqueue.provider.StructuredOutputDecoder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeoutException;

/**
 * Etichetta i cluster a partire dalle sintesi dei loro membri.
 * <p>
 * Una richiesta LLM per cluster, eseguite in parallelo sul pool dedicato (concorrenza
 * limitata). Un cluster che fallisce riceve l'etichetta di ripiego senza bloccare gli altri.
 * Le sintesi passate al modello rispettano un budget di token: si tengono le più
 * recenti e si scartano le più vecchie.
 */
@Service
public class ClusterLabeler {

    private static final Logger log = LoggerFactory.getLogger(ClusterLabeler.class);

    static final int CHARS_PER_TOKEN = 4;
    static final int MAX_LABEL_LENGTH = 48;

    static final String SYSTEM_PROMPT = """
            You are a data labeler for clusters of items. \
            You will be provided the summaries of one cluster's contents and must provide \
            a 1-2 word label of this cluster's content. Look for a broader theme where possible.""";

    static final JsonSchema SCHEMA = JsonSchema.builder()
            .name("LabelData")
            .rootElement(JsonObjectSchema.builder()
                    .addStringProperty("label", "1-2 word label for the cluster")
                    .required("label")
                    .build())
            .build();

    private final CompletionProvider completionProvider;
    private final StructuredOutputDecoder decoder;
    private final Executor executor;
    private final int maxSummaryTokens;
    private final String fallbackLabel;

    public ClusterLabeler(CompletionProvider completionProvider,
                          StructuredOutputDecoder decoder,
                          @Qualifier("labelExecutor") ExecutorService labelExecutor,
                          @Value("${app.labels.max-summary-tokens:2000}") int maxSummaryTokens,
                          @Value("${app.labels.fallback:Unlabeled}") String fallbackLabel) {
        this.completionProvider = completionProvider;
        this.decoder = decoder;
        this.executor = new MdcAwareExecutor(labelExecutor);
        this.maxSummaryTokens = maxSummaryTokens;
        this.fallbackLabel = fallbackLabel;
    }

    /** Avvia l'etichettatura e restituisce subito il job, con tutti i cluster in attesa. */
    public LabelingJob start(List<ClusterMembers> clusters) {
        List<Integer> ids = new ArrayList<>(clusters.size());
        List<CompletableFuture<ClusterLabel>> tasks = new ArrayList<>(clusters.size());
        for (ClusterMembers cluster : clusters) {
            ids.add(cluster.clusterId());
            tasks.add(CompletableFuture
                    .supplyAsync(() -> labelOne(cluster), executor)
                    .exceptionally(ex -> {
                        log.warn("Etichettatura del cluster {} fallita, uso '{}': {}",
                                cluster.clusterId(), fallbackLabel, ex.getMessage());
                        return fallback(cluster.clusterId());
                    }));
        }
        log.info("Etichettatura avviata per {} cluster", clusters.size());
        return new LabelingJob(ids, tasks);
    }

    /** Etichetta tutti i cluster e attende il risultato. */
    public List<ClusterLabel> label(List<ClusterMembers> clusters, Duration timeout)
            throws InterruptedException, TimeoutException {
        return start(clusters).await(timeout);
    }

    ClusterLabel labelOne(ClusterMembers cluster) {
        List<String> summaries = withinBudget(cluster.memberSummaries());
        if (summaries.isEmpty()) {
            log.debug("Cluster {} senza sintesi: etichetta di ripiego", cluster.clusterId());
            return fallback(cluster.clusterId());
        }
        StringBuilder prompt = new StringBuilder("Cluster summaries:\n");
        for (int i = 0; i < summaries.size(); i++) {
            prompt.append(i + 1).append(". ").append(summaries.get(i)).append('\n');
        }
        String raw = completionProvider.complete(SYSTEM_PROMPT, prompt.toString(), SCHEMA);
        String label = clean(decoder.decode(raw, LabelData.class).label());
        log.debug("Cluster {} etichettato '{}' ({} sintesi)", cluster.clusterId(), label, summaries.size());
        return new ClusterLabel(cluster.clusterId(), label, ClusterColors.forLabel(label), LabelState.LABELED);
    }

    /**
     * Sintesi dalla più recente, finché il budget lo consente. La prima viene sempre
     * inclusa, troncata se da sola supera il budget.
     */
    List<String> withinBudget(List<String> newestFirst) {
        int budgetChars = maxSummaryTokens * CHARS_PER_TOKEN;
        List<String> kept = new ArrayList<>();
        int used = 0;
        for (String summary : newestFirst) {
            if (summary == null || summary.isBlank()) {
                continue;
            }
            String s = summary.strip();
            if (kept.isEmpty() && s.length() > budgetChars) {
                kept.add(s.substring(0, budgetChars));
                break;
            }
            if (used + s.length() > budgetChars) {
                break;
            }
            kept.add(s);
            used += s.length();
        }
        return kept;
    }

    private String clean(String label) {
        if (label == null || label.isBlank()) {
            throw new ValidationException("Etichetta vuota nella risposta del modello");
        }
        String s = label.strip().replaceAll("\\s+", " ");
        return s.length() > MAX_LABEL_LENGTH ? s.substring(0, MAX_LABEL_LENGTH).strip() : s;
    }

    ClusterLabel fallback(int clusterId) {
        return new ClusterLabel(clusterId, fallbackLabel, ClusterColors.NEUTRAL, LabelState.FALLBACK);
    }
}
