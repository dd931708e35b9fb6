package it.aw.readingqueue.service;

import it.aw.readingqueue.model.Item;
import it.aw.readingqueue.model.QueueEntry;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Comparator;
import java.util.List;

/**
 * Priorità di lettura: sigmoide dell'età dell'item pesata per l'expiry score.
 * <p>
 * {@code priority = 1 / (1 + exp(-K * ((days * expiry / BASE_PERIOD_DAYS) - 0.5)))}.
 * Con expiry massimo l'item raggiunge 0.5 dopo esattamente un periodo base.
 * Calcolata in lettura, mai salvata.
 * <p>
 * In double la sigmoide satura a 1.0 dopo poche settimane: l'ordinamento usa
 * quindi il suo argomento ({@link #urgency}), che è monotono e non satura.
 */
@Component
public class PriorityScorer {

    public static final double K = 5.0;
    public static final double BASE_PERIOD_DAYS = 3.0;

    private static final double SECONDS_PER_DAY = 86_400.0;

    public static double priority(double daysSinceAdded, double expiryScore) {
        return 1.0 / (1.0 + Math.exp(-K * urgency(daysSinceAdded, expiryScore)));
    }

    /** Argomento della sigmoide, centrato su 0: stesso ordine della priorità, senza saturazione. */
    public static double urgency(double daysSinceAdded, double expiryScore) {
        return (daysSinceAdded * expiryScore / BASE_PERIOD_DAYS) - 0.5;
    }

    /** Priorità dell'item a {@code now}; null se l'item non ha ancora un expiry score. */
    public Double priorityOf(Item item, LocalDateTime now) {
        Double urgency = urgencyOf(item, now);
        return urgency == null ? null : 1.0 / (1.0 + Math.exp(-K * urgency));
    }

    Double urgencyOf(Item item, LocalDateTime now) {
        if (item.expiryScore() == null || item.createdAt() == null) {
            return null;
        }
        double days = Math.max(0.0, Duration.between(item.createdAt(), now).toMillis() / 1000.0 / SECONDS_PER_DAY);
        return urgency(days, item.expiryScore());
    }

    /** Ordina per priorità decrescente; gli item senza priorità vanno in fondo, dal più recente. */
    public List<QueueEntry> rank(List<Item> items, LocalDateTime now) {
        return items.stream()
                .map(item -> new Ranked(item, urgencyOf(item, now)))
                .sorted(Comparator.comparing(Ranked::urgency, Comparator.nullsLast(Comparator.reverseOrder()))
                        .thenComparing(r -> r.item().createdAt(), Comparator.nullsLast(Comparator.reverseOrder())))
                .map(r -> new QueueEntry(r.item(), priorityOf(r.item(), now)))
                .toList();
    }

    /** Stesso calcolo di {@link #rank}, mantenendo l'ordine ricevuto. */
    public List<QueueEntry> annotate(List<Item> items, LocalDateTime now) {
        return items.stream()
                .map(item -> new QueueEntry(item, priorityOf(item, now)))
                .toList();
    }

    private record Ranked(Item item, Double urgency) {}
}
