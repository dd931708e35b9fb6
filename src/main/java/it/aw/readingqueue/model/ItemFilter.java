package it.aw.readingqueue.model;

import java.util.List;
import java.util.Set;

/**
 * Filtro sugli item di un utente. Insiemi vuoti significano "nessun vincolo".
 */
public record ItemFilter(Set<ClientStatus> statuses, List<String> itemIds) {

    public ItemFilter {
        statuses = statuses == null ? Set.of() : Set.copyOf(statuses);
        itemIds  = itemIds  == null ? List.of() : List.copyOf(itemIds);
    }

    public static ItemFilter all() {
        return new ItemFilter(Set.of(), List.of());
    }

    public static ItemFilter ofStatus(ClientStatus... statuses) {
        return new ItemFilter(Set.of(statuses), List.of());
    }

    public static ItemFilter ofIds(List<String> itemIds) {
        return new ItemFilter(Set.of(), itemIds);
    }
}
