package it.aw.readingqueue.service;

import it.aw.readingqueue.error.NotFoundException;
import it.aw.readingqueue.error.ValidationException;
import it.aw.readingqueue.model.ClientStatus;
import it.aw.readingqueue.model.Item;
import it.aw.readingqueue.model.ItemFilter;
import it.aw.readingqueue.model.QueueEntry;
import it.aw.readingqueue.model.ServerStatus;
import it.aw.readingqueue.model.StoreStats;
import it.aw.readingqueue.provider.EmbeddingProvider;
import it.aw.readingqueue.registry.ItemStore;
import it.aw.readingqueue.registry.LexicalIndex;
import it.aw.readingqueue.registry.VectorIndex;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.mockito.ArgumentCaptor;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ItemServiceTest {

    private final ItemStore store = mock(ItemStore.class);
    private final LexicalIndex lexicalIndex = mock(LexicalIndex.class);
    private final VectorIndex vectorIndex = mock(VectorIndex.class);
    private final EmbeddingProvider embeddingProvider = mock(EmbeddingProvider.class);
    private final ItemService service =
            new ItemService(store, lexicalIndex, vectorIndex, new PriorityScorer(), embeddingProvider);

    @Nested
    @DisplayName("coda")
    class Queue {

        private final LocalDateTime now = LocalDateTime.now();
        private final Item fresh = Items.classified("fresh", "Nuovo", "s", 0.2, now.minusHours(1));
        private final Item urgent = Items.classified("urgent", "Urgente", "s", 1.0, now.minusDays(3));
        private final Item pending = Items.withStatus(
                Items.classified("pending", "Senza score", null, null, now), ClientStatus.QUEUED,
                ServerStatus.EXTRACTED, null);

        @Test
        @DisplayName("ordine per data: quello restituito dallo store, con priorità annotata")
        void byCreated() {
            when(store.listItems(eq("u1"), any())).thenReturn(List.of(fresh, urgent, pending));

            List<QueueEntry> queue = service.list("u1", Set.of(ClientStatus.QUEUED), ItemService.QueueOrder.CREATED);

            assertThat(queue).extracting(e -> e.item().id()).containsExactly("fresh", "urgent", "pending");
            assertThat(queue.get(0).priority()).isNotNull();
            assertThat(queue.get(2).priority()).isNull();
        }

        @Test
        @DisplayName("ordine per priorità: decrescente, senza score in fondo")
        void byPriority() {
            when(store.listItems(eq("u1"), any())).thenReturn(List.of(pending, fresh, urgent));

            List<QueueEntry> queue = service.list("u1", Set.of(), ItemService.QueueOrder.PRIORITY);

            assertThat(queue).extracting(e -> e.item().id()).containsExactly("urgent", "fresh", "pending");
            assertThat(queue.get(0).priority()).isGreaterThan(queue.get(1).priority());
        }

        @Test
        @DisplayName("il filtro sugli stati arriva allo store")
        void statusFilterForwarded() {
            when(store.listItems(eq("u1"), any())).thenReturn(List.of());

            service.list("u1", Set.of(ClientStatus.PAUSED, ClientStatus.BOOKMARK), ItemService.QueueOrder.CREATED);

            ArgumentCaptor<ItemFilter> filter = ArgumentCaptor.forClass(ItemFilter.class);
            verify(store).listItems(eq("u1"), filter.capture());
            assertThat(filter.getValue().statuses()).containsExactlyInAnyOrder(ClientStatus.PAUSED, ClientStatus.BOOKMARK);
            assertThat(filter.getValue().itemIds()).isEmpty();
        }
    }

    @Nested
    @DisplayName("dettaglio e cancellazione")
    class DetailAndDelete {

        @Test
        @DisplayName("item inesistente: NotFound")
        void missing() {
            when(store.findItem("u1", "x")).thenReturn(Optional.empty());

            assertThatThrownBy(() -> service.get("u1", "x")).isInstanceOf(NotFoundException.class);
        }

        @Test
        @DisplayName("cancellazione: rimosso anche dagli indici lessicale e semantico")
        void delete() {
            when(store.deleteItem("u1", "a")).thenReturn(true);

            service.delete("u1", "a");

            verify(lexicalIndex).removeItem("u1", "a");
            verify(vectorIndex).removeItem("u1", "a");
        }

        @Test
        @DisplayName("cancellazione di un item inesistente: NotFound, indice intatto")
        void deleteMissing() {
            when(store.deleteItem("u1", "a")).thenReturn(false);

            assertThatThrownBy(() -> service.delete("u1", "a")).isInstanceOf(NotFoundException.class);
            verify(lexicalIndex, never()).removeItem(anyString(), anyString());
            verify(vectorIndex, never()).removeItem(anyString(), anyString());
        }
    }

    @Nested
    @DisplayName("cambio di stato")
    class StatusChange {

        @ParameterizedTest
        @EnumSource(value = ClientStatus.class, names = {"QUEUED", "PAUSED", "COMPLETED", "BOOKMARK"})
        @DisplayName("stati impostabili dall'utente")
        void allowed(ClientStatus status) {
            Item item = Items.classified("a", "T", "s", 0.5, Items.NOW);
            when(store.updateClientStatus("u1", "a", status)).thenReturn(true);
            when(store.findItem("u1", "a")).thenReturn(Optional.of(item));

            QueueEntry entry = service.updateStatus("u1", "a", status);

            assertThat(entry.item().id()).isEqualTo("a");
            verify(store).updateClientStatus("u1", "a", status);
        }

        @ParameterizedTest
        @EnumSource(value = ClientStatus.class, names = {"ADDING", "ERROR"})
        @DisplayName("adding ed error sono riservati alla pipeline")
        void reserved(ClientStatus status) {
            assertThatThrownBy(() -> service.updateStatus("u1", "a", status)).isInstanceOf(ValidationException.class);
            verify(store, never()).updateClientStatus(anyString(), anyString(), any());
        }

        @Test
        @DisplayName("item inesistente: NotFound")
        void missing() {
            when(store.updateClientStatus("u1", "a", ClientStatus.PAUSED)).thenReturn(false);

            assertThatThrownBy(() -> service.updateStatus("u1", "a", ClientStatus.PAUSED))
                    .isInstanceOf(NotFoundException.class);
        }
    }

    @Test
    @DisplayName("statistiche: contatori dello store e modello di embedding")
    void stats() {
        when(store.totalItems()).thenReturn(3);
        when(store.embeddedItems()).thenReturn(2);
        when(store.totalChunks()).thenReturn(7);
        when(embeddingProvider.modelName()).thenReturn("all-minilm-l6-v2-q");

        StoreStats stats = service.stats();

        assertThat(stats.totalItems()).isEqualTo(3);
        assertThat(stats.embeddedItems()).isEqualTo(2);
        assertThat(stats.totalChunks()).isEqualTo(7);
        assertThat(stats.embeddingModel()).isEqualTo("all-minilm-l6-v2-q");
    }
}
