package it.aw.readingqueue.registry;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import it.aw.readingqueue.error.ConflictException;
import it.aw.readingqueue.error.NotFoundException;
import it.aw.readingqueue.model.ArticleContent;
import it.aw.readingqueue.model.ChunkEmbedding;
import it.aw.readingqueue.model.ChunkVector;
import it.aw.readingqueue.model.ClientStatus;
import it.aw.readingqueue.model.IndexedText;
import it.aw.readingqueue.model.IndexedVector;
import it.aw.readingqueue.model.Item;
import it.aw.readingqueue.model.ItemFilter;
import it.aw.readingqueue.model.ItemSummary;
import it.aw.readingqueue.model.ItemVector;
import it.aw.readingqueue.model.ServerStatus;
import it.aw.readingqueue.model.SummaryData;
import it.aw.readingqueue.model.Vectorization;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Registro degli item, persistito su DuckDB nelle tabelle {@code items},
 * {@code item_chunks} e {@code item_keys}.
 * <p>
 * Un'unica connessione JDBC è condivisa da tutte le operazioni; l'accesso
 * è sincronizzato per garantire la thread-safety (DuckDBConnection non è thread-safe).
 * <p>
 * Deduplica: {@code items(user_id, url)} è unico; l'URL canonico è riservato in
 * {@code item_keys}, la cui chiave primaria serializza le ingestioni concorrenti
 * dello stesso articolo. I vettori sono salvati come array JSON in colonne VARCHAR.
 * <p>
 * {@code item_chunks} non ha vincoli di unicità: DuckDB verifica i vincoli prima
 * della fine della transazione e rifiuterebbe delete + insert della stessa chiave.
 * L'unicità di (item, posizione) è garantita dalla sostituzione transazionale.
 */
@Component
public class ItemRegistry implements ItemStore {

    private static final Logger log = LoggerFactory.getLogger(ItemRegistry.class);

    private static final String CREATE_ITEMS = """
            CREATE TABLE IF NOT EXISTS items (
                id               VARCHAR   PRIMARY KEY,
                user_id          VARCHAR   NOT NULL,
                url              VARCHAR   NOT NULL,
                canonical_url    VARCHAR,
                title            VARCHAR,
                source_site      VARCHAR,
                publication_date TIMESTAMP,
                favicon_url      VARCHAR,
                content_text     VARCHAR,
                content_markdown VARCHAR,
                token_count      INTEGER,
                client_status    VARCHAR   NOT NULL,
                server_status    VARCHAR   NOT NULL,
                summary          VARCHAR,
                expiry_score     DOUBLE,
                error_message    VARCHAR,
                embedding        VARCHAR,
                created_at       TIMESTAMP NOT NULL,
                client_status_at TIMESTAMP,
                server_status_at TIMESTAMP,
                UNIQUE (user_id, url)
            )
            """;

    private static final String CREATE_CHUNKS = """
            CREATE TABLE IF NOT EXISTS item_chunks (
                item_id      VARCHAR   NOT NULL,
                user_id      VARCHAR   NOT NULL,
                position     INTEGER   NOT NULL,
                content      VARCHAR   NOT NULL,
                start_offset INTEGER   NOT NULL,
                end_offset   INTEGER   NOT NULL,
                token_count  INTEGER   NOT NULL,
                embedding    VARCHAR   NOT NULL,
                created_at   TIMESTAMP NOT NULL
            )
            """;

    private static final String CREATE_KEYS = """
            CREATE TABLE IF NOT EXISTS item_keys (
                user_id       VARCHAR NOT NULL,
                canonical_url VARCHAR NOT NULL,
                item_id       VARCHAR NOT NULL,
                PRIMARY KEY (user_id, canonical_url)
            )
            """;

    private static final String ITEM_COLUMNS = """
            id, user_id, url, canonical_url, title, source_site, publication_date, favicon_url,
            content_text, content_markdown, token_count, client_status, server_status, summary,
            expiry_score, error_message, embedding IS NOT NULL AS embedded, created_at,
            client_status_at, server_status_at
            """;

    private final ObjectMapper objectMapper;
    private final String dbPath;
    private Connection conn;

    public ItemRegistry(ObjectMapper objectMapper, @Value("${store.db.path}") String dbPath) {
        this.objectMapper = objectMapper;
        this.dbPath = dbPath;
    }

    @PostConstruct
    public void init() throws SQLException, IOException {
        Path path = Paths.get(dbPath);
        Files.createDirectories(path.toAbsolutePath().getParent());
        conn = DriverManager.getConnection("jdbc:duckdb:" + path.toAbsolutePath());
        migrateIfNeeded();
        try (Statement stmt = conn.createStatement()) {
            stmt.execute(CREATE_ITEMS);
            stmt.execute(CREATE_CHUNKS);
            stmt.execute(CREATE_KEYS);
        }
        log.info("ItemRegistry: tabelle 'items', 'item_chunks', 'item_keys' pronte su {}", path.toAbsolutePath());
    }

    /** Rileva schema obsoleto e ricrea le tabelle se necessario. */
    private void migrateIfNeeded() throws SQLException {
        Set<String> required = Set.of("canonical_url", "error_message", "embedding", "server_status_at");
        Set<String> existing = new HashSet<>();
        try (PreparedStatement ps = conn.prepareStatement(
                "SELECT column_name FROM information_schema.columns WHERE table_name = 'items'")) {
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) existing.add(rs.getString(1));
            }
        }
        if (!existing.isEmpty() && !existing.containsAll(required)) {
            try (Statement stmt = conn.createStatement()) {
                stmt.execute("DROP TABLE IF EXISTS item_keys");
                stmt.execute("DROP TABLE IF EXISTS item_chunks");
                stmt.execute("DROP TABLE IF EXISTS items");
            }
            log.warn("ItemRegistry: schema obsoleto rilevato, tabelle ricreate. Gli articoli vanno salvati di nuovo.");
        }
    }

    @PreDestroy
    public void close() {
        try {
            if (conn != null && !conn.isClosed()) conn.close();
        } catch (SQLException e) {
            log.warn("Errore chiusura connessione DuckDB registry: {}", e.getMessage());
        }
    }

    // ── Item ─────────────────────────────────────────────────────────────────

    @Override
    public synchronized Item createItem(String userId, String url) {
        String id = UUID.randomUUID().toString();
        Timestamp now = Timestamp.valueOf(LocalDateTime.now());
        String sql = """
                INSERT INTO items (id, user_id, url, client_status, server_status, created_at,
                                   client_status_at, server_status_at)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?)
                """;
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, id);
            ps.setString(2, userId);
            ps.setString(3, url);
            ps.setString(4, ClientStatus.ADDING.dbValue());
            ps.setString(5, ServerStatus.SAVED.dbValue());
            ps.setTimestamp(6, now);
            ps.setTimestamp(7, now);
            ps.setTimestamp(8, now);
            ps.executeUpdate();
        } catch (SQLException e) {
            if (isConstraintViolation(e)) {
                throw new ConflictException("Articolo già salvato: " + url);
            }
            throw new RuntimeException("Errore salvataggio item nel registry", e);
        }
        return findItem(userId, id).orElseThrow();
    }

    @Override
    public synchronized Optional<Item> findItem(String userId, String itemId) {
        try (PreparedStatement ps = conn.prepareStatement(
                "SELECT " + ITEM_COLUMNS + " FROM items WHERE user_id = ? AND id = ?")) {
            ps.setString(1, userId);
            ps.setString(2, itemId);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) return Optional.of(toItem(rs));
            }
        } catch (SQLException e) {
            throw new RuntimeException("Errore lettura item dal registry", e);
        }
        return Optional.empty();
    }

    @Override
    public synchronized List<Item> listItems(String userId, ItemFilter filter) {
        List<Object> args = new ArrayList<>();
        String where = whereClause(userId, filter, args);
        List<Item> result = new ArrayList<>();
        try (PreparedStatement ps = conn.prepareStatement(
                "SELECT " + ITEM_COLUMNS + " FROM items WHERE " + where + " ORDER BY created_at DESC, id")) {
            bind(ps, args);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) result.add(toItem(rs));
            }
        } catch (SQLException e) {
            throw new RuntimeException("Errore lettura registry", e);
        }
        return result;
    }

    @Override
    public synchronized List<Item> findItems(String userId, Collection<String> itemIds) {
        if (itemIds.isEmpty()) {
            return List.of();
        }
        Map<String, Item> byId = new HashMap<>();
        for (Item item : listItems(userId, ItemFilter.ofIds(List.copyOf(itemIds)))) {
            byId.put(item.id(), item);
        }
        List<Item> ordered = new ArrayList<>();
        for (String id : itemIds) {
            Item item = byId.get(id);
            if (item != null) ordered.add(item);
        }
        return ordered;
    }

    @Override
    public synchronized void claimCanonicalUrl(String userId, String canonicalUrl, String itemId) {
        try (PreparedStatement ps = conn.prepareStatement(
                "INSERT INTO item_keys (user_id, canonical_url, item_id) VALUES (?, ?, ?) ON CONFLICT DO NOTHING")) {
            ps.setString(1, userId);
            ps.setString(2, canonicalUrl);
            ps.setString(3, itemId);
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new RuntimeException("Errore registrazione URL canonico", e);
        }
        String owner;
        try (PreparedStatement ps = conn.prepareStatement(
                "SELECT item_id FROM item_keys WHERE user_id = ? AND canonical_url = ?")) {
            ps.setString(1, userId);
            ps.setString(2, canonicalUrl);
            try (ResultSet rs = ps.executeQuery()) {
                owner = rs.next() ? rs.getString(1) : null;
            }
        } catch (SQLException e) {
            throw new RuntimeException("Errore lettura URL canonico", e);
        }
        if (!itemId.equals(owner)) {
            throw new ConflictException("Articolo già salvato: " + canonicalUrl);
        }
    }

    @Override
    public synchronized Item applyExtraction(String userId, String itemId, ArticleContent content) {
        String sql = """
                UPDATE items SET canonical_url = ?, title = ?, source_site = ?, publication_date = ?,
                                 favicon_url = ?, content_text = ?, content_markdown = ?,
                                 server_status = ?, server_status_at = ?
                WHERE user_id = ? AND id = ?
                """;
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, content.dedupKey());
            ps.setString(2, content.title());
            ps.setString(3, content.sourceSite());
            setTimestamp(ps, 4, content.publicationDate());
            ps.setString(5, content.faviconUrl());
            ps.setString(6, content.contentText());
            ps.setString(7, content.contentMarkdown());
            ps.setString(8, ServerStatus.EXTRACTED.dbValue());
            ps.setTimestamp(9, Timestamp.valueOf(LocalDateTime.now()));
            ps.setString(10, userId);
            ps.setString(11, itemId);
            requireUpdated(ps.executeUpdate(), itemId);
        } catch (SQLException e) {
            throw new RuntimeException("Errore salvataggio contenuto estratto", e);
        }
        return findItem(userId, itemId).orElseThrow(() -> notFound(itemId));
    }

    @Override
    public synchronized Item applySummary(String userId, String itemId, SummaryData summary) {
        String sql = """
                UPDATE items SET summary = ?, expiry_score = ?, server_status = ?, server_status_at = ?
                WHERE user_id = ? AND id = ?
                """;
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, summary.summary());
            ps.setDouble(2, summary.expiryScore());
            ps.setString(3, ServerStatus.SUMMARISED.dbValue());
            ps.setTimestamp(4, Timestamp.valueOf(LocalDateTime.now()));
            ps.setString(5, userId);
            ps.setString(6, itemId);
            requireUpdated(ps.executeUpdate(), itemId);
        } catch (SQLException e) {
            throw new RuntimeException("Errore salvataggio sintesi", e);
        }
        return findItem(userId, itemId).orElseThrow(() -> notFound(itemId));
    }

    @Override
    public synchronized void saveEmbedding(String userId, String itemId, Vectorization vectorization) {
        String sql = """
                UPDATE items SET embedding = ?, token_count = ?, server_status = ?, server_status_at = ?,
                                 client_status = CASE WHEN client_status = ? THEN ? ELSE client_status END,
                                 client_status_at = CASE WHEN client_status = ? THEN ? ELSE client_status_at END,
                                 error_message = NULL
                WHERE user_id = ? AND id = ?
                """;
        try {
            inTransaction(() -> {
                Timestamp now = Timestamp.valueOf(LocalDateTime.now());
                try (PreparedStatement ps = conn.prepareStatement(sql)) {
                    ps.setString(1, toJson(vectorization.fullEmbedding()));
                    ps.setInt(2, vectorization.tokenCount());
                    ps.setString(3, ServerStatus.EMBEDDED.dbValue());
                    ps.setTimestamp(4, now);
                    ps.setString(5, ClientStatus.ADDING.dbValue());
                    ps.setString(6, ClientStatus.QUEUED.dbValue());
                    ps.setString(7, ClientStatus.ADDING.dbValue());
                    ps.setTimestamp(8, now);
                    ps.setString(9, userId);
                    ps.setString(10, itemId);
                    requireUpdated(ps.executeUpdate(), itemId);
                }
                replaceChunks(userId, itemId, vectorization.chunks());
                return null;
            });
        } catch (SQLException e) {
            throw new RuntimeException("Errore salvataggio embedding", e);
        }
        log.debug("Embedding salvato per item {} ({} chunk, pooled={})",
                itemId, vectorization.chunks().size(), vectorization.pooled());
    }

    @Override
    public synchronized void insertChunks(String userId, String itemId, List<ChunkEmbedding> chunks) {
        try {
            inTransaction(() -> {
                replaceChunks(userId, itemId, chunks);
                return null;
            });
        } catch (SQLException e) {
            throw new RuntimeException("Errore salvataggio chunk", e);
        }
    }

    private void replaceChunks(String userId, String itemId, List<ChunkEmbedding> chunks) throws SQLException {
        try (PreparedStatement del = conn.prepareStatement(
                "DELETE FROM item_chunks WHERE user_id = ? AND item_id = ?")) {
            del.setString(1, userId);
            del.setString(2, itemId);
            del.executeUpdate();
        }
        if (chunks.isEmpty()) {
            return;
        }
        String sql = """
                INSERT INTO item_chunks
                    (item_id, user_id, position, content, start_offset, end_offset, token_count, embedding, created_at)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)
                """;
        Timestamp now = Timestamp.valueOf(LocalDateTime.now());
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            for (ChunkEmbedding chunk : chunks) {
                ps.setString(1, itemId);
                ps.setString(2, userId);
                ps.setInt(3, chunk.chunk().position());
                ps.setString(4, chunk.chunk().text());
                ps.setInt(5, chunk.chunk().startOffset());
                ps.setInt(6, chunk.chunk().endOffset());
                ps.setInt(7, chunk.chunk().tokenCount());
                ps.setString(8, toJson(chunk.embedding()));
                ps.setTimestamp(9, now);
                ps.executeUpdate();
            }
        }
    }

    @Override
    public synchronized void updateServerStatus(String userId, String itemId, ServerStatus status) {
        try (PreparedStatement ps = conn.prepareStatement(
                "UPDATE items SET server_status = ?, server_status_at = ? WHERE user_id = ? AND id = ?")) {
            ps.setString(1, status.dbValue());
            ps.setTimestamp(2, Timestamp.valueOf(LocalDateTime.now()));
            ps.setString(3, userId);
            ps.setString(4, itemId);
            requireUpdated(ps.executeUpdate(), itemId);
        } catch (SQLException e) {
            throw new RuntimeException("Errore aggiornamento stato server", e);
        }
    }

    @Override
    public synchronized boolean updateClientStatus(String userId, String itemId, ClientStatus status) {
        try (PreparedStatement ps = conn.prepareStatement(
                "UPDATE items SET client_status = ?, client_status_at = ?, error_message = NULL "
                        + "WHERE user_id = ? AND id = ?")) {
            ps.setString(1, status.dbValue());
            ps.setTimestamp(2, Timestamp.valueOf(LocalDateTime.now()));
            ps.setString(3, userId);
            ps.setString(4, itemId);
            return ps.executeUpdate() > 0;
        } catch (SQLException e) {
            throw new RuntimeException("Errore aggiornamento stato client", e);
        }
    }

    @Override
    public synchronized void markError(String userId, String itemId, String message) {
        try (PreparedStatement ps = conn.prepareStatement(
                "UPDATE items SET client_status = ?, client_status_at = ?, error_message = ? "
                        + "WHERE user_id = ? AND id = ?")) {
            ps.setString(1, ClientStatus.ERROR.dbValue());
            ps.setTimestamp(2, Timestamp.valueOf(LocalDateTime.now()));
            ps.setString(3, message);
            ps.setString(4, userId);
            ps.setString(5, itemId);
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new RuntimeException("Errore salvataggio errore item", e);
        }
    }

    @Override
    public synchronized boolean deleteItem(String userId, String itemId) {
        try {
            return inTransaction(() -> {
                try (PreparedStatement ps = conn.prepareStatement(
                        "DELETE FROM item_chunks WHERE user_id = ? AND item_id = ?")) {
                    ps.setString(1, userId);
                    ps.setString(2, itemId);
                    ps.executeUpdate();
                }
                try (PreparedStatement ps = conn.prepareStatement(
                        "DELETE FROM item_keys WHERE user_id = ? AND item_id = ?")) {
                    ps.setString(1, userId);
                    ps.setString(2, itemId);
                    ps.executeUpdate();
                }
                try (PreparedStatement ps = conn.prepareStatement(
                        "DELETE FROM items WHERE user_id = ? AND id = ?")) {
                    ps.setString(1, userId);
                    ps.setString(2, itemId);
                    return ps.executeUpdate() > 0;
                }
            });
        } catch (SQLException e) {
            throw new RuntimeException("Errore rimozione item dal registry", e);
        }
    }

    // ── Vettori ──────────────────────────────────────────────────────────────

    @Override
    public synchronized List<ItemVector> getItemVectors(String userId, ItemFilter filter) {
        List<Object> args = new ArrayList<>();
        String where = whereClause(userId, filter, args) + " AND embedding IS NOT NULL";
        List<ItemVector> result = new ArrayList<>();
        try (PreparedStatement ps = conn.prepareStatement(
                "SELECT id, embedding FROM items WHERE " + where + " ORDER BY created_at DESC, id")) {
            bind(ps, args);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) result.add(new ItemVector(rs.getString("id"), fromJson(rs.getString("embedding"))));
            }
        } catch (SQLException e) {
            throw new RuntimeException("Errore lettura embedding item", e);
        }
        return result;
    }

    @Override
    public synchronized List<ChunkVector> getChunkVectors(String userId, String itemId) {
        return readChunks("SELECT item_id, position, content, embedding FROM item_chunks "
                + "WHERE user_id = ? AND item_id = ? ORDER BY position", userId, itemId);
    }

    private List<ChunkVector> readChunks(String sql, String... args) {
        List<ChunkVector> result = new ArrayList<>();
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            for (int i = 0; i < args.length; i++) ps.setString(i + 1, args[i]);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    result.add(new ChunkVector(
                            rs.getString(1),
                            rs.getInt(2),
                            rs.getString(3),
                            fromJson(rs.getString(4))));
                }
            }
        } catch (SQLException e) {
            throw new RuntimeException("Errore lettura chunk", e);
        }
        return result;
    }

    @Override
    public synchronized List<ItemSummary> getItemSummaries(String userId, Collection<String> itemIds) {
        if (itemIds.isEmpty()) {
            return List.of();
        }
        List<Object> args = new ArrayList<>();
        String where = whereClause(userId, ItemFilter.ofIds(List.copyOf(itemIds)), args) + " AND summary IS NOT NULL";
        List<ItemSummary> result = new ArrayList<>();
        try (PreparedStatement ps = conn.prepareStatement(
                "SELECT id, summary, created_at FROM items WHERE " + where + " ORDER BY created_at DESC, id")) {
            bind(ps, args);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    result.add(new ItemSummary(rs.getString(1), rs.getString(2),
                            rs.getTimestamp(3).toLocalDateTime()));
                }
            }
        } catch (SQLException e) {
            throw new RuntimeException("Errore lettura sintesi", e);
        }
        return result;
    }

    // ── Indice lessicale ─────────────────────────────────────────────────────

    @Override
    public synchronized List<IndexedText> loadIndexableTexts() {
        return loadTexts(null, null);
    }

    @Override
    public synchronized List<IndexedText> loadIndexableTexts(String userId, String itemId) {
        return loadTexts(userId, itemId);
    }

    private List<IndexedText> loadTexts(String userId, String itemId) {
        String itemScope = userId == null ? "" : " AND i.user_id = ? AND i.id = ?";
        String itemsSql = "SELECT i.user_id, i.id, CAST(NULL AS INTEGER), i.content_text, i.created_at FROM items i "
                + "WHERE i.embedding IS NOT NULL AND i.content_text IS NOT NULL" + itemScope;
        String chunksSql = "SELECT c.user_id, c.item_id, c.position, c.content, i.created_at FROM item_chunks c "
                + "JOIN items i ON i.id = c.item_id WHERE i.embedding IS NOT NULL" + itemScope;
        List<IndexedText> result = new ArrayList<>();
        for (String sql : List.of(itemsSql, chunksSql)) {
            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                if (userId != null) {
                    ps.setString(1, userId);
                    ps.setString(2, itemId);
                }
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        int position = rs.getInt(3);
                        Integer chunkPosition = rs.wasNull() ? null : position;
                        result.add(new IndexedText(rs.getString(1), rs.getString(2), chunkPosition,
                                rs.getString(4), rs.getTimestamp(5).toLocalDateTime()));
                    }
                }
            } catch (SQLException e) {
                throw new RuntimeException("Errore lettura testi da indicizzare", e);
            }
        }
        return result;
    }

    // ── Indice semantico ─────────────────────────────────────────────────────

    @Override
    public synchronized List<IndexedVector> loadIndexableVectors() {
        return loadVectors(null, null);
    }

    @Override
    public synchronized List<IndexedVector> loadIndexableVectors(String userId, String itemId) {
        return loadVectors(userId, itemId);
    }

    private List<IndexedVector> loadVectors(String userId, String itemId) {
        String itemScope = userId == null ? "" : " AND i.user_id = ? AND i.id = ?";
        String itemsSql = "SELECT i.user_id, i.id, CAST(NULL AS INTEGER), COALESCE(i.summary, i.title, i.url), "
                + "i.embedding FROM items i WHERE i.embedding IS NOT NULL" + itemScope;
        String chunksSql = "SELECT c.user_id, c.item_id, c.position, c.content, c.embedding FROM item_chunks c "
                + "JOIN items i ON i.id = c.item_id AND i.user_id = c.user_id "
                + "WHERE i.embedding IS NOT NULL" + itemScope;
        List<IndexedVector> result = new ArrayList<>();
        for (String sql : List.of(itemsSql, chunksSql)) {
            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                if (userId != null) {
                    ps.setString(1, userId);
                    ps.setString(2, itemId);
                }
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        int position = rs.getInt(3);
                        Integer chunkPosition = rs.wasNull() ? null : position;
                        result.add(new IndexedVector(rs.getString(1), rs.getString(2), chunkPosition,
                                rs.getString(4), fromJson(rs.getString(5))));
                    }
                }
            } catch (SQLException e) {
                throw new RuntimeException("Errore lettura vettori da indicizzare", e);
            }
        }
        return result;
    }

    // ── Statistiche ──────────────────────────────────────────────────────────

    @Override
    public synchronized int totalItems() {
        return count("SELECT COUNT(*) FROM items");
    }

    @Override
    public synchronized int embeddedItems() {
        return count("SELECT COUNT(*) FROM items WHERE embedding IS NOT NULL");
    }

    @Override
    public synchronized int totalChunks() {
        return count("SELECT COUNT(*) FROM item_chunks");
    }

    private int count(String sql) {
        try (Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery(sql)) {
            return rs.next() ? rs.getInt(1) : 0;
        } catch (SQLException e) {
            throw new RuntimeException("Errore conteggio", e);
        }
    }

    // ── Helper ───────────────────────────────────────────────────────────────

    @FunctionalInterface
    private interface SqlWork<T> {
        T run() throws SQLException;
    }

    private <T> T inTransaction(SqlWork<T> work) throws SQLException {
        conn.setAutoCommit(false);
        try {
            T result = work.run();
            conn.commit();
            return result;
        } catch (SQLException | RuntimeException e) {
            rollback(e);
            throw e;
        } finally {
            conn.setAutoCommit(true);
        }
    }

    private void rollback(Exception cause) {
        try {
            conn.rollback();
        } catch (SQLException e) {
            cause.addSuppressed(e);
        }
    }

    private static String whereClause(String userId, ItemFilter filter, List<Object> args) {
        StringBuilder where = new StringBuilder("user_id = ?");
        args.add(userId);
        if (!filter.statuses().isEmpty()) {
            where.append(" AND client_status IN (")
                 .append(String.join(", ", Collections.nCopies(filter.statuses().size(), "?")))
                 .append(")");
            filter.statuses().forEach(s -> args.add(s.dbValue()));
        }
        if (!filter.itemIds().isEmpty()) {
            where.append(" AND id IN (")
                 .append(String.join(", ", Collections.nCopies(filter.itemIds().size(), "?")))
                 .append(")");
            args.addAll(filter.itemIds());
        }
        return where.toString();
    }

    private static void bind(PreparedStatement ps, List<Object> args) throws SQLException {
        for (int i = 0; i < args.size(); i++) {
            ps.setString(i + 1, (String) args.get(i));
        }
    }

    private static void setTimestamp(PreparedStatement ps, int index, LocalDateTime value) throws SQLException {
        if (value == null) {
            ps.setNull(index, Types.TIMESTAMP);
        } else {
            ps.setTimestamp(index, Timestamp.valueOf(value));
        }
    }

    private static void requireUpdated(int rows, String itemId) {
        if (rows == 0) {
            throw notFound(itemId);
        }
    }

    private static NotFoundException notFound(String itemId) {
        return new NotFoundException("Item non trovato: " + itemId);
    }

    static boolean isConstraintViolation(SQLException e) {
        String message = e.getMessage();
        return message != null && (message.contains("Constraint Error") || message.contains("Duplicate key"));
    }

    private String toJson(float[] vector) {
        try {
            return objectMapper.writeValueAsString(vector);
        } catch (JsonProcessingException e) {
            throw new RuntimeException("Errore serializzazione vettore", e);
        }
    }

    private float[] fromJson(String json) {
        try {
            return objectMapper.readValue(json, float[].class);
        } catch (JsonProcessingException e) {
            throw new RuntimeException("Errore deserializzazione vettore", e);
        }
    }

    private Item toItem(ResultSet rs) throws SQLException {
        int tokens = rs.getInt("token_count");
        Integer tokenCount = rs.wasNull() ? null : tokens;
        double expiry = rs.getDouble("expiry_score");
        Double expiryScore = rs.wasNull() ? null : expiry;
        return new Item(
                rs.getString("id"),
                rs.getString("user_id"),
                rs.getString("url"),
                rs.getString("canonical_url"),
                rs.getString("title"),
                rs.getString("source_site"),
                toLocal(rs.getTimestamp("publication_date")),
                rs.getString("favicon_url"),
                rs.getString("content_text"),
                rs.getString("content_markdown"),
                tokenCount,
                ClientStatus.fromDb(rs.getString("client_status")),
                ServerStatus.fromDb(rs.getString("server_status")),
                rs.getString("summary"),
                expiryScore,
                rs.getString("error_message"),
                rs.getBoolean("embedded"),
                toLocal(rs.getTimestamp("created_at")),
                toLocal(rs.getTimestamp("client_status_at")),
                toLocal(rs.getTimestamp("server_status_at"))
        );
    }

    private static LocalDateTime toLocal(Timestamp ts) {
        return ts == null ? null : ts.toLocalDateTime();
    }
}
