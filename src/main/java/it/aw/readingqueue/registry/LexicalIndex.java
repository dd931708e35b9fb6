package it.aw.readingqueue.registry;

import it.aw.readingqueue.model.IndexedText;
import it.aw.readingqueue.model.SearchScope;
import jakarta.annotation.PreDestroy;
import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.analysis.en.EnglishAnalyzer;
import org.apache.lucene.document.Document;
import org.apache.lucene.document.Field;
import org.apache.lucene.document.NumericDocValuesField;
import org.apache.lucene.document.StoredField;
import org.apache.lucene.document.StringField;
import org.apache.lucene.document.TextField;
import org.apache.lucene.index.IndexWriter;
import org.apache.lucene.index.IndexWriterConfig;
import org.apache.lucene.index.StoredFields;
import org.apache.lucene.index.Term;
import org.apache.lucene.search.BooleanClause;
import org.apache.lucene.search.BooleanQuery;
import org.apache.lucene.search.IndexSearcher;
import org.apache.lucene.search.Query;
import org.apache.lucene.search.ScoreDoc;
import org.apache.lucene.search.SearcherManager;
import org.apache.lucene.search.Sort;
import org.apache.lucene.search.SortField;
import org.apache.lucene.search.TermQuery;
import org.apache.lucene.search.TopFieldDocs;
import org.apache.lucene.store.ByteBuffersDirectory;
import org.apache.lucene.util.QueryBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.Closeable;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Indice full-text in memoria (Lucene, BM25) sul testo degli item e dei loro chunk.
 * <p>
 * L'analyzer inglese applica stemming e stopword. Tutti i termini della query
 * sono obbligatori; a parità di punteggio vince l'unità creata più di recente.
 * L'indice non è persistito: viene ricostruito da DuckDB all'avvio (StoreLifecycle).
 */
@Component
public class LexicalIndex implements Closeable {

    private static final Logger log = LoggerFactory.getLogger(LexicalIndex.class);

    static final String F_KEY        = "itemKey";
    static final String F_USER       = "userId";
    static final String F_TYPE       = "type";
    static final String F_ITEM       = "itemId";
    static final String F_POSITION   = "position";
    static final String F_TEXT       = "text";
    static final String F_CREATED_AT = "createdAt";

    private static final Sort SCORE_THEN_NEWEST = new Sort(
            SortField.FIELD_SCORE,
            new SortField(F_CREATED_AT, SortField.Type.LONG, true));

    /** Match lessicale su un item ({@code chunkPosition} null) o su un suo chunk. */
    public record Hit(String itemId, Integer chunkPosition, String text, double score) {}

    private final Analyzer analyzer = new EnglishAnalyzer();
    private final ByteBuffersDirectory directory = new ByteBuffersDirectory();
    private final IndexWriter writer;
    private final SearcherManager searcherManager;

    public LexicalIndex() {
        try {
            writer = new IndexWriter(directory, new IndexWriterConfig(analyzer)
                    .setOpenMode(IndexWriterConfig.OpenMode.CREATE));
            searcherManager = new SearcherManager(writer, null);
        } catch (IOException e) {
            throw new UncheckedIOException("Impossibile creare l'indice lessicale", e);
        }
    }

    /** Sostituisce l'intero contenuto dell'indice. */
    public void rebuild(Collection<IndexedText> texts) {
        try {
            writer.deleteAll();
            for (IndexedText text : texts) {
                writer.addDocument(toDocument(text));
            }
            refresh();
        } catch (IOException e) {
            throw new UncheckedIOException("Errore ricostruzione indice lessicale", e);
        }
        log.info("Indice lessicale ricostruito: {} unità", texts.size());
    }

    /** Sostituisce testo e chunk di un item. */
    public void replaceItem(String userId, String itemId, Collection<IndexedText> texts) {
        try {
            writer.deleteDocuments(new Term(F_KEY, itemKey(userId, itemId)));
            for (IndexedText text : texts) {
                writer.addDocument(toDocument(text));
            }
            refresh();
        } catch (IOException e) {
            throw new UncheckedIOException("Errore aggiornamento indice lessicale", e);
        }
        log.debug("Indice lessicale aggiornato per item {} ({} unità)", itemId, texts.size());
    }

    public void removeItem(String userId, String itemId) {
        try {
            writer.deleteDocuments(new Term(F_KEY, itemKey(userId, itemId)));
            refresh();
        } catch (IOException e) {
            throw new UncheckedIOException("Errore rimozione dall'indice lessicale", e);
        }
    }

    /**
     * Ricerca BM25 sulle unità dell'utente nello scope richiesto.
     * Una query composta solo da stopword non produce risultati.
     */
    public List<Hit> search(String userId, String text, SearchScope scope, int limit) {
        Query textQuery = new QueryBuilder(analyzer).createBooleanQuery(F_TEXT, text, BooleanClause.Occur.MUST);
        if (textQuery == null || limit <= 0) {
            return List.of();
        }
        Query query = new BooleanQuery.Builder()
                .add(textQuery, BooleanClause.Occur.MUST)
                .add(new TermQuery(new Term(F_USER, userId)), BooleanClause.Occur.FILTER)
                .add(new TermQuery(new Term(F_TYPE, typeOf(scope))), BooleanClause.Occur.FILTER)
                .build();

        List<Hit> hits = new ArrayList<>();
        IndexSearcher searcher = null;
        try {
            searcher = searcherManager.acquire();
            TopFieldDocs top = searcher.search(query, limit, SCORE_THEN_NEWEST, true);
            StoredFields stored = searcher.storedFields();
            for (ScoreDoc sd : top.scoreDocs) {
                Document doc = stored.document(sd.doc);
                Integer position = doc.getField(F_POSITION) != null
                        ? doc.getField(F_POSITION).numericValue().intValue()
                        : null;
                hits.add(new Hit(doc.get(F_ITEM), position, doc.get(F_TEXT), sd.score));
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Errore ricerca lessicale", e);
        } finally {
            release(searcher);
        }
        return hits;
    }

    public int size() {
        return writer.getDocStats().numDocs;
    }

    @PreDestroy
    @Override
    public void close() {
        try {
            searcherManager.close();
            writer.close();
        } catch (IOException e) {
            log.warn("Errore chiusura indice lessicale: {}", e.getMessage());
        }
    }

    private void refresh() throws IOException {
        searcherManager.maybeRefreshBlocking();
    }

    private void release(IndexSearcher searcher) {
        if (searcher == null) {
            return;
        }
        try {
            searcherManager.release(searcher);
        } catch (IOException e) {
            log.warn("Errore rilascio searcher lessicale: {}", e.getMessage());
        }
    }

    private static Document toDocument(IndexedText text) {
        Document doc = new Document();
        doc.add(new StringField(F_KEY, itemKey(text.userId(), text.itemId()), Field.Store.NO));
        doc.add(new StringField(F_USER, text.userId(), Field.Store.NO));
        doc.add(new StringField(F_TYPE, text.isChunk() ? "chunk" : "item", Field.Store.NO));
        doc.add(new StringField(F_ITEM, text.itemId(), Field.Store.YES));
        if (text.isChunk()) {
            doc.add(new StoredField(F_POSITION, text.chunkPosition()));
        }
        doc.add(new TextField(F_TEXT, text.text() == null ? "" : text.text(), Field.Store.YES));
        doc.add(new NumericDocValuesField(F_CREATED_AT, text.createdAt().toInstant(ZoneOffset.UTC).toEpochMilli()));
        return doc;
    }

    private static String typeOf(SearchScope scope) {
        return scope == SearchScope.CHUNKS ? "chunk" : "item";
    }

    private static String itemKey(String userId, String itemId) {
        return userId + "/" + itemId;
    }
}
