package it.aw.readingqueue.service;

import dev.langchain4j.data.document.Document;
import dev.langchain4j.data.document.DocumentSplitter;
import dev.langchain4j.data.document.splitter.DocumentSplitters;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.TokenCountEstimator;
import it.aw.readingqueue.model.ChunkingParams;
import it.aw.readingqueue.model.TextChunk;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Suddivide il testo con {@code DocumentSplitters.recursive} (paragrafi, righe,
 * frasi, parole) in chunk di al più {@code chunkTokens} token con overlap.
 * <p>
 * Gli offset [startOffset, endOffset) sono ricavati cercando ogni segmento nel
 * testo completo a partire dal precedente; tra due chunk consecutivi resta al più
 * lo spazio bianco scartato dallo splitter.
 */
@Component
public class TextChunker {

    private static final Logger log = LoggerFactory.getLogger(TextChunker.class);

    private static final int PREFIX_LENGTH = 32;

    private final TokenCountEstimator tokenCountEstimator;

    public TextChunker(TokenCountEstimator tokenCountEstimator) {
        this.tokenCountEstimator = tokenCountEstimator;
    }

    public List<TextChunk> chunk(String text, ChunkingParams params) {
        List<TextChunk> chunks = new ArrayList<>();
        if (text == null || text.isBlank()) {
            return chunks;
        }
        DocumentSplitter splitter = DocumentSplitters.recursive(
                params.chunkTokens(), params.overlapTokens(), tokenCountEstimator);
        List<TextSegment> segments = splitter.split(Document.from(text));

        int searchFrom = 0;
        for (TextSegment segment : segments) {
            String chunkText = segment.text();
            int start = locate(text, chunkText, searchFrom);
            int end = Math.min(text.length(), start + chunkText.length());
            chunks.add(new TextChunk(chunks.size(), chunkText, start, end, countTokens(chunkText)));
            searchFrom = Math.min(text.length(), start + 1);
        }
        return chunks;
    }

    public int countTokens(String text) {
        return text == null || text.isEmpty() ? 0 : tokenCountEstimator.estimateTokenCountInText(text);
    }

    /**
     * Offset del segmento nel testo: ricerca progressiva dal chunk precedente,
     * poi sul solo prefisso (lo splitter può aver normalizzato gli spazi interni).
     */
    private static int locate(String text, String chunkText, int from) {
        int offset = text.indexOf(chunkText, from);
        if (offset >= 0) {
            return offset;
        }
        String prefix = chunkText.substring(0, Math.min(PREFIX_LENGTH, chunkText.length()));
        offset = text.indexOf(prefix, from);
        if (offset >= 0) {
            return offset;
        }
        log.debug("Segmento non ritrovato nel testo a partire da {}, offset stimato", from);
        return from;
    }
}
