package it.aw.readingqueue.provider;

import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.scoring.ScoringModel;
import it.aw.readingqueue.error.ProviderException;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Reranking cross-encoder tramite un {@link ScoringModel} LangChain4j (di default {@link OnnxCrossEncoderScoringModel}).
 * <p>
 * Se lo scoring model non è configurato il provider risulta non disponibile e la
 * ricerca semantica ordina per similarità coseno.
 */
@Component
public class LangChain4jRerankProvider implements RerankProvider {

    static final int MAX_BATCH_SIZE = 100;

    private final ScoringModel scoringModel;
    private final ProviderCalls calls;

    @Autowired
    public LangChain4jRerankProvider(ObjectProvider<ScoringModel> scoringModel, ProviderCalls calls) {
        this(scoringModel.getIfAvailable(), calls);
    }

    LangChain4jRerankProvider(ScoringModel scoringModel, ProviderCalls calls) {
        this.scoringModel = scoringModel;
        this.calls = calls;
    }

    @Override
    public boolean isAvailable() {
        return scoringModel != null;
    }

    @Override
    public List<Double> rerank(String query, List<String> candidates) {
        if (scoringModel == null) {
            throw new ProviderException("rerank: nessuno scoring model configurato", null);
        }
        List<Double> scores = new ArrayList<>(candidates.size());
        for (int from = 0; from < candidates.size(); from += MAX_BATCH_SIZE) {
            List<TextSegment> batch = candidates.subList(from, Math.min(from + MAX_BATCH_SIZE, candidates.size()))
                    .stream()
                    .map(c -> TextSegment.from(c.isBlank() ? " " : c))
                    .toList();
            List<Double> batchScores = calls.call("rerank", () -> scoringModel.scoreAll(batch, query).content());
            if (batchScores == null || batchScores.size() != batch.size()) {
                throw new ProviderException("rerank: numero di punteggi non coerente con i candidati", null);
            }
            scores.addAll(batchScores);
        }
        return scores;
    }
}
