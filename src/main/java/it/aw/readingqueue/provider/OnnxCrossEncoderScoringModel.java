package it.aw.readingqueue.provider;

import ai.djl.huggingface.tokenizers.Encoding;
import ai.djl.huggingface.tokenizers.HuggingFaceTokenizer;
import ai.onnxruntime.OnnxTensor;
import ai.onnxruntime.OrtEnvironment;
import ai.onnxruntime.OrtException;
import ai.onnxruntime.OrtSession;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.output.Response;
import dev.langchain4j.model.scoring.ScoringModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Cross-encoder locale su ONNX Runtime (es. ms-marco-MiniLM esportato in ONNX).
 * <p>
 * Ogni coppia (query, testo) è tokenizzata con il tokenizer HuggingFace del modello,
 * troncata a {@code maxLength} token e valutata in un unico batch. Il logit di
 * rilevanza passa per una sigmoide: i punteggi sono in [0, 1].
 */
public class OnnxCrossEncoderScoringModel implements ScoringModel, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(OnnxCrossEncoderScoringModel.class);

    static final String INPUT_IDS = "input_ids";
    static final String ATTENTION_MASK = "attention_mask";
    static final String TOKEN_TYPE_IDS = "token_type_ids";

    private final OrtEnvironment env;
    private final OrtSession session;
    private final HuggingFaceTokenizer tokenizer;
    private final boolean usesTokenTypes;

    public OnnxCrossEncoderScoringModel(Path modelPath, Path tokenizerPath, int maxLength)
            throws OrtException, IOException {
        this.env = OrtEnvironment.getEnvironment();
        this.session = env.createSession(modelPath.toString(), new OrtSession.SessionOptions());
        this.tokenizer = HuggingFaceTokenizer.builder()
                .optTokenizerPath(tokenizerPath)
                .optMaxLength(maxLength)
                .optTruncation(true)
                .optPadding(false)
                .build();
        this.usesTokenTypes = session.getInputNames().contains(TOKEN_TYPE_IDS);
        log.info("Cross-encoder ONNX caricato da {} (input: {})", modelPath, session.getInputNames());
    }

    @Override
    public Response<List<Double>> scoreAll(List<TextSegment> segments, String query) {
        if (segments.isEmpty()) {
            return Response.from(List.of());
        }
        List<long[]> ids = new ArrayList<>(segments.size());
        List<long[]> masks = new ArrayList<>(segments.size());
        List<long[]> types = new ArrayList<>(segments.size());
        for (TextSegment segment : segments) {
            Encoding encoding = tokenizer.encode(query, segment.text());
            ids.add(encoding.getIds());
            masks.add(encoding.getAttentionMask());
            types.add(encoding.getTypeIds());
        }

        Map<String, OnnxTensor> inputs = new HashMap<>();
        try {
            inputs.put(INPUT_IDS, OnnxTensor.createTensor(env, pad(ids)));
            inputs.put(ATTENTION_MASK, OnnxTensor.createTensor(env, pad(masks)));
            if (usesTokenTypes) {
                inputs.put(TOKEN_TYPE_IDS, OnnxTensor.createTensor(env, pad(types)));
            }
            try (OrtSession.Result result = session.run(inputs)) {
                return Response.from(scores(result.get(0).getValue()));
            }
        } catch (OrtException e) {
            throw new IllegalStateException("Inferenza cross-encoder fallita: " + e.getMessage(), e);
        } finally {
            inputs.values().forEach(OnnxTensor::close);
        }
    }

    /** Uscita [batch, classi] oppure [batch] per le teste a logit singolo appiattite. */
    static List<Double> scores(Object output) {
        List<Double> scores = new ArrayList<>();
        if (output instanceof float[][]) {
            for (float[] row : (float[][]) output) {
                scores.add(relevance(row));
            }
        } else if (output instanceof float[]) {
            for (float logit : (float[]) output) {
                scores.add(relevance(new float[]{logit}));
            }
        } else {
            throw new IllegalStateException("Uscita del cross-encoder non supportata: "
                    + (output == null ? "null" : output.getClass().getSimpleName()));
        }
        return scores;
    }

    /** Allinea le righe alla più lunga completando con zeri (token di padding e maschera nulla). */
    static long[][] pad(List<long[]> rows) {
        int width = 0;
        for (long[] row : rows) width = Math.max(width, row.length);
        long[][] out = new long[rows.size()][width];
        for (int i = 0; i < rows.size(); i++) {
            System.arraycopy(rows.get(i), 0, out[i], 0, rows.get(i).length);
        }
        return out;
    }

    /**
     * Rilevanza da una riga di logit: sigmoide del logit singolo, oppure
     * probabilità softmax dell'ultima classe per le teste a più classi.
     */
    static double relevance(float[] logits) {
        if (logits.length == 1) {
            return 1.0 / (1.0 + Math.exp(-logits[0]));
        }
        double max = Double.NEGATIVE_INFINITY;
        for (float l : logits) max = Math.max(max, l);
        double sum = 0;
        for (float l : logits) sum += Math.exp(l - max);
        return Math.exp(logits[logits.length - 1] - max) / sum;
    }

    @Override
    public void close() throws OrtException {
        tokenizer.close();
        session.close();
    }
}
