package eu.virtualparadox.finrag.rag.embed;

import ai.djl.huggingface.tokenizers.Encoding;
import ai.djl.huggingface.tokenizers.HuggingFaceTokenizer;
import ai.onnxruntime.OnnxTensor;
import ai.onnxruntime.OrtEnvironment;
import ai.onnxruntime.OrtException;
import ai.onnxruntime.OrtSession;
import eu.virtualparadox.finrag.application.config.ApplicationConfig;
import eu.virtualparadox.finrag.util.OrtInitializer;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Local embedding model (bge-m3 style) served by ONNX Runtime.
 * <p>Expects {@code model.onnx} and {@code tokenizer.json} under {@code <models>/embedding}. Token vectors
 * are mean-pooled over the attention mask and L2-normalised, so cosine similarity equals the dot product.</p>
 */
@Service
@Slf4j
public final class OnnxEmbeddingService implements EmbeddingService {

    private static final int MAX_LEN = 1024;

    private final Path modelPath;
    private final Path tokenizerPath;
    private final int batchSize;

    private OrtEnvironment env;
    private OrtSession session;
    private HuggingFaceTokenizer tokenizer;

    public OnnxEmbeddingService(final ApplicationConfig config,
                                @Value("${finrag.embedding.batch-size:8}") final int batchSize) {
        final Path embeddingModelRoot = config.getModels().resolve("embedding");
        this.modelPath = embeddingModelRoot.resolve("model.onnx");
        this.tokenizerPath = embeddingModelRoot.resolve("tokenizer.json");
        this.batchSize = Math.max(1, batchSize);
    }

    @PostConstruct
    public void init() throws IOException, OrtException {
        this.env = OrtEnvironment.getEnvironment();
        final OrtSession.SessionOptions options = OrtInitializer.initializeOrt();

        this.session = env.createSession(modelPath.toString(), options);
        this.tokenizer = HuggingFaceTokenizer.newInstance(tokenizerPath);

        log.info("Loaded ONNX embedding model: {}", modelPath);
        log.debug("Model expects inputs: {}", session.getInputNames());
    }

    @PreDestroy
    public void cleanup() throws OrtException {
        if (tokenizer != null) {
            tokenizer.close();
        }
        if (session != null) {
            session.close();
        }
    }

    @Override
    public List<float[]> embed(final List<String> texts) {
        final List<float[]> result = new ArrayList<>(texts.size());
        for (int from = 0; from < texts.size(); from += batchSize) {
            final int to = Math.min(texts.size(), from + batchSize);
            result.addAll(embedBatch(texts.subList(from, to)));
        }
        log.debug("Embedded {} text(s)", texts.size());
        return result;
    }

    @Override
    public float[] embedQuery(final String text) {
        if (StringUtils.isBlank(text)) {
            throw new IllegalArgumentException("query must not be blank");
        }
        return embedBatch(List.of(text)).get(0);
    }

    @Override
    public String modelName() {
        return modelPath.toString();
    }

    private List<float[]> embedBatch(final List<String> texts) {
        try {
            final List<Encoding> encodings = new ArrayList<>();
            int maxLen = 0;

            for (final String text : texts) {
                final Encoding e = tokenizer.encode(text);
                encodings.add(e);
                maxLen = Math.max(maxLen, e.getIds().length);
            }
            if (maxLen > MAX_LEN) {
                maxLen = MAX_LEN;
            }

            final int size = encodings.size();
            final long[][] inputIdArr = new long[size][maxLen];
            final long[][] attnMaskArr = new long[size][maxLen];
            final long[][] tokenTypeArr = new long[size][maxLen];

            for (int i = 0; i < size; i++) {
                final long[] ids = encodings.get(i).getIds();
                final long[] mask = encodings.get(i).getAttentionMask();
                final int len = Math.min(ids.length, maxLen);

                System.arraycopy(ids, 0, inputIdArr[i], 0, len);
                System.arraycopy(mask, 0, attnMaskArr[i], 0, len);
            }

            try (final OnnxTensor inputIds = OnnxTensor.createTensor(env, inputIdArr);
                 final OnnxTensor attentionMask = OnnxTensor.createTensor(env, attnMaskArr);
                 final OnnxTensor tokenTypeTensor = OnnxTensor.createTensor(env, tokenTypeArr)) {

                final Map<String, OnnxTensor> inputs = new HashMap<>();
                if (session.getInputNames().contains("input_ids")) {
                    inputs.put("input_ids", inputIds);
                }
                if (session.getInputNames().contains("attention_mask")) {
                    inputs.put("attention_mask", attentionMask);
                }
                if (session.getInputNames().contains("token_type_ids")) {
                    inputs.put("token_type_ids", tokenTypeTensor);
                }

                try (final OrtSession.Result result = session.run(inputs)) {
                    final float[][][] embeddings = (float[][][]) result.get(0).getValue();

                    final List<float[]> out = new ArrayList<>(size);
                    for (int i = 0; i < size; i++) {
                        final float[] vec = meanPool(embeddings[i], attnMaskArr[i]);
                        normalize(vec);
                        out.add(vec);
                    }
                    return out;
                }
            }
        } catch (final Exception e) {
            throw new IllegalStateException("Failed to embed batch of " + texts.size() + " text(s)", e);
        }
    }

    static float[] meanPool(final float[][] tokenVectors, final long[] attentionMask) {
        final int hiddenDim = tokenVectors[0].length;
        final float[] pooled = new float[hiddenDim];

        int validCount = 0;
        for (int i = 0; i < tokenVectors.length && i < attentionMask.length; i++) {
            if (attentionMask[i] == 1) {
                final float[] tokenVec = tokenVectors[i];
                for (int j = 0; j < hiddenDim; j++) {
                    pooled[j] += tokenVec[j];
                }
                validCount++;
            }
        }

        if (validCount > 0) {
            for (int j = 0; j < hiddenDim; j++) {
                pooled[j] /= validCount;
            }
        }
        return pooled;
    }

    static void normalize(final float[] vec) {
        double norm = 0.0;
        for (final float v : vec) {
            norm += v * v;
        }
        norm = Math.sqrt(norm);
        if (norm > 0.0) {
            for (int i = 0; i < vec.length; i++) {
                vec[i] /= (float) norm;
            }
        }
    }
}
