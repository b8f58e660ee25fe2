package eu.virtualparadox.docrag.rag.embed;

import ai.djl.huggingface.tokenizers.Encoding;
import ai.djl.huggingface.tokenizers.HuggingFaceTokenizer;
import ai.onnxruntime.OnnxTensor;
import ai.onnxruntime.OrtEnvironment;
import ai.onnxruntime.OrtException;
import ai.onnxruntime.OrtSession;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;

/**
 * Local sentence-embedding model run through ONNX Runtime.
 * <p>
 * Expects {@code model.onnx} and {@code tokenizer.json} in the model directory. Token vectors are
 * mean-pooled over the attention mask and L2-normalized.
 */
@Slf4j
public final class OnnxEmbeddingCapability implements EmbeddingCapability, AutoCloseable {

    private static final int MAX_LEN = 512;

    private final Path modelPath;
    private final Path tokenizerPath;
    private final String modelId;

    private OrtEnvironment env;
    private OrtSession session;
    private HuggingFaceTokenizer tokenizer;

    public OnnxEmbeddingCapability(final Path modelDir) {
        this.modelPath = modelDir.resolve("model.onnx");
        this.tokenizerPath = modelDir.resolve("tokenizer.json");
        this.modelId = "onnx:" + modelDir.getFileName();
    }

    /**
     * Loads the model and tokenizer. Must be called once before {@link #embed(String)}.
     */
    public void init() throws IOException, OrtException {
        this.env = OrtEnvironment.getEnvironment();
        this.session = env.createSession(modelPath.toString(), sessionOptions());
        this.tokenizer = HuggingFaceTokenizer.newInstance(tokenizerPath);

        log.info("Loaded ONNX embedding model: {}", modelPath);
        log.info("Model expects inputs: {}", session.getInputNames());
    }

    @Override
    public void close() throws OrtException {
        if (tokenizer != null) {
            tokenizer.close();
        }
        if (session != null) {
            session.close();
        }
    }

    @Override
    public String modelId() {
        return modelId;
    }

    @Override
    public float[] embed(final String text) {
        if (session == null) {
            throw new IllegalStateException("ONNX embedding model not initialized: " + modelPath);
        }

        final Encoding encoding = tokenizer.encode(text);
        final int len = Math.min(encoding.getIds().length, MAX_LEN);

        final long[][] inputIds = new long[1][len];
        final long[][] attentionMask = new long[1][len];
        final long[][] tokenTypes = new long[1][len];
        System.arraycopy(encoding.getIds(), 0, inputIds[0], 0, len);
        System.arraycopy(encoding.getAttentionMask(), 0, attentionMask[0], 0, len);

        try (final OnnxTensor idsTensor = OnnxTensor.createTensor(env, inputIds);
             final OnnxTensor maskTensor = OnnxTensor.createTensor(env, attentionMask);
             final OnnxTensor typeTensor = OnnxTensor.createTensor(env, tokenTypes)) {

            final Map<String, OnnxTensor> inputs = new HashMap<>();
            if (session.getInputNames().contains("input_ids")) {
                inputs.put("input_ids", idsTensor);
            }
            if (session.getInputNames().contains("attention_mask")) {
                inputs.put("attention_mask", maskTensor);
            }
            if (session.getInputNames().contains("token_type_ids")) {
                inputs.put("token_type_ids", typeTensor);
            }

            try (final OrtSession.Result result = session.run(inputs)) {
                final float[][][] hidden = (float[][][]) result.get(0).getValue();
                final float[] vector = meanPool(hidden[0], attentionMask[0]);
                normalize(vector);
                return vector;
            }
        }
        catch (final OrtException e) {
            throw new IllegalStateException("Failed to embed text with " + modelPath, e);
        }
    }

    private static OrtSession.SessionOptions sessionOptions() throws OrtException {
        final OrtSession.SessionOptions options = new OrtSession.SessionOptions();

        // leave one core free for other tasks
        final int intraThreads = Math.max(1, Runtime.getRuntime().availableProcessors() - 1);
        options.setIntraOpNumThreads(intraThreads);
        options.setInterOpNumThreads(1);

        log.info("Intra-op threads: {}, Inter-op threads: {}", intraThreads, 1);
        return options;
    }

    private static float[] meanPool(final float[][] tokenVectors, final long[] attentionMask) {
        final int hiddenDim = tokenVectors[0].length;
        final float[] pooled = new float[hiddenDim];

        int validCount = 0;
        for (int i = 0; i < tokenVectors.length; i++) {
            if (attentionMask[i] == 1) {
                for (int j = 0; j < hiddenDim; j++) {
                    pooled[j] += tokenVectors[i][j];
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

    private static void normalize(final float[] vector) {
        double norm = 0.0;
        for (final float v : vector) {
            norm += v * v;
        }
        norm = Math.sqrt(norm);
        if (norm > 0.0) {
            for (int i = 0; i < vector.length; i++) {
                vector[i] /= (float) norm;
            }
        }
    }
}
