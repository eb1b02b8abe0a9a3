package eu.virtualparadox.titanshield.rag.embed;

import ai.djl.huggingface.tokenizers.Encoding;
import ai.djl.huggingface.tokenizers.HuggingFaceTokenizer;
import ai.onnxruntime.OnnxTensor;
import ai.onnxruntime.OrtEnvironment;
import ai.onnxruntime.OrtException;
import ai.onnxruntime.OrtSession;
import eu.virtualparadox.titanshield.application.config.TitanShieldProperties;
import eu.virtualparadox.titanshield.application.executor.DependencyExecutor;
import eu.virtualparadox.titanshield.resilience.DependencyCalls;
import eu.virtualparadox.titanshield.resilience.DependencyResult;
import eu.virtualparadox.titanshield.resilience.InvalidResponseException;
import eu.virtualparadox.titanshield.util.VectorMath;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/**
 * Sentence embeddings from a local ONNX encoder: tokenise, run the model, mean-pool over the attention mask and
 * L2-normalise.
 */
@Service
@Slf4j
@ConditionalOnProperty(prefix = "titanshield.embedding", name = "provider", havingValue = "ONNX", matchIfMissing = true)
public class OnnxEmbeddingClient implements EmbeddingClient {

    private static final int MAX_LEN = 512;

    private final DependencyExecutor dependencyExecutor;
    private final Path modelPath;
    private final Path tokenizerPath;
    private final int dimension;

    private OrtEnvironment env;
    private OrtSession session;
    private HuggingFaceTokenizer tokenizer;

    public OnnxEmbeddingClient(final DependencyExecutor dependencyExecutor,
                               final TitanShieldProperties props) {
        this.dependencyExecutor = dependencyExecutor;
        this.dimension = props.getEmbedding().getDimension();

        final Path embeddingModelRoot = props.getPaths().getModels().resolve("embedding");
        this.modelPath = embeddingModelRoot.resolve("model.onnx");
        this.tokenizerPath = embeddingModelRoot.resolve("tokenizer.json");
    }

    @PostConstruct
    public void init() throws IOException, OrtException {
        this.env = OrtEnvironment.getEnvironment();
        this.session = env.createSession(modelPath.toString(), sessionOptions());
        this.tokenizer = HuggingFaceTokenizer.newInstance(tokenizerPath);

        log.info("Loaded ONNX embedding model: {}", modelPath);
        log.info("Model expects inputs: {}", session.getInputNames());
    }

    @PreDestroy
    public void cleanup() throws OrtException {
        if (session != null) {
            session.close();
        }
        if (tokenizer != null) {
            tokenizer.close();
        }
    }

    @Override
    public DependencyResult<float[]> embed(final String text, final Duration timeout) {
        return DependencyCalls.call(dependencyExecutor, "onnx-embed", timeout, () -> embedNow(text));
    }

    @Override
    public int dimension() {
        return dimension;
    }

    @Override
    public String name() {
        return "onnx";
    }

    private float[] embedNow(final String text) throws OrtException {
        final Encoding encoding = tokenizer.encode(text == null ? "" : text);
        final int len = Math.min(encoding.getIds().length, MAX_LEN);

        final long[][] inputIdArr = new long[1][len];
        final long[][] attnMaskArr = new long[1][len];
        final long[][] tokenTypeArr = new long[1][len];
        System.arraycopy(encoding.getIds(), 0, inputIdArr[0], 0, len);
        System.arraycopy(encoding.getAttentionMask(), 0, attnMaskArr[0], 0, len);

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
                final float[] vec = VectorMath.normalize(meanPool(embeddings[0], attnMaskArr[0]));
                if (vec.length != dimension) {
                    throw new InvalidResponseException(
                            "Embedding has dimension " + vec.length + ", expected " + dimension);
                }
                return vec;
            }
        }
    }

    private float[] meanPool(final float[][] tokenVectors, final long[] attentionMask) {
        if (tokenVectors.length == 0) {
            throw new InvalidResponseException("Model returned no token vectors");
        }
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

    private static OrtSession.SessionOptions sessionOptions() throws OrtException {
        final OrtSession.SessionOptions opts = new OrtSession.SessionOptions();

        // leave one core free for retrieval and the question workers
        final int intraThreads = Math.max(1, Runtime.getRuntime().availableProcessors() - 1);
        opts.setIntraOpNumThreads(intraThreads);
        opts.setInterOpNumThreads(1);

        log.info("Intra-op threads: {}, Inter-op threads: {}", intraThreads, 1);
        return opts;
    }
}
