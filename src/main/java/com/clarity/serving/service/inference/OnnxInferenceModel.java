package com.clarity.serving.service.inference;

import ai.onnxruntime.OnnxTensor;
import ai.onnxruntime.OnnxValue;
import ai.onnxruntime.OrtEnvironment;
import ai.onnxruntime.OrtException;
import ai.onnxruntime.OrtSession;
import com.clarity.serving.exception.CompilationException;
import com.clarity.serving.exception.InferenceException;
import lombok.extern.slf4j.Slf4j;

import java.nio.FloatBuffer;
import java.nio.file.Path;
import java.util.Map;

/**
 * Actigraphy transformer executed by ONNX Runtime.
 *
 * Input: one float tensor of shape [1, window]. Outputs: multi-task logits first, the
 * pooled embedding second (optional). {@link OrtSession#run} is thread-safe, so a single
 * session serves concurrent callers.
 */
@Slf4j
public class OnnxInferenceModel implements CompilableModel {

    private static final String OPTIMIZED_SUFFIX = ".optimized.onnx";

    private final OrtEnvironment env;
    private final OrtSession session;
    private final String inputName;
    private final String modelId;
    private final String version;
    private final Path modelPath;
    private final int intraOpThreads;
    private final boolean optimized;

    private OnnxInferenceModel(OrtEnvironment env, OrtSession session, String modelId, String version,
                               Path modelPath, int intraOpThreads, boolean optimized) throws OrtException {
        this.env = env;
        this.session = session;
        this.inputName = session.getInputNames().iterator().next();
        this.modelId = modelId;
        this.version = version;
        this.modelPath = modelPath;
        this.intraOpThreads = intraOpThreads;
        this.optimized = optimized;
    }

    /**
     * Open a session with basic graph optimizations only; full optimization is left to
     * {@link #compile}.
     */
    public static OnnxInferenceModel open(OrtEnvironment env, String modelId, String version,
                                          Path modelPath, int intraOpThreads) throws OrtException {
        try (OrtSession.SessionOptions options = new OrtSession.SessionOptions()) {
            options.setIntraOpNumThreads(intraOpThreads);
            options.setOptimizationLevel(OrtSession.SessionOptions.OptLevel.BASIC_OPT);

            OrtSession session = env.createSession(modelPath.toString(), options);
            log.info("ONNX model {}:{} loaded from {}", modelId, version, modelPath);
            log.info("Model inputs: {}, outputs: {}", session.getInputNames(), session.getOutputNames());
            return new OnnxInferenceModel(env, session, modelId, version, modelPath, intraOpThreads, false);
        }
    }

    @Override
    public InferenceModel compile(Path outputDir) {
        try (OrtSession.SessionOptions options = new OrtSession.SessionOptions()) {
            options.setIntraOpNumThreads(intraOpThreads);
            options.setOptimizationLevel(OrtSession.SessionOptions.OptLevel.ALL_OPT);
            if (outputDir != null) {
                Path target = outputDir.resolve(modelId + "-" + version + OPTIMIZED_SUFFIX);
                options.setOptimizedModelFilePath(target.toString());
                log.info("Writing optimized graph for {}:{} to {}", modelId, version, target);
            }

            OrtSession compiled = env.createSession(modelPath.toString(), options);
            return new OnnxInferenceModel(env, compiled, modelId, version, modelPath, intraOpThreads, true);
        } catch (OrtException e) {
            throw new CompilationException("ONNX compilation failed for " + modelId + ":" + version, e);
        }
    }

    @Override
    public ModelOutput predict(float[] window) {
        long[] shape = {1, window.length};

        try (OnnxTensor input = OnnxTensor.createTensor(env, FloatBuffer.wrap(window), shape);
             OrtSession.Result result = session.run(Map.of(inputName, input))) {

            float[] logits = firstRow(result.get(0));
            float[] embedding = result.size() > 1 ? firstRow(result.get(1)) : new float[0];
            return MultiTaskHeadDecoder.decode(logits, embedding);

        } catch (OrtException e) {
            throw new InferenceException("ONNX inference failed for " + modelId + ":" + version, e);
        }
    }

    @Override
    public String modelId() {
        return modelId;
    }

    @Override
    public String version() {
        return version;
    }

    @Override
    public boolean isOptimized() {
        return optimized;
    }

    @Override
    public void close() {
        try {
            session.close();
            log.info("ONNX session for {}:{} closed", modelId, version);
        } catch (OrtException e) {
            log.error("Error closing ONNX session for {}:{}", modelId, version, e);
        }
    }

    /**
     * Output tensors carry a leading batch dimension of 1.
     */
    private float[] firstRow(OnnxValue value) throws OrtException {
        Object raw = value.getValue();
        if (raw instanceof float[][] matrix && matrix.length > 0) {
            return matrix[0];
        }
        if (raw instanceof float[] vector) {
            return vector;
        }
        throw new InferenceException("Unexpected output type " + raw.getClass().getSimpleName()
                + " from " + modelId + ":" + version);
    }
}
