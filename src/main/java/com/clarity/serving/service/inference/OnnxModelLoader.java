package com.clarity.serving.service.inference;

import ai.onnxruntime.OrtEnvironment;
import ai.onnxruntime.OrtException;
import com.clarity.serving.config.ServingProperties;
import com.clarity.serving.exception.ModelLoadException;
import com.clarity.serving.model.ModelFormat;
import com.clarity.serving.service.lifecycle.ModelLoader;
import com.clarity.serving.service.lifecycle.ModelVersion;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Loads ONNX model versions. The ONNX Runtime environment is created on first load.
 */
@Slf4j
@Component
public class OnnxModelLoader implements ModelLoader {

    private final int intraOpThreads;
    private volatile OrtEnvironment env;

    public OnnxModelLoader(ServingProperties properties) {
        this.intraOpThreads = properties.getModels().getIntraOpThreads();
    }

    @Override
    public ModelFormat format() {
        return ModelFormat.ONNX;
    }

    @Override
    public InferenceModel load(ModelVersion version) {
        if (version.getPath() == null || version.getPath().isBlank()) {
            throw new ModelLoadException(version.getModelId(), version.getVersion(),
                    "No model path registered for " + version.uniqueId());
        }

        Path modelPath = Path.of(version.getPath());
        if (!Files.isRegularFile(modelPath)) {
            throw new ModelLoadException(version.getModelId(), version.getVersion(),
                    "Model file not found for " + version.uniqueId() + ": " + modelPath);
        }

        OrtEnvironment environment;
        try {
            environment = environment();
        } catch (RuntimeException | LinkageError e) {
            throw new ModelLoadException(version.getModelId(), version.getVersion(),
                    "ONNX Runtime unavailable: " + e.getMessage(), e);
        }

        try {
            return OnnxInferenceModel.open(environment, version.getModelId(), version.getVersion(),
                    modelPath, intraOpThreads);
        } catch (OrtException e) {
            throw new ModelLoadException(version.getModelId(), version.getVersion(),
                    "Failed to create ONNX session for " + version.uniqueId(), e);
        }
    }

    private OrtEnvironment environment() {
        OrtEnvironment current = env;
        if (current == null) {
            synchronized (this) {
                current = env;
                if (current == null) {
                    log.info("Initializing ONNX Runtime environment");
                    current = OrtEnvironment.getEnvironment();
                    env = current;
                }
            }
        }
        return current;
    }
}
