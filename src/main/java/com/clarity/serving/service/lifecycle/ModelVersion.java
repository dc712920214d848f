package com.clarity.serving.service.lifecycle;

import com.clarity.serving.model.ModelFormat;
import com.clarity.serving.model.ModelState;
import com.clarity.serving.service.inference.InferenceModel;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.Setter;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;

/**
 * A registered model version and its lifecycle bookkeeping.
 * Mutable state is only changed by {@link ModelVersionManager}.
 */
@Getter
public class ModelVersion {

    private final String modelId;
    private final String version;
    private final ModelFormat format;
    private final String path;
    private final boolean critical;

    @Setter(AccessLevel.PACKAGE)
    private volatile ModelState state = ModelState.NOT_LOADED;

    @Setter(AccessLevel.PACKAGE)
    private volatile Duration loadTime;

    @Setter(AccessLevel.PACKAGE)
    private volatile Instant loadedAt;

    @Setter(AccessLevel.PACKAGE)
    private volatile String errorMessage;

    /**
     * When the last load failed; null once a load succeeds.
     */
    @Setter(AccessLevel.PACKAGE)
    private volatile Instant failedAt;

    @Getter(AccessLevel.PACKAGE)
    @Setter(AccessLevel.PACKAGE)
    private volatile InferenceModel model;

    /**
     * In-flight load shared by every caller waiting on this version.
     */
    @Getter(AccessLevel.PACKAGE)
    @Setter(AccessLevel.PACKAGE)
    private volatile CompletableFuture<InferenceModel> loading;

    public ModelVersion(String modelId, String version, ModelFormat format, String path, boolean critical) {
        this.modelId = modelId;
        this.version = version;
        this.format = format;
        this.path = path;
        this.critical = critical;
    }

    public String uniqueId() {
        return key(modelId, version);
    }

    static String key(String modelId, String version) {
        return modelId + ":" + version;
    }

    @Override
    public String toString() {
        return uniqueId() + "[" + state + "]";
    }
}
