package com.clarity.serving.service.lifecycle;

import com.clarity.serving.config.ExecutorConfiguration;
import com.clarity.serving.config.ServingProperties;
import com.clarity.serving.exception.FallbackExhaustedException;
import com.clarity.serving.exception.ModelLoadException;
import com.clarity.serving.model.LoadingStrategy;
import com.clarity.serving.model.ModelFormat;
import com.clarity.serving.model.ModelState;
import com.clarity.serving.model.dto.ModelStatus;
import com.clarity.serving.monitor.ServingMetrics;
import com.clarity.serving.service.batch.ServingModel;
import com.clarity.serving.service.batch.ServingModelProvider;
import com.clarity.serving.service.inference.InferenceModel;
import com.clarity.serving.service.optimization.ModelOptimizer;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Owns model handles and drives their lifecycle.
 *
 * Loads run on the loading executor and are shared: every caller asking for a version that
 * is loading waits on the same future. State transitions happen under a single monitor;
 * loading and closing handles happen outside it. Reload is not atomic: between unloading
 * the old handle and the new load completing, callers wait for the new load.
 *
 * A version whose load failed is retried on request once {@code retryBackoff} has passed;
 * until then requests for it fail fast, which sends serving to the fallback model.
 */
@Slf4j
@Service
public class ModelVersionManager implements ServingModelProvider {

    public static final String LATEST = "latest";

    private final Map<ModelFormat, ModelLoader> loaders = new EnumMap<>(ModelFormat.class);
    private final ModelOptimizer optimizer;
    private final ServingProperties properties;
    private final ServingMetrics metrics;
    private final Clock clock;
    private final Executor loadingExecutor;

    private final Object lock = new Object();
    private final Map<String, ModelVersion> versions = new ConcurrentHashMap<>();
    private final Map<String, String> activeVersions = new ConcurrentHashMap<>();

    public ModelVersionManager(List<ModelLoader> loaders,
                               ModelOptimizer optimizer,
                               ServingProperties properties,
                               ServingMetrics metrics,
                               Clock clock,
                               @Qualifier(ExecutorConfiguration.LOADING_EXECUTOR) Executor loadingExecutor) {
        for (ModelLoader loader : loaders) {
            this.loaders.put(loader.format(), loader);
        }
        this.optimizer = optimizer;
        this.properties = properties;
        this.metrics = metrics;
        this.clock = clock;
        this.loadingExecutor = loadingExecutor;
    }

    /**
     * Register configured models and apply the loading strategy.
     */
    @PostConstruct
    public void initialize() {
        ServingProperties.ModelsConfig config = properties.getModels();
        for (ServingProperties.ModelRegistration registration : config.getRegistrations()) {
            register(registration.getId(), registration.getVersion(), registration.getFormat(),
                    registration.getPath(), registration.isCritical());
        }

        find(config.getPrimaryId(), config.getPrimaryVersion())
                .ifPresent(primary -> activeVersions.putIfAbsent(primary.getModelId(), primary.getVersion()));

        LoadingStrategy strategy = config.getLoadingStrategy();
        log.info("Model manager initialized with {} versions, strategy {}", versions.size(), strategy);

        switch (strategy) {
            case EAGER -> loadAll();
            case PROGRESSIVE -> loadProgressively();
            case LAZY -> log.info("Models will load on first request");
        }
    }

    /**
     * Register a model version. Registering an existing version returns it unchanged.
     */
    public ModelVersion register(String modelId, String version, ModelFormat format, String path, boolean critical) {
        if (modelId == null || modelId.isBlank() || version == null || version.isBlank()) {
            throw new IllegalArgumentException("Model id and version are required");
        }
        if (LATEST.equals(version)) {
            throw new IllegalArgumentException("'" + LATEST + "' is an alias, not a version");
        }

        ModelVersion candidate = new ModelVersion(modelId, version, format, path, critical);
        ModelVersion existing = versions.putIfAbsent(candidate.uniqueId(), candidate);
        if (existing != null) {
            log.warn("Model {} already registered", existing.uniqueId());
            return existing;
        }
        log.info("Registered model {} (format: {}, critical: {})", candidate.uniqueId(), format, critical);
        return candidate;
    }

    /**
     * Get a loaded model, loading it first if needed.
     *
     * @param modelId  model id
     * @param version  version or {@value #LATEST}
     * @param critical whether a failure must be surfaced
     * @return loaded model, or empty when a non-critical model is unavailable
     * @throws ModelLoadException if a critical model cannot be loaded
     */
    public Optional<InferenceModel> getModel(String modelId, String version, boolean critical) {
        return acquire(modelId, () -> version, critical, true);
    }

    /**
     * Unload an available version.
     *
     * @return true if a handle was released
     */
    public boolean unload(String modelId, String version) {
        Optional<ModelVersion> registered = find(modelId, version);
        if (registered.isEmpty()) {
            log.warn("Cannot unload unregistered model {}:{}", modelId, version);
            return false;
        }

        ModelVersion modelVersion = registered.get();
        InferenceModel handle = beginUnload(modelVersion);
        if (handle == null) {
            log.warn("Model {} is not loaded, nothing to unload", modelVersion);
            return false;
        }
        finishUnload(modelVersion, handle);
        markNotLoaded(modelVersion);
        log.info("Unloaded model {}", modelVersion.uniqueId());
        return true;
    }

    /**
     * Unload the active version of a model, then load the requested one and make it active.
     * Not atomic: requests arriving in between wait for the new load.
     *
     * @throws ModelLoadException if the requested version cannot be loaded
     */
    public InferenceModel reload(String modelId, String version) {
        ModelVersion target = find(modelId, version).orElseThrow(() -> new ModelLoadException(modelId, version,
                "Model " + modelId + ":" + version + " is not registered"));
        log.info("Reloading {} as {}", modelId, target.uniqueId());

        ModelVersion previous = null;
        InferenceModel previousHandle = null;
        InferenceModel staleHandle;
        CompletableFuture<InferenceModel> loading;
        boolean dispatch = false;
        synchronized (lock) {
            // Switch first: serving resolves the active version under this monitor
            ModelVersion current = activeVersion(modelId).orElse(null);
            activeVersions.put(modelId, target.getVersion());
            if (current != null && current != target) {
                previous = current;
                previousHandle = beginUnload(current);
            }
            staleHandle = beginUnload(target);

            loading = target.getLoading();
            if (loading == null) {
                loading = prepareLoad(target);
                dispatch = true;
            }
        }

        // Old handles are released before the new load starts
        if (previousHandle != null) {
            finishUnload(previous, previousHandle);
            markNotLoaded(previous);
        }
        if (staleHandle != null) {
            finishUnload(target, staleHandle);
        }
        if (dispatch) {
            dispatchLoad(target, loading);
        }
        return await(target, loading, true).orElseThrow();
    }

    /**
     * Hot swap: load the requested version, make it active, then unload the previous one.
     * The previous version keeps serving if the new one fails to load.
     *
     * @throws ModelLoadException if the requested version cannot be loaded
     */
    public InferenceModel swap(String modelId, String version) {
        ModelVersion target = find(modelId, version).orElseThrow(() -> new ModelLoadException(modelId, version,
                "Model " + modelId + ":" + version + " is not registered"));
        InferenceModel model = acquire(modelId, target::getVersion, true, false).orElseThrow();

        String previous;
        synchronized (lock) {
            previous = activeVersions.put(modelId, target.getVersion());
        }
        log.info("Swapped {} from {} to {}", modelId, previous, target.getVersion());
        if (previous != null && !previous.equals(target.getVersion())) {
            unload(modelId, previous);
        }
        return model;
    }

    /**
     * Resolve the serving model: the active primary version, else the fallback model.
     *
     * @throws FallbackExhaustedException if neither can be loaded
     */
    @Override
    public ServingModel servingModel() {
        ServingProperties.ModelsConfig config = properties.getModels();
        String primaryId = config.getPrimaryId();
        Optional<InferenceModel> primary = acquire(primaryId,
                () -> activeVersions.getOrDefault(primaryId, config.getPrimaryVersion()), false, true);
        if (primary.isPresent()) {
            return new ServingModel(primary.get(), false);
        }

        String primaryVersion = activeVersions.getOrDefault(primaryId, config.getPrimaryVersion());

        String fallbackId = config.getFallbackId();
        if (fallbackId == null || fallbackId.isBlank()) {
            throw new FallbackExhaustedException("Primary model " + primaryId + ":" + primaryVersion
                    + " unavailable and no fallback configured");
        }

        Optional<InferenceModel> fallback = acquire(fallbackId,
                () -> activeVersions.getOrDefault(fallbackId, LATEST), false, true);
        if (fallback.isPresent()) {
            log.debug("Serving fallback model {}:{}", fallback.get().modelId(), fallback.get().version());
            return new ServingModel(fallback.get(), true);
        }

        log.error("No available models: primary {}:{} and fallback {} both unavailable",
                primaryId, primaryVersion, fallbackId);
        throw new FallbackExhaustedException("No available models: primary " + primaryId + ":" + primaryVersion
                + " and fallback " + fallbackId + " both unavailable");
    }

    /**
     * Check if every critical model is available.
     *
     * @return readiness
     */
    public boolean isReady() {
        return versions.values().stream()
                .filter(ModelVersion::isCritical)
                .allMatch(v -> v.getState() == ModelState.AVAILABLE);
    }

    /**
     * Get a snapshot of every registered version.
     *
     * @return statuses ordered by model id and version
     */
    public List<ModelStatus> status() {
        return versions.values().stream()
                .sorted(Comparator.comparing(ModelVersion::getModelId)
                        .thenComparing(ModelVersion::getVersion, ModelVersionManager::compareVersions))
                .map(this::toStatus)
                .collect(Collectors.toList());
    }

    /**
     * Get the active version of a model, if one is set.
     */
    public Optional<String> activeVersionOf(String modelId) {
        return Optional.ofNullable(activeVersions.get(modelId));
    }

    @PreDestroy
    public void shutdown() {
        log.info("Releasing loaded models");
        for (ModelVersion modelVersion : versions.values()) {
            InferenceModel handle = beginUnload(modelVersion);
            if (handle != null) {
                finishUnload(modelVersion, handle);
                markNotLoaded(modelVersion);
            }
        }
    }

    /**
     * Compare dotted versions numerically where possible, e.g. 1.10.0 after 1.9.0.
     */
    static int compareVersions(String left, String right) {
        String[] a = left.split("\\.");
        String[] b = right.split("\\.");
        for (int i = 0; i < Math.max(a.length, b.length); i++) {
            String x = i < a.length ? a[i] : "0";
            String y = i < b.length ? b[i] : "0";
            int result;
            try {
                result = Long.compare(Long.parseLong(x), Long.parseLong(y));
            } catch (NumberFormatException e) {
                result = x.compareTo(y);
            }
            if (result != 0) {
                return result;
            }
        }
        return 0;
    }

    private void loadAll() {
        for (ModelVersion modelVersion : byCriticalFirst()) {
            getModel(modelVersion.getModelId(), modelVersion.getVersion(), modelVersion.isCritical());
        }
    }

    /**
     * Start critical loads immediately and the rest once those finish, without blocking startup.
     */
    private void loadProgressively() {
        List<CompletableFuture<InferenceModel>> critical = new ArrayList<>();
        List<ModelVersion> deferred = new ArrayList<>();
        synchronized (lock) {
            for (ModelVersion modelVersion : byCriticalFirst()) {
                if (modelVersion.isCritical()) {
                    critical.add(startLoad(modelVersion));
                } else {
                    deferred.add(modelVersion);
                }
            }
        }

        log.info("Progressive loading: {} critical, {} deferred", critical.size(), deferred.size());
        CompletableFuture.allOf(critical.toArray(new CompletableFuture<?>[0]))
                .handle((ignored, error) -> {
                    if (error != null) {
                        log.error("Critical model loading failed, service is not ready", error);
                    }
                    synchronized (lock) {
                        for (ModelVersion modelVersion : deferred) {
                            if (modelVersion.getState() == ModelState.NOT_LOADED && modelVersion.getLoading() == null) {
                                startLoad(modelVersion);
                            }
                        }
                    }
                    return null;
                });
    }

    private List<ModelVersion> byCriticalFirst() {
        return versions.values().stream()
                .sorted(Comparator.comparing((ModelVersion v) -> !v.isCritical())
                        .thenComparing(ModelVersion::uniqueId))
                .collect(Collectors.toList());
    }

    /**
     * Resolve and load under the monitor, so a concurrent reload is seen either entirely
     * before or entirely after.
     */
    private Optional<InferenceModel> acquire(String modelId, Supplier<String> version, boolean critical,
                                             boolean honorBackoff) {
        ModelVersion modelVersion;
        CompletableFuture<InferenceModel> loading;
        synchronized (lock) {
            String requested = version.get();
            Optional<ModelVersion> registered = find(modelId, requested);
            if (registered.isEmpty()) {
                return unavailable(new ModelLoadException(modelId, requested,
                        "Model " + modelId + ":" + requested + " is not registered"), critical);
            }

            modelVersion = registered.get();
            if (modelVersion.getState() == ModelState.AVAILABLE) {
                return Optional.of(modelVersion.getModel());
            }
            loading = modelVersion.getLoading();
            if (loading == null) {
                if (honorBackoff && inBackoff(modelVersion)) {
                    return unavailable(new ModelLoadException(modelId, modelVersion.getVersion(),
                            "Model " + modelVersion.uniqueId() + " failed to load, retrying after "
                                    + modelVersion.getFailedAt().plus(properties.getModels().getRetryBackoff())),
                            critical);
                }
                loading = startLoad(modelVersion);
            }
        }
        return await(modelVersion, loading, critical);
    }

    private boolean inBackoff(ModelVersion modelVersion) {
        Instant failedAt = modelVersion.getFailedAt();
        return modelVersion.getState() == ModelState.ERROR
                && failedAt != null
                && clock.instant().isBefore(failedAt.plus(properties.getModels().getRetryBackoff()));
    }

    /**
     * Must hold {@link #lock}.
     */
    private CompletableFuture<InferenceModel> startLoad(ModelVersion modelVersion) {
        CompletableFuture<InferenceModel> loading = prepareLoad(modelVersion);
        dispatchLoad(modelVersion, loading);
        return loading;
    }

    /**
     * Must hold {@link #lock}. Callers arriving from here on wait on the returned future.
     */
    private CompletableFuture<InferenceModel> prepareLoad(ModelVersion modelVersion) {
        modelVersion.setState(ModelState.LOADING);
        modelVersion.setErrorMessage(null);
        CompletableFuture<InferenceModel> loading = new CompletableFuture<>();
        modelVersion.setLoading(loading);
        log.info("Loading model {}", modelVersion.uniqueId());
        return loading;
    }

    private void dispatchLoad(ModelVersion modelVersion, CompletableFuture<InferenceModel> loading) {
        try {
            loadingExecutor.execute(() -> load(modelVersion, loading));
        } catch (RuntimeException e) {
            synchronized (lock) {
                modelVersion.setState(ModelState.ERROR);
                modelVersion.setErrorMessage(e.getMessage());
                modelVersion.setFailedAt(clock.instant());
                modelVersion.setLoading(null);
            }
            loading.completeExceptionally(new ModelLoadException(modelVersion.getModelId(),
                    modelVersion.getVersion(), "Could not schedule load of " + modelVersion.uniqueId(), e));
        }
    }

    private void load(ModelVersion modelVersion, CompletableFuture<InferenceModel> loading) {
        long startTime = System.nanoTime();
        try {
            ModelLoader loader = loaders.get(modelVersion.getFormat());
            if (loader == null) {
                throw new ModelLoadException(modelVersion.getModelId(), modelVersion.getVersion(),
                        "No loader for format " + modelVersion.getFormat());
            }

            InferenceModel model = new GuardedInferenceModel(optimize(loader.load(modelVersion)));
            Duration loadTime = Duration.ofNanos(System.nanoTime() - startTime);
            synchronized (lock) {
                modelVersion.setModel(model);
                modelVersion.setLoadTime(loadTime);
                modelVersion.setLoadedAt(clock.instant());
                modelVersion.setState(ModelState.AVAILABLE);
                modelVersion.setFailedAt(null);
                modelVersion.setLoading(null);
            }
            metrics.modelLoad(modelVersion.getModelId(), modelVersion.getVersion(), "success");
            log.info("Model {} available in {}ms (optimized: {})", modelVersion.uniqueId(),
                    loadTime.toMillis(), model.isOptimized());
            loading.complete(model);

        } catch (RuntimeException | Error e) {
            // The future always completes, linkage and native errors included
            ModelLoadException failure = e instanceof ModelLoadException loadException
                    ? loadException
                    : new ModelLoadException(modelVersion.getModelId(), modelVersion.getVersion(),
                    "Failed to load " + modelVersion.uniqueId() + ": " + e, e);
            boolean repeated;
            synchronized (lock) {
                repeated = modelVersion.getFailedAt() != null;
                modelVersion.setState(ModelState.ERROR);
                modelVersion.setErrorMessage(failure.getMessage());
                modelVersion.setLoadTime(Duration.ofNanos(System.nanoTime() - startTime));
                modelVersion.setFailedAt(clock.instant());
                modelVersion.setLoading(null);
            }
            metrics.modelLoad(modelVersion.getModelId(), modelVersion.getVersion(), "failure");
            if (repeated) {
                log.warn("Model {} still failing to load: {}", modelVersion.uniqueId(), failure.getMessage());
            } else {
                log.error("Failed to load model {}", modelVersion.uniqueId(), e);
            }
            loading.completeExceptionally(failure);
        }
    }

    private InferenceModel optimize(InferenceModel model) {
        ServingProperties.OptimizationConfig config = properties.getOptimization();
        if (!config.isEnabled()) {
            return model;
        }

        if (config.isPruningEnabled()) {
            optimizer.prune(model, config.getPruningAmount());
        }

        InferenceModel serving = model;
        Optional<InferenceModel> compiled = optimizer.compile(model);
        if (compiled.isPresent() && compiled.get() != model) {
            model.close();
            serving = compiled.get();
        }

        optimizer.warmUp(serving, config.getWarmUpIterations());
        return serving;
    }

    private Optional<InferenceModel> await(ModelVersion modelVersion, CompletableFuture<InferenceModel> loading,
                                           boolean critical) {
        Duration timeout = properties.getModels().getLoadTimeout();
        try {
            return Optional.of(loading.get(timeout.toMillis(), TimeUnit.MILLISECONDS));
        } catch (TimeoutException e) {
            return unavailable(new ModelLoadException(modelVersion.getModelId(), modelVersion.getVersion(),
                    "Timed out after " + timeout.toSeconds() + "s waiting for " + modelVersion.uniqueId(), e), critical);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return unavailable(new ModelLoadException(modelVersion.getModelId(), modelVersion.getVersion(),
                    "Interrupted while waiting for " + modelVersion.uniqueId(), e), critical);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            ModelLoadException failure = cause instanceof ModelLoadException loadException
                    ? loadException
                    : new ModelLoadException(modelVersion.getModelId(), modelVersion.getVersion(),
                    "Failed to load " + modelVersion.uniqueId(), cause);
            return unavailable(failure, critical);
        }
    }

    private Optional<InferenceModel> unavailable(ModelLoadException failure, boolean critical) {
        if (critical) {
            throw failure;
        }
        log.warn("Non-critical model unavailable, continuing without it: {}", failure.getMessage());
        return Optional.empty();
    }

    private Optional<ModelVersion> find(String modelId, String version) {
        if (LATEST.equals(version)) {
            return versions.values().stream()
                    .filter(v -> v.getModelId().equals(modelId))
                    .max(Comparator.comparing(ModelVersion::getVersion, ModelVersionManager::compareVersions));
        }
        return Optional.ofNullable(versions.get(ModelVersion.key(modelId, version)));
    }

    private Optional<ModelVersion> activeVersion(String modelId) {
        return activeVersionOf(modelId).flatMap(version -> find(modelId, version));
    }

    /**
     * Mark an available version as unloading and detach its handle.
     *
     * @return detached handle, null if the version was not available
     */
    private InferenceModel beginUnload(ModelVersion modelVersion) {
        synchronized (lock) {
            if (modelVersion.getState() != ModelState.AVAILABLE) {
                return null;
            }
            modelVersion.setState(ModelState.UNLOADING);
            InferenceModel handle = modelVersion.getModel();
            modelVersion.setModel(null);
            return handle;
        }
    }

    /**
     * Close outside the monitor; waits for in-flight predictions on this handle.
     */
    private void finishUnload(ModelVersion modelVersion, InferenceModel handle) {
        log.info("Unloading model {}", modelVersion.uniqueId());
        handle.close();
        metrics.modelLoad(modelVersion.getModelId(), modelVersion.getVersion(), "unloaded");
    }

    /**
     * A load started while unloading wins over the unload.
     */
    private void markNotLoaded(ModelVersion modelVersion) {
        synchronized (lock) {
            if (modelVersion.getState() == ModelState.UNLOADING) {
                modelVersion.setState(ModelState.NOT_LOADED);
            }
        }
    }

    private ModelStatus toStatus(ModelVersion modelVersion) {
        InferenceModel model = modelVersion.getModel();
        return ModelStatus.builder()
                .modelId(modelVersion.getModelId())
                .version(modelVersion.getVersion())
                .state(modelVersion.getState())
                .critical(modelVersion.isCritical())
                .active(modelVersion.getVersion().equals(activeVersions.get(modelVersion.getModelId())))
                .optimized(model != null && model.isOptimized())
                .loadTime(modelVersion.getLoadTime())
                .loadedAt(modelVersion.getLoadedAt())
                .errorMessage(modelVersion.getErrorMessage())
                .build();
    }
}
