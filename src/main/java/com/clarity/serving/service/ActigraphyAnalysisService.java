package com.clarity.serving.service;

import com.clarity.serving.config.ServingProperties;
import com.clarity.serving.exception.InferenceTimeoutException;
import com.clarity.serving.exception.InvalidInputException;
import com.clarity.serving.model.ActigraphyDataPoint;
import com.clarity.serving.model.ActigraphyInput;
import com.clarity.serving.model.AnalysisResult;
import com.clarity.serving.model.dto.ServingStatus;
import com.clarity.serving.service.batch.BatchCoalescer;
import com.clarity.serving.service.cache.FingerprintGenerator;
import com.clarity.serving.service.cache.ResultCache;
import com.clarity.serving.service.lifecycle.ModelVersionManager;
import com.clarity.serving.service.window.ActivityStandardizer;
import com.clarity.serving.service.window.WeekSelection;
import com.clarity.serving.service.window.WindowNormalizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;

/**
 * Entry point for actigraphy analysis.
 *
 * Flow: validate, fingerprint, check cache, standardize, normalize to the model window,
 * batch inference, assemble, store. Results produced by the fallback model are returned but
 * never cached. Every returned future fails with {@link InferenceTimeoutException} once
 * {@code clarity.batch.request-timeout} passes without a result.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ActigraphyAnalysisService {

    private final ServingProperties properties;
    private final WindowNormalizer windowNormalizer;
    private final ActivityStandardizer standardizer;
    private final FingerprintGenerator fingerprintGenerator;
    private final ResultCache resultCache;
    private final BatchCoalescer batchCoalescer;
    private final ModelVersionManager modelManager;
    private final AnalysisAssembler assembler;
    private final Clock clock;

    public CompletableFuture<AnalysisResult> analyze(ActigraphyInput input) {
        return analyze(input, true);
    }

    /**
     * Analyze the most recent week of a series.
     *
     * @param input    validated at this boundary
     * @param useCache whether to read and write the result cache
     * @return future completed with the analysis, or exceptionally with the inference failure
     * @throws InvalidInputException if the input is malformed
     */
    public CompletableFuture<AnalysisResult> analyze(ActigraphyInput input, boolean useCache) {
        validate(input);
        float[] values = input.values();
        if (values.length == 0) {
            log.warn("Empty series for user {}, analysing a fill-only window", input.getUserId());
        }

        boolean caching = useCache && properties.getCache().isEnabled();
        String fingerprint = caching ? fingerprintGenerator.generate(input.getUserId(), values) : null;
        if (fingerprint != null) {
            Optional<AnalysisResult> cached = resultCache.get(fingerprint);
            if (cached.isPresent()) {
                return CompletableFuture.completedFuture(cached.get().asCacheHit());
            }
        }

        float[] window = normalize(values);
        return withTimeout(batchCoalescer.submit(window), input.getUserId())
                .thenApply(prediction -> {
                    AnalysisResult result = assembler.assemble(input.getUserId(), prediction, clock.instant());
                    if (fingerprint != null && !prediction.isFallback()) {
                        resultCache.put(fingerprint, result);
                    }
                    return result;
                });
    }

    /**
     * Analyze every complete week of a series, oldest first. The partial leading week is
     * dropped; a series shorter than one week yields no results. Not cached.
     */
    public CompletableFuture<List<AnalysisResult>> analyzeWeeks(ActigraphyInput input) {
        validate(input);
        ServingProperties.WindowConfig config = properties.getWindow();

        float[] values = input.values();
        if (config.isStandardize()) {
            values = standardizer.standardize(values);
        }
        List<float[]> weeks = windowNormalizer.sliceToWeeks(values, config.getTargetLength(), WeekSelection.ALL);
        log.info("Analyzing {} complete weeks for user {}", weeks.size(), input.getUserId());

        Instant analysisTimestamp = clock.instant();
        List<CompletableFuture<AnalysisResult>> results = new ArrayList<>(weeks.size());
        for (float[] week : weeks) {
            results.add(batchCoalescer.submit(week)
                    .thenApply(prediction -> assembler.assemble(input.getUserId(), prediction, analysisTimestamp)));
        }

        CompletableFuture<List<AnalysisResult>> all = CompletableFuture.allOf(results.toArray(new CompletableFuture<?>[0]))
                .thenApply(ignored -> results.stream()
                        .map(CompletableFuture::join)
                        .collect(Collectors.toList()));
        return withTimeout(all, input.getUserId());
    }

    /**
     * Reload the primary model at the given version. Cached results are dropped.
     */
    public void reloadModel(String version) {
        String primaryId = properties.getModels().getPrimaryId();
        modelManager.reload(primaryId, version);
        resultCache.clear();
        log.info("Primary model {} reloaded at version {}", primaryId, version);
    }

    /**
     * Hot swap the primary model to the given version. Cached results are dropped.
     */
    public void swapModel(String version) {
        String primaryId = properties.getModels().getPrimaryId();
        modelManager.swap(primaryId, version);
        resultCache.clear();
        log.info("Primary model {} swapped to version {}", primaryId, version);
    }

    public ServingStatus status() {
        String primaryId = properties.getModels().getPrimaryId();
        return ServingStatus.builder()
                .ready(modelManager.isReady())
                .activeModelId(primaryId)
                .activeVersion(modelManager.activeVersionOf(primaryId).orElse(null))
                .models(modelManager.status())
                .cache(resultCache.statistics())
                .pendingRequests(batchCoalescer.pendingCount())
                .build();
    }

    /**
     * Bound a pending result by the request timeout. The underlying work is not cancelled.
     */
    private <T> CompletableFuture<T> withTimeout(CompletableFuture<T> pending, String userId) {
        Duration timeout = properties.getBatch().getRequestTimeout();
        CompletableFuture<T> bounded = new CompletableFuture<>();
        pending.orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS).whenComplete((value, error) -> {
            if (error == null) {
                bounded.complete(value);
                return;
            }
            Throwable cause = error instanceof CompletionException && error.getCause() != null
                    ? error.getCause()
                    : error;
            if (cause instanceof TimeoutException) {
                log.warn("Analysis for user {} timed out after {}ms", userId, timeout.toMillis());
                bounded.completeExceptionally(new InferenceTimeoutException(
                        "Analysis for user " + userId + " timed out after " + timeout.toMillis() + "ms", cause));
            } else {
                bounded.completeExceptionally(cause);
            }
        });
        return bounded;
    }

    float[] normalize(float[] values) {
        ServingProperties.WindowConfig config = properties.getWindow();
        float[] standardized = config.isStandardize() ? standardizer.standardize(values) : values;
        return windowNormalizer.prepare(standardized, config.getTargetLength(), config.getFillValue());
    }

    void validate(ActigraphyInput input) {
        if (input == null) {
            throw new InvalidInputException("Input is required");
        }
        if (input.getUserId() == null || input.getUserId().isBlank()) {
            throw new InvalidInputException("User id is required");
        }
        if (input.getDataPoints() == null) {
            throw new InvalidInputException("Data points are required");
        }
        if (!(input.getSamplingRate() > 0.0)) {
            throw new InvalidInputException("Sampling rate must be positive, got " + input.getSamplingRate());
        }

        int maxDataPoints = properties.getWindow().getMaxDataPoints();
        List<ActigraphyDataPoint> points = input.getDataPoints();
        if (points.size() > maxDataPoints) {
            throw new InvalidInputException("Too many data points: " + points.size() + " (max " + maxDataPoints + ")");
        }

        Instant previous = null;
        for (int i = 0; i < points.size(); i++) {
            ActigraphyDataPoint point = points.get(i);
            if (point == null || point.getTimestamp() == null) {
                throw new InvalidInputException("Data point " + i + " has no timestamp");
            }
            if (previous != null && point.getTimestamp().isBefore(previous)) {
                throw new InvalidInputException("Data point " + i + " is out of chronological order");
            }
            previous = point.getTimestamp();
        }
    }
}
