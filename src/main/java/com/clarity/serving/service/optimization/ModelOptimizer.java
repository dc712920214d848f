package com.clarity.serving.service.optimization;

import com.clarity.serving.config.ServingProperties;
import com.clarity.serving.service.inference.CompilableModel;
import com.clarity.serving.service.inference.InferenceModel;
import com.clarity.serving.service.inference.PrunableModel;
import com.clarity.serving.service.window.WindowNormalizer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Best-effort performance pass over loaded models: pruning, compilation and warm-up.
 * Nothing here is required for correct serving; every failure leaves the model as it was.
 */
@Slf4j
@Service
public class ModelOptimizer {

    private static final int WARM_UP_MINUTES = 1440;

    private final Path optimizedModelDir;
    private final WindowNormalizer windowNormalizer;

    @Autowired
    public ModelOptimizer(ServingProperties properties, WindowNormalizer windowNormalizer) {
        this(toPath(properties.getOptimization().getOptimizedModelDir()), windowNormalizer);
    }

    public ModelOptimizer(Path optimizedModelDir, WindowNormalizer windowNormalizer) {
        this.optimizedModelDir = optimizedModelDir;
        this.windowNormalizer = windowNormalizer;
    }

    /**
     * Compile a model into a faster handle.
     *
     * @param model loaded model
     * @return compiled handle, or empty when the model cannot be compiled
     */
    public Optional<InferenceModel> compile(InferenceModel model) {
        if (!(model instanceof CompilableModel compilable)) {
            log.debug("Model {}:{} does not support compilation", model.modelId(), model.version());
            return Optional.empty();
        }
        if (model.isOptimized()) {
            return Optional.of(model);
        }

        long startTime = System.nanoTime();
        try {
            Path outputDir = prepareOutputDir();
            InferenceModel compiled = compilable.compile(outputDir);
            long elapsedMs = (System.nanoTime() - startTime) / 1_000_000;
            log.info("Compiled model {}:{} in {}ms", model.modelId(), model.version(), elapsedMs);
            return Optional.of(compiled);
        } catch (RuntimeException e) {
            log.warn("Compilation failed for {}:{}, serving uncompiled model",
                    model.modelId(), model.version(), e);
            return Optional.empty();
        }
    }

    /**
     * L1 magnitude pruning, applied at most once per model.
     * Attention layers lose {@code amount} of their weights, feed-forward layers half of that.
     *
     * @return true if pruning was applied by this call
     */
    public boolean prune(InferenceModel model, double amount) {
        if (!(model instanceof PrunableModel prunable)) {
            log.debug("Model {}:{} does not expose weights, skipping pruning", model.modelId(), model.version());
            return false;
        }
        if (prunable.isPruned()) {
            log.debug("Model {}:{} already pruned", model.modelId(), model.version());
            return false;
        }
        if (amount <= 0.0 || amount >= 1.0) {
            log.warn("Pruning amount {} out of range (0, 1), skipping", amount);
            return false;
        }

        log.info("Applying magnitude pruning to {}:{} (amount: {})", model.modelId(), model.version(), amount);
        int layers = 0;
        for (Map.Entry<String, float[]> layer : prunable.weights().entrySet()) {
            String name = layer.getKey().toLowerCase(Locale.ROOT);
            if (name.contains("attention")) {
                pruneSmallest(layer.getValue(), amount);
                layers++;
            } else if (name.contains("feed_forward") || name.contains("ff")) {
                pruneSmallest(layer.getValue(), amount * 0.5);
                layers++;
            }
        }
        prunable.markPruned();
        log.info("Pruned {} layers of {}:{}", layers, model.modelId(), model.version());
        return true;
    }

    /**
     * Run dummy one-day windows through a model.
     *
     * @return latency statistics, {@link WarmUpStats#NONE} when nothing ran
     */
    public WarmUpStats warmUp(InferenceModel model, int iterations) {
        if (iterations <= 0) {
            return WarmUpStats.NONE;
        }
        log.info("Warming up {}:{} with {} iterations", model.modelId(), model.version(), iterations);

        double total = 0.0;
        double min = Double.MAX_VALUE;
        double max = 0.0;
        int completed = 0;
        for (int i = 0; i < iterations; i++) {
            float[] window = windowNormalizer.prepare(dummyDay(i));
            long startTime = System.nanoTime();
            try {
                model.predict(window);
            } catch (RuntimeException e) {
                log.warn("Warm-up iteration {} failed for {}:{}", i + 1, model.modelId(), model.version(), e);
                continue;
            }
            double elapsedMs = (System.nanoTime() - startTime) / 1_000_000.0;
            total += elapsedMs;
            min = Math.min(min, elapsedMs);
            max = Math.max(max, elapsedMs);
            completed++;
        }

        if (completed == 0) {
            return WarmUpStats.NONE;
        }
        WarmUpStats stats = new WarmUpStats(completed, total / completed, min, max);
        log.info("Warm-up completed for {}:{} - mean {}ms", model.modelId(), model.version(),
                String.format(Locale.ROOT, "%.3f", stats.meanMillis()));
        return stats;
    }

    /**
     * Zero the {@code amount} fraction of weights with the smallest magnitude.
     */
    static void pruneSmallest(float[] weights, double amount) {
        int count = (int) Math.round(weights.length * amount);
        if (count <= 0) {
            return;
        }
        float[] magnitudes = new float[weights.length];
        for (int i = 0; i < weights.length; i++) {
            magnitudes[i] = Math.abs(weights[i]);
        }
        Arrays.sort(magnitudes);
        float threshold = magnitudes[count - 1];

        int pruned = 0;
        for (int i = 0; i < weights.length && pruned < count; i++) {
            if (Math.abs(weights[i]) <= threshold) {
                weights[i] = 0.0f;
                pruned++;
            }
        }
    }

    /**
     * Alternating activity levels, one value per minute.
     */
    private static float[] dummyDay(int iteration) {
        float[] day = new float[WARM_UP_MINUTES];
        Arrays.fill(day, 30.0f + 20.0f * (iteration % 2));
        return day;
    }

    private Path prepareOutputDir() {
        if (optimizedModelDir == null) {
            return null;
        }
        try {
            return Files.createDirectories(optimizedModelDir);
        } catch (IOException e) {
            log.warn("Cannot create optimized model directory {}, keeping compiled graph in memory",
                    optimizedModelDir, e);
            return null;
        }
    }

    private static Path toPath(String dir) {
        return dir == null || dir.isBlank() ? null : Path.of(dir);
    }
}
