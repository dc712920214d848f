package com.clarity.serving.config;

import com.clarity.serving.model.LoadingStrategy;
import com.clarity.serving.model.ModelFormat;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for Clarity Serving.
 */
@Data
@Component
@ConfigurationProperties(prefix = "clarity")
public class ServingProperties {

    private WindowConfig window = new WindowConfig();
    private CacheConfig cache = new CacheConfig();
    private BatchConfig batch = new BatchConfig();
    private OptimizationConfig optimization = new OptimizationConfig();
    private ModelsConfig models = new ModelsConfig();

    @Data
    public static class WindowConfig {
        /**
         * Samples per model input (one week at one-minute resolution).
         */
        private int targetLength = 10080;
        private float fillValue = 0.0f;
        private boolean standardize = true;
        /**
         * Upper bound on accepted samples per request (two weeks).
         */
        private int maxDataPoints = 20160;
    }

    @Data
    public static class CacheConfig {
        private boolean enabled = true;
        private long maxSize = 10000;
        private Duration ttl = Duration.ofHours(1);
        /**
         * Number of leading and trailing values sampled into the fingerprint.
         */
        private int fingerprintSampleSize = 5;
    }

    @Data
    public static class BatchConfig {
        private int maxBatchSize = 8;
        private int workerThreads = 4;
        /**
         * Longest a caller waits for a result, queueing and inference included.
         */
        private Duration requestTimeout = Duration.ofSeconds(60);
    }

    @Data
    public static class OptimizationConfig {
        private boolean enabled = true;
        private boolean pruningEnabled = false;
        private double pruningAmount = 0.1;
        private int warmUpIterations = 5;
        /**
         * Directory for optimized ONNX graphs; nothing is written when unset.
         */
        private String optimizedModelDir;
    }

    @Data
    public static class ModelsConfig {
        private LoadingStrategy loadingStrategy = LoadingStrategy.PROGRESSIVE;
        private Duration loadTimeout = Duration.ofSeconds(180);
        /**
         * Requests within this window after a failed load skip the retry and go to the fallback.
         */
        private Duration retryBackoff = Duration.ofSeconds(30);
        private String primaryId = "pat";
        private String primaryVersion = "1.1.0";
        /**
         * Model id served when the primary model is unavailable; blank disables fallback.
         */
        private String fallbackId = "baseline";
        private int intraOpThreads = 4;
        private List<ModelRegistration> registrations = new ArrayList<>();
    }

    @Data
    public static class ModelRegistration {
        private String id;
        private String version;
        private String path;
        private ModelFormat format = ModelFormat.ONNX;
        private boolean critical = false;
    }
}
