package com.clarity.serving.service.cache;

import com.clarity.serving.config.ServingProperties;
import com.clarity.serving.model.AnalysisResult;
import com.clarity.serving.model.CachedAnalysis;
import com.clarity.serving.model.dto.CacheStatistics;
import com.clarity.serving.monitor.ServingMetrics;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Cache;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.atomic.LongAdder;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

/**
 * Fingerprint-keyed store of analysis results with TTL.
 *
 * Entries are kept as GZIP-compressed JSON. An entry is valid while
 * {@code now - createdAt < ttl}; anything expired or undecodable reads as a miss
 * and undecodable entries are evicted.
 */
@Slf4j
@Component
public class ResultCache {

    private static final int KEY_LOG_LENGTH = 8;

    private final Cache<String, byte[]> store;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final Duration ttl;
    private final ServingMetrics metrics;

    private final LongAdder hits = new LongAdder();
    private final LongAdder misses = new LongAdder();
    private final LongAdder corruptEvictions = new LongAdder();

    @Autowired
    public ResultCache(
            Cache<String, byte[]> resultStore,
            ObjectMapper objectMapper,
            Clock clock,
            ServingProperties properties,
            ServingMetrics metrics) {
        this(resultStore, objectMapper, clock, properties.getCache().getTtl(), metrics);
    }

    public ResultCache(
            Cache<String, byte[]> store,
            ObjectMapper objectMapper,
            Clock clock,
            Duration ttl,
            ServingMetrics metrics) {
        this.store = store;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.ttl = ttl;
        this.metrics = metrics;
    }

    /**
     * Get cached result by fingerprint.
     *
     * @param fingerprint request fingerprint
     * @return cached result if present, decodable and within TTL
     */
    public Optional<AnalysisResult> get(String fingerprint) {
        byte[] compressed = store.getIfPresent(fingerprint);
        if (compressed == null) {
            return miss(fingerprint);
        }

        Optional<CachedAnalysis> cached = decode(fingerprint, compressed);
        if (cached.isEmpty()) {
            store.invalidate(fingerprint);
            corruptEvictions.increment();
            metrics.cacheCorruption();
            return miss(fingerprint);
        }

        if (!isValid(cached.get().getCreatedAt())) {
            store.invalidate(fingerprint);
            log.debug("Cache entry expired: {}", shortKey(fingerprint));
            return miss(fingerprint);
        }

        hits.increment();
        metrics.cacheHit();
        log.debug("Cache hit: {}", shortKey(fingerprint));
        return Optional.of(cached.get().getResult());
    }

    /**
     * Store result, replacing any entry for the same fingerprint with a fresh timestamp.
     */
    public void put(String fingerprint, AnalysisResult result) {
        CachedAnalysis cached = CachedAnalysis.builder()
                .result(result)
                .createdAt(clock.instant())
                .build();
        try {
            store.put(fingerprint, compress(cached));
            log.debug("Cached analysis result {}", shortKey(fingerprint));
        } catch (IOException e) {
            // Cache failures shouldn't break requests
            log.warn("Failed to cache analysis result {}", shortKey(fingerprint), e);
        }
    }

    public void invalidate(String fingerprint) {
        store.invalidate(fingerprint);
    }

    public void clear() {
        store.invalidateAll();
        log.info("Analysis cache cleared");
    }

    public CacheStatistics statistics() {
        store.cleanUp();
        long hitCount = hits.sum();
        long missCount = misses.sum();
        long total = hitCount + missCount;

        Instant now = clock.instant();
        double oldestAge = 0.0;
        for (byte[] compressed : store.asMap().values()) {
            Optional<CachedAnalysis> cached = tryDecompress(compressed);
            if (cached.isPresent() && cached.get().getCreatedAt() != null) {
                double age = Duration.between(cached.get().getCreatedAt(), now).toMillis() / 1000.0;
                oldestAge = Math.max(oldestAge, age);
            }
        }

        return CacheStatistics.builder()
                .size(store.estimatedSize())
                .hits(hitCount)
                .misses(missCount)
                .hitRatio(total == 0 ? 0.0 : (double) hitCount / total)
                .corruptEvictions(corruptEvictions.sum())
                .oldestEntryAgeSeconds(oldestAge)
                .build();
    }

    private Optional<AnalysisResult> miss(String fingerprint) {
        misses.increment();
        metrics.cacheMiss();
        log.debug("Cache miss: {}", shortKey(fingerprint));
        return Optional.empty();
    }

    private boolean isValid(Instant createdAt) {
        return Duration.between(createdAt, clock.instant()).compareTo(ttl) < 0;
    }

    private Optional<CachedAnalysis> decode(String fingerprint, byte[] compressed) {
        Optional<CachedAnalysis> cached = tryDecompress(compressed);
        if (cached.isEmpty()) {
            log.warn("Cache corruption detected for key {}, evicting", shortKey(fingerprint));
            return Optional.empty();
        }
        if (cached.get().getResult() == null || cached.get().getCreatedAt() == null) {
            log.warn("Cache entry {} is missing fields, evicting", shortKey(fingerprint));
            return Optional.empty();
        }
        return cached;
    }

    private Optional<CachedAnalysis> tryDecompress(byte[] compressed) {
        try {
            return Optional.ofNullable(decompress(compressed));
        } catch (IOException | RuntimeException e) {
            log.debug("Undecodable cache entry", e);
            return Optional.empty();
        }
    }

    /**
     * Compress cached analysis using GZIP.
     */
    private byte[] compress(CachedAnalysis cached) throws IOException {
        ByteArrayOutputStream baos = new ByteArrayOutputStream();
        try (GZIPOutputStream gzipOut = new GZIPOutputStream(baos)) {
            gzipOut.write(objectMapper.writeValueAsBytes(cached));
        }
        return baos.toByteArray();
    }

    /**
     * Decompress and deserialize cached analysis.
     */
    private CachedAnalysis decompress(byte[] compressed) throws IOException {
        try (GZIPInputStream gzipIn = new GZIPInputStream(new ByteArrayInputStream(compressed))) {
            return objectMapper.readValue(gzipIn.readAllBytes(), CachedAnalysis.class);
        }
    }

    private static String shortKey(String fingerprint) {
        return fingerprint.length() > KEY_LOG_LENGTH ? fingerprint.substring(0, KEY_LOG_LENGTH) : fingerprint;
    }
}
