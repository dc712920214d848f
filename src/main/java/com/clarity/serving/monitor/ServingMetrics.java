package com.clarity.serving.monitor;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Serving meters. Recording never throws into the caller.
 */
@Slf4j
@Component
public class ServingMetrics {

    private final MeterRegistry meterRegistry;
    private final Counter cacheHits;
    private final Counter cacheMisses;
    private final Counter cacheCorruptions;
    private final DistributionSummary batchSize;

    public ServingMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        this.cacheHits = Counter.builder("clarity.cache.requests").tag("result", "hit").register(meterRegistry);
        this.cacheMisses = Counter.builder("clarity.cache.requests").tag("result", "miss").register(meterRegistry);
        this.cacheCorruptions = Counter.builder("clarity.cache.corrupt").register(meterRegistry);
        this.batchSize = DistributionSummary.builder("clarity.batch.size").register(meterRegistry);
    }

    public void cacheHit() {
        cacheHits.increment();
    }

    public void cacheMiss() {
        cacheMisses.increment();
    }

    public void cacheCorruption() {
        cacheCorruptions.increment();
    }

    public void batch(int size) {
        batchSize.record(size);
    }

    public void inference(String modelId, String version, long elapsedNanos, boolean success) {
        try {
            Timer.builder("clarity.inference.latency")
                    .tag("model", modelId)
                    .tag("version", version)
                    .tag("outcome", success ? "success" : "failure")
                    .register(meterRegistry)
                    .record(elapsedNanos, TimeUnit.NANOSECONDS);
        } catch (RuntimeException e) {
            log.debug("Failed to record inference latency for {}:{}", modelId, version, e);
        }
    }

    public void modelLoad(String modelId, String version, String outcome) {
        try {
            Counter.builder("clarity.model.loads")
                    .tag("model", modelId)
                    .tag("version", version)
                    .tag("outcome", outcome)
                    .register(meterRegistry)
                    .increment();
        } catch (RuntimeException e) {
            log.debug("Failed to record model load for {}:{}", modelId, version, e);
        }
    }
}
