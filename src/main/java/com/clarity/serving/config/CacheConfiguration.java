package com.clarity.serving.config;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.TimeUnit;

/**
 * Caffeine store backing the inference result cache.
 */
@Configuration
public class CacheConfiguration {

    private final ServingProperties properties;

    public CacheConfiguration(ServingProperties properties) {
        this.properties = properties;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public Cache<String, byte[]> resultStore(Clock clock) {
        return resultStoreBuilder(properties.getCache(), clock).build();
    }

    /**
     * Expired entries are purged during Caffeine's amortized maintenance, which runs on the
     * calling thread so no reaper thread is involved.
     */
    public static Caffeine<Object, Object> resultStoreBuilder(ServingProperties.CacheConfig config, Clock clock) {
        return Caffeine.newBuilder()
                .maximumSize(config.getMaxSize())
                .expireAfterWrite(config.getTtl())
                .ticker(() -> TimeUnit.MILLISECONDS.toNanos(clock.millis()))
                .executor(Runnable::run)
                .recordStats();
    }
}
