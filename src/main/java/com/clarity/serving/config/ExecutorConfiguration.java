package com.clarity.serving.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Thread pools for batch dispatch, inference and background model loading.
 */
@Configuration
public class ExecutorConfiguration {

    public static final String DISPATCH_EXECUTOR = "batchDispatchExecutor";
    public static final String INFERENCE_EXECUTOR = "inferenceExecutor";
    public static final String LOADING_EXECUTOR = "modelLoadingExecutor";

    private final ServingProperties properties;

    public ExecutorConfiguration(ServingProperties properties) {
        this.properties = properties;
    }

    @Bean(name = DISPATCH_EXECUTOR, destroyMethod = "shutdown")
    public ExecutorService batchDispatchExecutor() {
        return Executors.newSingleThreadExecutor(daemonThreads("batch-dispatch"));
    }

    @Bean(name = INFERENCE_EXECUTOR, destroyMethod = "shutdown")
    public ExecutorService inferenceExecutor() {
        return Executors.newFixedThreadPool(
                properties.getBatch().getWorkerThreads(), daemonThreads("inference-worker"));
    }

    @Bean(name = LOADING_EXECUTOR, destroyMethod = "shutdown")
    public ExecutorService modelLoadingExecutor() {
        return Executors.newFixedThreadPool(2, daemonThreads("model-loader"));
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
