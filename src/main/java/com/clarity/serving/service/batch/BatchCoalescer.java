package com.clarity.serving.service.batch;

import com.clarity.serving.config.ExecutorConfiguration;
import com.clarity.serving.config.ServingProperties;
import com.clarity.serving.exception.ModelUnloadedException;
import com.clarity.serving.monitor.ServingMetrics;
import com.clarity.serving.service.inference.InferenceModel;
import com.clarity.serving.service.inference.ModelOutput;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Coalesces concurrent inference requests into bounded batches.
 *
 * Submissions go to an unbounded FIFO queue. A single drain loop on the dispatch executor
 * takes up to {@code maxBatchSize} requests at a time, resolves the serving model once for
 * the batch and runs every request concurrently on the inference executor. Each request's
 * future completes on its own, so one failure never affects the rest of the batch. A request
 * whose handle was unloaded before it ran is retried once on the model serving at that point.
 * The next batch starts when the current one has fully completed; the loop exits when the
 * queue is empty and restarts on the next submission.
 *
 * Admitted requests are not cancellable.
 */
@Slf4j
@Component
public class BatchCoalescer {

    private final ServingModelProvider modelProvider;
    private final Executor dispatchExecutor;
    private final Executor inferenceExecutor;
    private final int maxBatchSize;
    private final ServingMetrics metrics;

    private final ReentrantLock queueLock = new ReentrantLock();
    private final Deque<PendingRequest> queue = new ArrayDeque<>();
    private final AtomicBoolean draining = new AtomicBoolean(false);

    @Autowired
    public BatchCoalescer(ServingModelProvider modelProvider,
                          @Qualifier(ExecutorConfiguration.DISPATCH_EXECUTOR) Executor dispatchExecutor,
                          @Qualifier(ExecutorConfiguration.INFERENCE_EXECUTOR) Executor inferenceExecutor,
                          ServingProperties properties,
                          ServingMetrics metrics) {
        this(modelProvider, dispatchExecutor, inferenceExecutor, properties.getBatch().getMaxBatchSize(), metrics);
    }

    public BatchCoalescer(ServingModelProvider modelProvider, Executor dispatchExecutor,
                          Executor inferenceExecutor, int maxBatchSize, ServingMetrics metrics) {
        if (maxBatchSize <= 0) {
            throw new IllegalArgumentException("maxBatchSize must be positive: " + maxBatchSize);
        }
        this.modelProvider = modelProvider;
        this.dispatchExecutor = dispatchExecutor;
        this.inferenceExecutor = inferenceExecutor;
        this.maxBatchSize = maxBatchSize;
        this.metrics = metrics;
    }

    /**
     * Queue a normalized window for inference.
     *
     * @param window normalized window
     * @return future completed with the prediction, or exceptionally with this request's failure
     */
    public CompletableFuture<Prediction> submit(float[] window) {
        PendingRequest request = new PendingRequest(window);
        queueLock.lock();
        try {
            queue.addLast(request);
        } finally {
            queueLock.unlock();
        }
        scheduleDrain();
        return request.promise;
    }

    /**
     * Get number of requests waiting for a batch.
     *
     * @return queued request count
     */
    public int pendingCount() {
        queueLock.lock();
        try {
            return queue.size();
        } finally {
            queueLock.unlock();
        }
    }

    private void scheduleDrain() {
        if (!draining.compareAndSet(false, true)) {
            return;
        }
        try {
            dispatchExecutor.execute(this::drain);
        } catch (RejectedExecutionException e) {
            draining.set(false);
            log.error("Batch dispatcher rejected drain, failing queued requests", e);
            failQueued(e);
        }
    }

    private void drain() {
        try {
            List<PendingRequest> batch = nextBatch();
            while (!batch.isEmpty()) {
                runBatch(batch);
                batch = nextBatch();
            }
        } finally {
            draining.set(false);
        }

        // A submission may have enqueued after the last empty poll but before the flag reset
        if (pendingCount() > 0) {
            scheduleDrain();
        }
    }

    private List<PendingRequest> nextBatch() {
        queueLock.lock();
        try {
            int size = Math.min(maxBatchSize, queue.size());
            List<PendingRequest> batch = new ArrayList<>(size);
            for (int i = 0; i < size; i++) {
                batch.add(queue.pollFirst());
            }
            return batch;
        } finally {
            queueLock.unlock();
        }
    }

    private void runBatch(List<PendingRequest> batch) {
        metrics.batch(batch.size());
        long startTime = System.nanoTime();

        ServingModel serving;
        try {
            serving = modelProvider.servingModel();
        } catch (RuntimeException e) {
            log.error("No model available for batch of {} requests", batch.size(), e);
            batch.forEach(request -> request.promise.completeExceptionally(e));
            return;
        }

        List<CompletableFuture<Void>> tasks = new ArrayList<>(batch.size());
        for (PendingRequest request : batch) {
            try {
                tasks.add(CompletableFuture
                        .supplyAsync(() -> predict(serving, request.window), inferenceExecutor)
                        .handle((prediction, error) -> {
                            if (error != null) {
                                request.promise.completeExceptionally(unwrap(error));
                            } else {
                                request.promise.complete(prediction);
                            }
                            return null;
                        }));
            } catch (RejectedExecutionException e) {
                request.promise.completeExceptionally(e);
            }
        }

        CompletableFuture.allOf(tasks.toArray(new CompletableFuture<?>[0])).join();

        long elapsedMs = (System.nanoTime() - startTime) / 1_000_000;
        log.debug("Processed batch of {} on {}:{} in {}ms", batch.size(),
                serving.getModel().modelId(), serving.getModel().version(), elapsedMs);
    }

    private Prediction predict(ServingModel serving, float[] window) {
        try {
            return predictOn(serving, window);
        } catch (ModelUnloadedException e) {
            // Handle released by a reload after the batch resolved it; blocks while the new version loads
            ServingModel current = modelProvider.servingModel();
            log.debug("{}, retrying on {}:{}", e.getMessage(),
                    current.getModel().modelId(), current.getModel().version());
            return predictOn(current, window);
        }
    }

    private Prediction predictOn(ServingModel serving, float[] window) {
        InferenceModel model = serving.getModel();
        long startTime = System.nanoTime();
        boolean success = false;
        try {
            ModelOutput output = model.predict(window);
            success = true;
            return new Prediction(output, model.modelId(), model.version(), model.isOptimized(), serving.isFallback());
        } finally {
            metrics.inference(model.modelId(), model.version(), System.nanoTime() - startTime, success);
        }
    }

    private void failQueued(Throwable cause) {
        List<PendingRequest> batch = nextBatch();
        while (!batch.isEmpty()) {
            batch.forEach(request -> request.promise.completeExceptionally(cause));
            batch = nextBatch();
        }
    }

    private static Throwable unwrap(Throwable error) {
        if (error instanceof CompletionException && error.getCause() != null) {
            return error.getCause();
        }
        return error;
    }

    private static final class PendingRequest {
        private final float[] window;
        private final CompletableFuture<Prediction> promise = new CompletableFuture<>();

        private PendingRequest(float[] window) {
            this.window = window;
        }
    }
}
