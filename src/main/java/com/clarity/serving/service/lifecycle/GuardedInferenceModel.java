package com.clarity.serving.service.lifecycle;

import com.clarity.serving.exception.ModelUnloadedException;
import com.clarity.serving.service.inference.InferenceModel;
import com.clarity.serving.service.inference.ModelOutput;

import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Handle given out by the manager. Predictions share the handle; closing waits for
 * in-flight predictions and rejects later ones.
 */
class GuardedInferenceModel implements InferenceModel {

    private final InferenceModel delegate;
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private boolean closed;

    GuardedInferenceModel(InferenceModel delegate) {
        this.delegate = delegate;
    }

    @Override
    public ModelOutput predict(float[] window) {
        lock.readLock().lock();
        try {
            if (closed) {
                throw new ModelUnloadedException("Model " + delegate.modelId() + ":" + delegate.version()
                        + " was unloaded");
            }
            return delegate.predict(window);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void close() {
        lock.writeLock().lock();
        try {
            if (!closed) {
                closed = true;
                delegate.close();
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public String modelId() {
        return delegate.modelId();
    }

    @Override
    public String version() {
        return delegate.version();
    }

    @Override
    public boolean isOptimized() {
        return delegate.isOptimized();
    }
}
