package com.clarity.serving.service.inference;

import java.nio.file.Path;

/**
 * Model that can produce a faster, semantically equivalent handle of itself.
 */
public interface CompilableModel extends InferenceModel {

    /**
     * Build the compiled handle. The receiver stays usable.
     *
     * @param outputDir directory for the compiled artifact, or null to keep it in memory only
     * @return compiled handle with {@link #isOptimized()} true
     * @throws com.clarity.serving.exception.CompilationException if compilation fails
     */
    InferenceModel compile(Path outputDir);
}
