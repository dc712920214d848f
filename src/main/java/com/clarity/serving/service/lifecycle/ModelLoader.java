package com.clarity.serving.service.lifecycle;

import com.clarity.serving.model.ModelFormat;
import com.clarity.serving.service.inference.InferenceModel;

/**
 * Creates model instances for one artifact format.
 */
public interface ModelLoader {

    /**
     * Get the format this loader handles.
     *
     * @return artifact format
     */
    ModelFormat format();

    /**
     * Load the given version.
     *
     * @param version registered version, path already verified upstream
     * @return loaded model
     * @throws com.clarity.serving.exception.ModelLoadException if the model cannot be created
     */
    InferenceModel load(ModelVersion version);
}
