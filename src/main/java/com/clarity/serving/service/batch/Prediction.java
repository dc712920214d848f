package com.clarity.serving.service.batch;

import com.clarity.serving.service.inference.ModelOutput;
import lombok.Value;

/**
 * Model output with the identity of the model that produced it.
 */
@Value
public class Prediction {

    ModelOutput output;
    String modelId;
    String version;
    boolean optimized;
    boolean fallback;
}
