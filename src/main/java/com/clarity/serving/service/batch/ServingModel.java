package com.clarity.serving.service.batch;

import com.clarity.serving.service.inference.InferenceModel;
import lombok.Value;

@Value
public class ServingModel {

    InferenceModel model;

    /**
     * Served by the fallback model because the primary is unavailable.
     */
    boolean fallback;
}
