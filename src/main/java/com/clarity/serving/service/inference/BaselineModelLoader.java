package com.clarity.serving.service.inference;

import com.clarity.serving.model.ModelFormat;
import com.clarity.serving.service.lifecycle.ModelLoader;
import com.clarity.serving.service.lifecycle.ModelVersion;
import org.springframework.stereotype.Component;

@Component
public class BaselineModelLoader implements ModelLoader {

    @Override
    public ModelFormat format() {
        return ModelFormat.BASELINE;
    }

    @Override
    public InferenceModel load(ModelVersion version) {
        return new BaselineActigraphyModel(version.getModelId(), version.getVersion());
    }
}
