package com.project.image.anomaly.inference;

import org.springframework.stereotype.Component;

import java.nio.file.Path;

@Component
public class OnnxModelLoader implements ModelLoader {

    @Override
    public InferenceAdapter load(Path modelPath) {
        return OnnxInferenceAdapter.open(modelPath);
    }
}
