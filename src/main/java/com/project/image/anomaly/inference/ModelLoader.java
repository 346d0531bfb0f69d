package com.project.image.anomaly.inference;

import java.nio.file.Path;

@FunctionalInterface
public interface ModelLoader {
    InferenceAdapter load(Path modelPath);
}
