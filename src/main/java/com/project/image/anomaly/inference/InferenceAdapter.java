package com.project.image.anomaly.inference;

import com.project.image.anomaly.processing.Tensor;

/**
 * Runs the anomaly model: a [1,3,H,W] normalised image tensor in, a [1,1,H,W] anomaly map out.
 * Implementations must be deterministic for a fixed model and input, and must be safe to call
 * from several worker threads (serialising internally if the backend is not re-entrant).
 */
public interface InferenceAdapter extends AutoCloseable {

    Tensor infer(Tensor input);

    String description();

    @Override
    void close();
}
