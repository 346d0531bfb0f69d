package com.project.image.anomaly;

import com.project.image.anomaly.exceptions.ModelExecutionException;
import com.project.image.anomaly.inference.InferenceAdapter;
import com.project.image.anomaly.processing.Tensor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Function;

/** In-memory stand-in for a model: computes the anomaly map with a plain function. */
class FakeInferenceAdapter implements InferenceAdapter {

    private final String name;
    private final Function<Tensor, Tensor> model;
    final List<String> callingThreads = Collections.synchronizedList(new ArrayList<>());
    volatile boolean closed;

    FakeInferenceAdapter(String name, Function<Tensor, Tensor> model) {
        this.name = name;
        this.model = model;
    }

    /** Squared distance of each pixel from the mean image: bright and dark pixels score high. */
    static FakeInferenceAdapter pixelEnergy() {
        return new FakeInferenceAdapter("pixel-energy", input -> {
            int h = (int) input.dim(2), w = (int) input.dim(3);
            float[] out = new float[h * w];
            for (int y = 0; y < h; y++) {
                for (int x = 0; x < w; x++) {
                    float s = 0;
                    for (int c = 0; c < 3; c++) {
                        float v = input.get(0, c, y, x);
                        s += v * v;
                    }
                    out[y * w + x] = s;
                }
            }
            return new Tensor(new long[]{1, 1, h, w}, out);
        });
    }

    /** Ignores the image and reports a single hot pixel. */
    static FakeInferenceAdapter spike(int x, int y, float value) {
        return new FakeInferenceAdapter("spike", input -> {
            int h = (int) input.dim(2), w = (int) input.dim(3);
            float[] out = new float[h * w];
            out[y * w + x] = value;
            return new Tensor(new long[]{1, 1, h, w}, out);
        });
    }

    static FakeInferenceAdapter constant(float value) {
        return new FakeInferenceAdapter("constant", input -> {
            int h = (int) input.dim(2), w = (int) input.dim(3);
            float[] out = new float[h * w];
            java.util.Arrays.fill(out, value);
            return new Tensor(new long[]{1, 1, h, w}, out);
        });
    }

    static FakeInferenceAdapter failing(String message) {
        return new FakeInferenceAdapter("failing", input -> {
            throw new ModelExecutionException(message);
        });
    }

    @Override
    public Tensor infer(Tensor input) {
        if (closed) {
            throw new ModelExecutionException("closed");
        }
        callingThreads.add(Thread.currentThread().getName());
        return model.apply(input);
    }

    @Override
    public String description() {
        return name;
    }

    @Override
    public void close() {
        closed = true;
    }
}
