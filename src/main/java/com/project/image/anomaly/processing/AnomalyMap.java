package com.project.image.anomaly.processing;

import com.project.image.anomaly.exceptions.ShapeMismatchException;

/**
 * Per-pixel anomaly scores, shape [height, width], row-major.
 * Instances produced by the pipeline are treated as read-only once built.
 */
public final class AnomalyMap {
    private final int width;
    private final int height;
    private final float[] values;

    public AnomalyMap(int width, int height, float[] values) {
        if (width <= 0 || height <= 0) {
            throw new ShapeMismatchException("Anomaly map must not be empty: " + width + "x" + height);
        }
        if (values.length != width * height) {
            throw new ShapeMismatchException("Anomaly map " + width + "x" + height
                    + " needs " + (width * height) + " values, got " + values.length);
        }
        this.width = width;
        this.height = height;
        this.values = values;
    }

    public static AnomalyMap fromTensor(Tensor tensor) {
        if (tensor.rank() != 4 || tensor.dim(0) != 1 || tensor.dim(1) != 1) {
            throw new ShapeMismatchException("Expected a [1,1,H,W] anomaly map, got " + tensor);
        }
        return new AnomalyMap((int) tensor.dim(3), (int) tensor.dim(2), tensor.data());
    }

    public static AnomalyMap filled(int width, int height, float value) {
        float[] v = new float[width * height];
        java.util.Arrays.fill(v, value);
        return new AnomalyMap(width, height, v);
    }

    public int width() { return width; }

    public int height() { return height; }

    public int size() { return values.length; }

    public float get(int x, int y) {
        return values[y * width + x];
    }

    public float[] values() {
        return values;
    }

    public float min() {
        float min = Float.POSITIVE_INFINITY;
        for (float v : values) {
            if (v < min) min = v;
        }
        return min;
    }

    public float max() {
        float max = Float.NEGATIVE_INFINITY;
        for (float v : values) {
            if (v > max) max = v;
        }
        return max;
    }
}
