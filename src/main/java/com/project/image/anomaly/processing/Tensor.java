package com.project.image.anomaly.processing;

import com.project.image.anomaly.exceptions.ShapeMismatchException;

import java.util.Arrays;

/**
 * Dense float tensor, channel-first and row-major. The backing array is shared, not copied:
 * a tensor handed to the next stage must not be written to again.
 */
public final class Tensor {
    private final long[] shape;
    private final float[] data;

    public Tensor(long[] shape, float[] data) {
        long expected = 1;
        for (long d : shape) {
            if (d <= 0) {
                throw new ShapeMismatchException("Invalid tensor dimension in " + Arrays.toString(shape));
            }
            expected *= d;
        }
        if (expected != data.length) {
            throw new ShapeMismatchException("Tensor shape " + Arrays.toString(shape)
                    + " needs " + expected + " elements, got " + data.length);
        }
        this.shape = shape.clone();
        this.data = data;
    }

    public static Tensor zeros(long... shape) {
        long n = 1;
        for (long d : shape) n *= d;
        return new Tensor(shape, new float[Math.toIntExact(n)]);
    }

    public long[] shape() {
        return shape.clone();
    }

    public int rank() {
        return shape.length;
    }

    public long dim(int axis) {
        return shape[axis];
    }

    public float[] data() {
        return data;
    }

    public int offset(int n, int c, int y, int x) {
        int channels = (int) shape[1], height = (int) shape[2], width = (int) shape[3];
        return ((n * channels + c) * height + y) * width + x;
    }

    public float get(int n, int c, int y, int x) {
        return data[offset(n, c, y, x)];
    }

    public void set(int n, int c, int y, int x, float value) {
        data[offset(n, c, y, x)] = value;
    }

    public boolean hasShape(long... expected) {
        return Arrays.equals(shape, expected);
    }

    @Override
    public String toString() {
        return "Tensor" + Arrays.toString(shape);
    }
}
