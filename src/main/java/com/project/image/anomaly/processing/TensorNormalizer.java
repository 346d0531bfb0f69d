package com.project.image.anomaly.processing;

import com.project.image.anomaly.exceptions.ShapeMismatchException;

import java.awt.image.BufferedImage;

/**
 * RGB pixels to a [1,3,H,W] tensor using ImageNet mean/std per channel.
 */
public class TensorNormalizer {

    static final float[] MEAN = {0.485f, 0.456f, 0.406f};
    static final float[] STD  = {0.229f, 0.224f, 0.225f};

    private final int size;

    public TensorNormalizer(int size) {
        this.size = size;
    }

    public TensorNormalizer() {
        this(GeometricPreprocessor.CROP);
    }

    public Tensor normalize(BufferedImage image) {
        if (image.getWidth() != size || image.getHeight() != size) {
            throw new ShapeMismatchException("Normalizer expects " + size + "x" + size
                    + " pixels, got " + image.getWidth() + "x" + image.getHeight());
        }
        int[] argb = image.getRGB(0, 0, size, size, null, 0, size);
        Tensor tensor = Tensor.zeros(1, 3, size, size);
        float[] data = tensor.data();
        final int plane = size * size;

        for (int i = 0; i < plane; i++) {
            int p = argb[i];
            int r = (p >> 16) & 0xFF, g = (p >> 8) & 0xFF, b = p & 0xFF;
            data[i]             = ((r / 255f) - MEAN[0]) / STD[0];
            data[plane + i]     = ((g / 255f) - MEAN[1]) / STD[1];
            data[2 * plane + i] = ((b / 255f) - MEAN[2]) / STD[2];
        }
        return tensor;
    }

    public int size() {
        return size;
    }
}
