package com.project.image.anomaly.processing;

import java.util.Arrays;

/**
 * Normalised 1D Gaussian with radius {@code ceil(4 * sigma)}.
 */
public final class GaussianKernel {
    private final double sigma;
    private final int radius;
    private final double[] weights;

    private GaussianKernel(double sigma, int radius, double[] weights) {
        this.sigma = sigma;
        this.radius = radius;
        this.weights = weights;
    }

    public static GaussianKernel of(double sigma) {
        if (!(sigma > 0) || Double.isInfinite(sigma)) {
            throw new IllegalArgumentException("sigma must be a positive finite number, got " + sigma);
        }
        int radius = (int) Math.ceil(4 * sigma);
        int size = 2 * radius + 1;
        double[] w = new double[size];
        double twoSigmaSq = 2 * sigma * sigma;
        double sum = 0;
        for (int i = 0; i < size; i++) {
            int d = i - radius;
            w[i] = Math.exp(-(d * d) / twoSigmaSq);
            sum += w[i];
        }
        for (int i = 0; i < size; i++) w[i] /= sum;
        return new GaussianKernel(sigma, radius, w);
    }

    public double sigma() { return sigma; }

    public int radius() { return radius; }

    public int size() { return weights.length; }

    public double weight(int i) { return weights[i]; }

    public double[] weights() {
        return weights.clone();
    }

    @Override
    public String toString() {
        return "GaussianKernel{sigma=" + sigma + ", radius=" + radius + ", weights=" + Arrays.toString(weights) + "}";
    }
}
