package com.project.image.anomaly.processing;

import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.Point;
import org.opencv.imgproc.Imgproc;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Gaussian blur of an anomaly map as a horizontal pass followed by a vertical pass.
 * Both passes use the same {@link BoundaryMode}.
 */
public class SeparableGaussianSmoother {
    private static final Logger log = LoggerFactory.getLogger(SeparableGaussianSmoother.class);

    static {
        OpenCvLoader.ensureLoaded();
    }

    public static final double DEFAULT_SIGMA = 4.0;

    private final GaussianKernel kernel;
    private final BoundaryMode boundary;
    private final Mat kernelRow;

    public SeparableGaussianSmoother(double sigma, BoundaryMode boundary) {
        this.kernel = GaussianKernel.of(sigma);
        this.boundary = boundary;
        this.kernelRow = new Mat(1, kernel.size(), CvType.CV_64F);
        kernelRow.put(0, 0, kernel.weights());
    }

    public SeparableGaussianSmoother() {
        this(DEFAULT_SIGMA, BoundaryMode.REFLECT);
    }

    public GaussianKernel kernel() { return kernel; }

    public BoundaryMode boundary() { return boundary; }

    public AnomalyMap smooth(AnomalyMap raw) {
        final int w = raw.width(), h = raw.height();
        log.debug("Smoothing {}x{} map with sigma={}, radius={}, boundary={}",
                w, h, kernel.sigma(), kernel.radius(), boundary);

        Mat src = new Mat(h, w, CvType.CV_32F);
        Mat dst = new Mat();
        try {
            src.put(0, 0, raw.values());
            Imgproc.sepFilter2D(src, dst, CvType.CV_32F, kernelRow, kernelRow,
                    new Point(-1, -1), 0, boundary.borderType());
            float[] out = new float[w * h];
            dst.get(0, 0, out);
            return new AnomalyMap(w, h, out);
        } finally {
            src.release();
            dst.release();
        }
    }
}
