package com.project.image.anomaly.processing;

import com.project.image.anomaly.exceptions.InvalidImageException;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.Rect;
import org.opencv.core.Size;
import org.opencv.imgproc.Imgproc;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.image.BufferedImage;
import java.awt.image.DataBufferByte;

/**
 * Brings an arbitrary image to the model's 224×224 input: a stretch to 256×256 (aspect ratio is
 * not preserved), then the centre 224×224 window at offset (16,16). Alpha, if present, is discarded.
 */
public class GeometricPreprocessor {
    private static final Logger log = LoggerFactory.getLogger(GeometricPreprocessor.class);

    static {
        OpenCvLoader.ensureLoaded();
    }

    public static final int RESIZE = 256;
    public static final int CROP = 224;
    public static final int OFFSET = (RESIZE - CROP) / 2;

    public BufferedImage preprocess(BufferedImage input) {
        if (input == null) {
            throw new InvalidImageException("No image supplied.");
        }
        if (input.getWidth() <= 0 || input.getHeight() <= 0) {
            throw new InvalidImageException("Image has no pixels: " + input.getWidth() + "x" + input.getHeight());
        }
        log.debug("Preprocessing {}x{} image: resize to {}x{}, crop {}x{} at ({},{})",
                input.getWidth(), input.getHeight(), RESIZE, RESIZE, CROP, CROP, OFFSET, OFFSET);

        Mat image = bufferedImageToMat(input);
        Mat resized = resize(image, RESIZE, RESIZE);
        Mat cropped = resized.submat(new Rect(OFFSET, OFFSET, CROP, CROP)).clone();
        try {
            return matToBufferedImage(cropped);
        } finally {
            image.release();
            resized.release();
            cropped.release();
        }
    }

    public static BufferedImage resize(BufferedImage src, int dw, int dh) {
        Mat image = bufferedImageToMat(src);
        Mat resized = resize(image, dw, dh);
        try {
            return matToBufferedImage(resized);
        } finally {
            image.release();
            resized.release();
        }
    }

    // area averaging when both axes shrink, bilinear otherwise
    private static Mat resize(Mat src, int dw, int dh) {
        int interpolation = src.cols() >= dw && src.rows() >= dh ? Imgproc.INTER_AREA : Imgproc.INTER_LINEAR;
        Mat dst = new Mat();
        Imgproc.resize(src, dst, new Size(dw, dh), 0, 0, interpolation);
        return dst;
    }

    private static Mat bufferedImageToMat(BufferedImage image) {
        int w = image.getWidth(), h = image.getHeight();
        int[] argb = image.getRGB(0, 0, w, h, null, 0, w);
        byte[] bgr = new byte[w * h * 3];
        for (int i = 0; i < argb.length; i++) {
            int p = argb[i];
            bgr[i * 3] = (byte) p;
            bgr[i * 3 + 1] = (byte) (p >> 8);
            bgr[i * 3 + 2] = (byte) (p >> 16);
        }
        Mat mat = new Mat(h, w, CvType.CV_8UC3);
        mat.put(0, 0, bgr);
        return mat;
    }

    private static BufferedImage matToBufferedImage(Mat mat) {
        BufferedImage image = new BufferedImage(mat.cols(), mat.rows(), BufferedImage.TYPE_3BYTE_BGR);
        byte[] pixels = ((DataBufferByte) image.getRaster().getDataBuffer()).getData();
        mat.get(0, 0, pixels);
        return image;
    }
}
