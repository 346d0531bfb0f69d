package com.project.image.anomaly.processing;

import com.project.image.anomaly.exceptions.AnomalyDetectionException;
import com.project.image.anomaly.exceptions.ShapeMismatchException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import javax.imageio.ImageIO;

/**
 * Turns a smoothed anomaly map into a translucent blue-to-red heatmap and blends it over the
 * preprocessed source image.
 */
public class HeatmapColorizer {
    private static final Logger log = LoggerFactory.getLogger(HeatmapColorizer.class);

    public static final int HEATMAP_ALPHA = 150;
    static final float EPSILON = 1e-5f;

    /**
     * Colours every cell relative to the map's own range. {@code maxScore} is the value already
     * returned by {@link ScoreExtractor#score}; the minimum is recomputed here.
     */
    public BufferedImage colorize(AnomalyMap map, float maxScore) {
        final int w = map.width(), h = map.height();
        final float minScore = map.min();
        final float range = maxScore - minScore + EPSILON;
        log.debug("Colorizing {}x{} map, min={}, max={}", w, h, minScore, maxScore);

        int[] argb = new int[w * h];
        float[] v = map.values();
        for (int i = 0; i < v.length; i++) {
            argb[i] = colorFor((v[i] - minScore) / range);
        }
        BufferedImage heatmap = new BufferedImage(w, h, BufferedImage.TYPE_INT_ARGB);
        heatmap.setRGB(0, 0, w, h, argb, 0, w);
        return heatmap;
    }

    public static int colorFor(float normalized) {
        float n4 = 4f * normalized;
        int r = channel(1.5f - Math.abs(n4 - 3f));
        int g = channel(1.5f - Math.abs(n4 - 2f));
        int b = channel(1.5f - Math.abs(n4 - 1f));
        return (HEATMAP_ALPHA << 24) | (r << 16) | (g << 8) | b;
    }

    private static int channel(float value) {
        float clamped = value < 0f ? 0f : Math.min(1f, value);
        return Math.round(clamped * 255f);
    }

    public BufferedImage composite(BufferedImage base, BufferedImage heatmap) {
        final int w = base.getWidth(), h = base.getHeight();
        if (heatmap.getWidth() != w || heatmap.getHeight() != h) {
            throw new ShapeMismatchException("Heatmap " + heatmap.getWidth() + "x" + heatmap.getHeight()
                    + " does not match image " + w + "x" + h);
        }
        int[] dst = base.getRGB(0, 0, w, h, null, 0, w);
        int[] src = heatmap.getRGB(0, 0, w, h, null, 0, w);

        for (int i = 0; i < dst.length; i++) {
            int s = src[i], d = dst[i];
            float alpha = ((s >>> 24) & 0xFF) / 255f;
            int r = blend((d >> 16) & 0xFF, (s >> 16) & 0xFF, alpha);
            int g = blend((d >> 8) & 0xFF, (s >> 8) & 0xFF, alpha);
            int b = blend(d & 0xFF, s & 0xFF, alpha);
            dst[i] = (0xFF << 24) | (r << 16) | (g << 8) | b;
        }

        BufferedImage out = new BufferedImage(w, h, BufferedImage.TYPE_INT_RGB);
        out.setRGB(0, 0, w, h, dst, 0, w);
        return out;
    }

    public static byte[] toJpeg(BufferedImage img) {
        try (ByteArrayOutputStream baos = new ByteArrayOutputStream()) {
            if (!ImageIO.write(img, "jpg", baos)) {
                throw new AnomalyDetectionException("No JPEG writer available for image type " + img.getType());
            }
            return baos.toByteArray();
        } catch (IOException e) {
            throw new AnomalyDetectionException("Failed to encode heatmap image", e);
        }
    }

    private static int blend(int orig, int tint, float alpha) {
        return clamp(Math.round(alpha * tint + (1f - alpha) * orig));
    }

    private static int clamp(int v) {
        return (v < 0) ? 0 : Math.min(255, v);
    }
}
