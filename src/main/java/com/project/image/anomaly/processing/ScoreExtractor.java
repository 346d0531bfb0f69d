package com.project.image.anomaly.processing;

import java.awt.Point;

/** The anomaly score of an image is the largest value of its smoothed map. */
public final class ScoreExtractor {

    private ScoreExtractor() {
    }

    public static float score(AnomalyMap map) {
        float[] v = map.values();
        if (v.length == 0) {
            throw new IllegalArgumentException("Cannot score an empty anomaly map");
        }
        float max = v[0];
        for (int i = 1; i < v.length; i++) {
            if (v[i] > max) max = v[i];
        }
        return max;
    }

    public static Point locate(AnomalyMap map) {
        float[] v = map.values();
        if (v.length == 0) {
            throw new IllegalArgumentException("Cannot locate the peak of an empty anomaly map");
        }
        int best = 0;
        for (int i = 1; i < v.length; i++) {
            if (v[i] > v[best]) best = i;
        }
        return new Point(best % map.width(), best / map.width());
    }
}
