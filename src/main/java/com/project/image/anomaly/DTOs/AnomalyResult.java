package com.project.image.anomaly.DTOs;

public record AnomalyResult(
        float score,
        float threshold,
        boolean anomalous,
        int peakX,
        int peakY,
        int width,
        int height,
        byte[] heatmapJpeg     // 224x224 heatmap blended over the preprocessed image
) {
    public static final String ANOMALY = "ANOMALY DETECTED";
    public static final String NORMAL = "NORMAL";

    public String status() {
        return anomalous ? ANOMALY : NORMAL;
    }
}
