package com.project.image.anomaly.DTOs;

public record ModelStatus(
        boolean loaded,
        String modelName,
        String category,
        float threshold
) {}
