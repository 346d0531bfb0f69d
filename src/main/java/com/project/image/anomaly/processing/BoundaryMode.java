package com.project.image.anomaly.processing;

import org.opencv.core.Core;

/** How the smoother reads samples that fall outside the map. */
public enum BoundaryMode {
    REFLECT(Core.BORDER_REFLECT),   // -1 -> 0, N -> N-1
    CLAMP(Core.BORDER_REPLICATE);

    private final int borderType;

    BoundaryMode(int borderType) {
        this.borderType = borderType;
    }

    public int borderType() {
        return borderType;
    }
}
