package com.project.image.anomaly.processing;

import org.opencv.core.Core;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

final class OpenCvLoader {
    private static final Logger log = LoggerFactory.getLogger(OpenCvLoader.class);

    static {
        try {
            nu.pattern.OpenCV.loadShared();
        } catch (RuntimeException | LinkageError e) {
            // loadShared cannot patch java.library.path on newer JDKs
            log.debug("Shared OpenCV load failed, extracting a local copy", e);
            nu.pattern.OpenCV.loadLocally();
        }
        log.info("OpenCV {} loaded successfully", Core.VERSION);
    }

    private OpenCvLoader() {
    }

    static void ensureLoaded() {
    }
}
