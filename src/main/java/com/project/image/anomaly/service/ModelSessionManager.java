package com.project.image.anomaly.service;

import com.project.image.anomaly.DTOs.ModelMetadata;
import com.project.image.anomaly.DTOs.ModelStatus;
import com.project.image.anomaly.exceptions.ModelLoadException;
import com.project.image.anomaly.inference.InferenceAdapter;
import com.project.image.anomaly.inference.ModelLoader;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Function;

/**
 * Owns the single active model. Analyses run under the read lock with the snapshot they started
 * with; loading a model or changing the threshold swaps the snapshot under the write lock, so a
 * change applies from the next analysis on and an adapter is never closed while in use.
 */
@Service
public class ModelSessionManager {
    private static final Logger log = LoggerFactory.getLogger(ModelSessionManager.class);

    public record ActiveModel(InferenceAdapter adapter, ModelMetadata metadata, String modelName, float threshold) {
        public String category() {
            return metadata == null ? null : metadata.category();
        }
    }

    private final ModelLoader modelLoader;
    private final ModelMetadataService metadataService;
    private final float defaultThreshold;
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private ActiveModel active;

    @Autowired
    public ModelSessionManager(ModelLoader modelLoader,
                               ModelMetadataService metadataService,
                               @Value("${app.anomaly.default-threshold:10.0}") float defaultThreshold,
                               @Value("${app.anomaly.model-path:}") String modelPath,
                               @Value("${app.anomaly.metadata-path:}") String metadataPath) {
        this.modelLoader = modelLoader;
        this.metadataService = metadataService;
        this.defaultThreshold = defaultThreshold;

        if (StringUtils.hasText(modelPath)) {
            log.info("Loading startup model from {}", modelPath);
            load(Paths.get(modelPath), StringUtils.hasText(metadataPath) ? Paths.get(metadataPath) : null, null);
        } else {
            log.info("No startup model configured (app.anomaly.model-path); waiting for one to be loaded");
        }
    }

    public ModelSessionManager(ModelLoader modelLoader, ModelMetadataService metadataService, float defaultThreshold) {
        this(modelLoader, metadataService, defaultThreshold, "", "");
    }

    /**
     * Opens a model (and its metadata) and makes it the active one, closing the previous model.
     * The threshold is {@code thresholdOverride} if given, else the metadata's, else the default.
     */
    public ModelStatus load(Path modelPath, Path metadataPath, Float thresholdOverride) {
        // metadata first: a bad sidecar must not leave an opened session behind
        ModelMetadata metadata = metadataService.resolve(modelPath, metadataPath).orElse(null);
        InferenceAdapter adapter = modelLoader.load(modelPath);
        String name = metadata != null && StringUtils.hasText(metadata.modelName())
                ? metadata.modelName()
                : modelPath.getFileName().toString();
        return activate(adapter, metadata, name, thresholdOverride);
    }

    public ModelStatus activate(InferenceAdapter adapter, ModelMetadata metadata, String modelName, Float thresholdOverride) {
        float threshold = thresholdOverride != null ? thresholdOverride
                : (metadata != null && metadata.threshold() != null) ? metadata.threshold()
                : defaultThreshold;
        ActiveModel next = new ActiveModel(adapter, metadata, modelName, threshold);

        ActiveModel previous;
        lock.writeLock().lock();
        try {
            previous = active;
            active = next;
        } finally {
            lock.writeLock().unlock();
        }
        log.info("Active model is now '{}' ({}), threshold={}", modelName, adapter.description(), threshold);

        if (previous != null && previous.adapter() != adapter) {
            previous.adapter().close();
        }
        return toStatus(next);
    }

    public ModelStatus updateThreshold(float threshold) {
        lock.writeLock().lock();
        try {
            if (active == null) {
                throw new ModelLoadException("No model loaded. Please load an ONNX model first.");
            }
            active = new ActiveModel(active.adapter(), active.metadata(), active.modelName(), threshold);
            log.info("Threshold for '{}' set to {}", active.modelName(), threshold);
            return toStatus(active);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public <T> T withActiveModel(Function<ActiveModel, T> work) {
        lock.readLock().lock();
        try {
            if (active == null) {
                throw new ModelLoadException("No model loaded. Please load an ONNX model first.");
            }
            return work.apply(active);
        } finally {
            lock.readLock().unlock();
        }
    }

    public ModelStatus status() {
        lock.readLock().lock();
        try {
            return active == null
                    ? new ModelStatus(false, null, null, defaultThreshold)
                    : toStatus(active);
        } finally {
            lock.readLock().unlock();
        }
    }

    @PreDestroy
    public void close() {
        ActiveModel previous;
        lock.writeLock().lock();
        try {
            previous = active;
            active = null;
        } finally {
            lock.writeLock().unlock();
        }
        if (previous != null) {
            log.info("Releasing model '{}'", previous.modelName());
            previous.adapter().close();
        }
    }

    private static ModelStatus toStatus(ActiveModel model) {
        return new ModelStatus(true, model.modelName(), model.category(), model.threshold());
    }
}
