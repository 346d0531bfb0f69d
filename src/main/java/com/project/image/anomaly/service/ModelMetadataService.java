package com.project.image.anomaly.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.project.image.anomaly.DTOs.ModelMetadata;
import com.project.image.anomaly.exceptions.ModelLoadException;
import com.project.image.anomaly.exceptions.ShapeMismatchException;
import com.project.image.anomaly.processing.GeometricPreprocessor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

@Service
public class ModelMetadataService {
    private static final Logger log = LoggerFactory.getLogger(ModelMetadataService.class);

    static final String DEFAULT_METADATA_FILE = "metadata.json";

    private final ObjectMapper objectMapper;

    public ModelMetadataService(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public ModelMetadata read(Path path) {
        if (!Files.isRegularFile(path)) {
            throw new ModelLoadException("Metadata file not found: " + path);
        }
        ModelMetadata metadata;
        try {
            metadata = objectMapper.readValue(path.toFile(), ModelMetadata.class);
        } catch (IOException e) {
            throw new ModelLoadException("Invalid model metadata " + path + ": " + e.getMessage(), e);
        }
        if (metadata == null) {
            throw new ModelLoadException("Empty model metadata: " + path);
        }
        checkInputSize(metadata.inputSize());
        log.info("Read metadata for model '{}' (category={}, threshold={})",
                metadata.modelName(), metadata.category(), metadata.threshold());
        return metadata;
    }

    /**
     * Metadata for a model file: the explicit path if given, otherwise {@code <model>.json} or
     * {@code metadata.json} next to the model. Empty when none of these exist.
     */
    public Optional<ModelMetadata> resolve(Path modelPath, Path explicitPath) {
        if (explicitPath != null) {
            return Optional.of(read(explicitPath));
        }
        Path dir = modelPath.toAbsolutePath().getParent();
        if (dir == null) {
            return Optional.empty();
        }
        String file = modelPath.getFileName().toString();
        int dot = file.lastIndexOf('.');
        String base = dot > 0 ? file.substring(0, dot) : file;

        for (Path candidate : List.of(dir.resolve(base + ".json"), dir.resolve(DEFAULT_METADATA_FILE))) {
            if (Files.isRegularFile(candidate)) {
                log.debug("Using metadata found next to model: {}", candidate);
                return Optional.of(read(candidate));
            }
        }
        log.debug("No metadata found for {}", modelPath);
        return Optional.empty();
    }

    // input_size is [H, W] or [C, H, W]; the spatial part must match the pipeline's input
    private static void checkInputSize(List<Integer> inputSize) {
        if (inputSize == null || inputSize.isEmpty()) return;
        int n = inputSize.size();
        if (n < 2) {
            throw new ShapeMismatchException("Metadata input_size " + inputSize + " has no spatial dimensions");
        }
        int h = inputSize.get(n - 2), w = inputSize.get(n - 1);
        if (h != GeometricPreprocessor.CROP || w != GeometricPreprocessor.CROP) {
            throw new ShapeMismatchException("Model input_size " + inputSize + " is not supported; the pipeline produces "
                    + GeometricPreprocessor.CROP + "x" + GeometricPreprocessor.CROP);
        }
    }
}
