package com.project.image.anomaly.DTOs;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/** Sidecar description of an exported model, read from its JSON metadata file. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ModelMetadata(
        @JsonProperty("model_name") String modelName,
        @JsonProperty("threshold") Float threshold,
        @JsonProperty("input_size") List<Integer> inputSize,
        @JsonProperty("category") String category
) {}
