package com.project.image.anomaly.exceptions;

public class ModelLoadException extends AnomalyDetectionException {
    public ModelLoadException(String message) { super(message); }
    public ModelLoadException(String message, Throwable cause) { super(message, cause); }
}
