package com.project.image.anomaly.exceptions;

public class ModelExecutionException extends AnomalyDetectionException {
    public ModelExecutionException(String message) { super(message); }
    public ModelExecutionException(String message, Throwable cause) { super(message, cause); }
}
