package com.project.image.anomaly.exceptions;

/** Domain-specific exception for failures anywhere in the analysis pipeline. */
public class AnomalyDetectionException extends RuntimeException {
    public AnomalyDetectionException(String message) { super(message); }
    public AnomalyDetectionException(String message, Throwable cause) { super(message, cause); }
}
