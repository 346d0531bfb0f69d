package com.project.image.anomaly.exceptions;

public class InvalidImageException extends AnomalyDetectionException {
    public InvalidImageException(String message) { super(message); }
    public InvalidImageException(String message, Throwable cause) { super(message, cause); }
}
