package com.project.image.anomaly.exceptions;

public class ShapeMismatchException extends AnomalyDetectionException {
    public ShapeMismatchException(String message) { super(message); }
}
