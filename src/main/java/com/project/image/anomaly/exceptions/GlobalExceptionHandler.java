package com.project.image.anomaly.exceptions;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ui.Model;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.multipart.MaxUploadSizeExceededException;

import jakarta.validation.ConstraintViolationException;
import java.io.IOException;

@ControllerAdvice
public class GlobalExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler({InvalidImageException.class, StorageException.class})
    public String handleBadInput(RuntimeException ex, Model model) {
        log.warn("Rejected image: {}", ex.getMessage());
        model.addAttribute("error", ex.getMessage());
        model.addAttribute("suggestion", "Try another image in PNG or JPEG format.");
        return "analyze";
    }

    @ExceptionHandler(ModelLoadException.class)
    public String handleModelLoad(ModelLoadException ex, Model model) {
        log.warn("Model error: {}", ex.getMessage());
        model.addAttribute("error", ex.getMessage());
        return "index";
    }

    @ExceptionHandler({ModelExecutionException.class, ShapeMismatchException.class})
    public String handleModelFailure(AnomalyDetectionException ex, Model model) {
        log.error("Analysis failed", ex);
        model.addAttribute("error", "The model could not process the image: " + ex.getMessage());
        model.addAttribute("suggestion", "Check that the loaded model expects a 1x3x224x224 input.");
        return "analyze";
    }

    @ExceptionHandler(AnomalyDetectionException.class)
    public String handleDomainException(AnomalyDetectionException ex, Model model) {
        log.warn("Domain error: {}", ex.getMessage());
        model.addAttribute("error", ex.getMessage());
        return "analyze";
    }

    @ExceptionHandler(MaxUploadSizeExceededException.class)
    public String handleMaxUploadSizeExceeded(MaxUploadSizeExceededException ex, Model model) {
        log.warn("File upload size exceeded: {}", ex.getMessage());
        model.addAttribute("error", "The file is too large. Maximum size: 10MB");
        return "analyze";
    }

    @ExceptionHandler(ConstraintViolationException.class)
    public String handleValidationErrors(ConstraintViolationException ex, Model model) {
        log.warn("Validation error: {}", ex.getMessage());
        model.addAttribute("error", "Invalid parameters. Please check the values you entered.");
        return "index";
    }

    @ExceptionHandler(IOException.class)
    public String handleIOException(IOException ex, Model model) {
        log.error("IO error occurred", ex);
        model.addAttribute("error", "The file could not be read. Please try another image.");
        return "analyze";
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public String handleIllegalArgument(IllegalArgumentException ex, Model model) {
        log.warn("Invalid argument: {}", ex.getMessage());
        model.addAttribute("error", "Invalid parameters: " + ex.getMessage());
        return "analyze";
    }

    @ExceptionHandler(Exception.class)
    public String handleUnknownException(Exception ex, Model model) {
        log.error("Unhandled error occurred", ex);
        model.addAttribute("error", "An unexpected error occurred. Please try again.");
        return "index";
    }
}
