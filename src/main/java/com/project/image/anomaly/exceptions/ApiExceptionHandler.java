package com.project.image.anomaly.exceptions;

import com.project.image.anomaly.controller.AnalysisApiController;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.io.IOException;

@RestControllerAdvice(assignableTypes = AnalysisApiController.class)
@Order(Ordered.HIGHEST_PRECEDENCE)
public class ApiExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler({InvalidImageException.class, IllegalArgumentException.class, IOException.class})
    public ProblemDetail handleBadImage(Exception ex) {
        log.warn("API rejected image: {}", ex.getMessage());
        return problem(HttpStatus.BAD_REQUEST, "Invalid image", ex);
    }

    @ExceptionHandler(ModelLoadException.class)
    public ProblemDetail handleModelLoad(ModelLoadException ex) {
        log.warn("API model error: {}", ex.getMessage());
        return problem(HttpStatus.CONFLICT, "Model not available", ex);
    }

    @ExceptionHandler({ModelExecutionException.class, ShapeMismatchException.class})
    public ProblemDetail handleModelFailure(AnomalyDetectionException ex) {
        log.error("API analysis failed", ex);
        return problem(HttpStatus.INTERNAL_SERVER_ERROR, "Model execution failed", ex);
    }

    @ExceptionHandler(AnomalyDetectionException.class)
    public ProblemDetail handleDomain(AnomalyDetectionException ex) {
        log.error("API analysis failed", ex);
        return problem(HttpStatus.INTERNAL_SERVER_ERROR, "Analysis failed", ex);
    }

    private static ProblemDetail problem(HttpStatus status, String title, Exception ex) {
        ProblemDetail detail = ProblemDetail.forStatusAndDetail(status, ex.getMessage());
        detail.setTitle(title);
        detail.setProperty("error", ex.getClass().getSimpleName());
        return detail;
    }
}
