package net.plantmatch.controller;

import jakarta.servlet.http.HttpServletRequest;
import net.plantmatch.exception.CatalogLoadException;
import net.plantmatch.exception.InvalidCriteriaException;
import net.plantmatch.util.LoggingUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.net.URI;

/**
 * Translates recommendation failures into RFC 9457 {@link ProblemDetail} responses.
 */
@RestControllerAdvice
public class RecommendationExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(RecommendationExceptionHandler.class);

    @ExceptionHandler(InvalidCriteriaException.class)
    public ProblemDetail handleInvalidCriteria(InvalidCriteriaException ex, HttpServletRequest request) {
        log.debug("Rejected recommendation criteria for {}: {}", request.getRequestURI(), ex.violations());
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, ex.getMessage());
        problem.setTitle("Invalid recommendation criteria");
        problem.setInstance(URI.create(request.getRequestURI()));
        problem.setProperty("violations", ex.violations());
        return problem;
    }

    @ExceptionHandler(CatalogLoadException.class)
    public ProblemDetail handleCatalogLoad(CatalogLoadException ex, HttpServletRequest request) {
        LoggingUtils.error(log, ex, "Plant catalog unavailable while serving {}", request.getRequestURI());
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(HttpStatus.SERVICE_UNAVAILABLE,
            "The plant catalog is currently unavailable.");
        problem.setTitle("Plant catalog unavailable");
        problem.setInstance(URI.create(request.getRequestURI()));
        return problem;
    }
}
