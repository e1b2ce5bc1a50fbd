package org.jstats.pitchlens_api.core.config;

import jakarta.validation.ConstraintViolationException;
import org.jstats.pitchlens_api.core.error.ConfigurationException;
import org.jstats.pitchlens_api.core.error.OrientationException;
import org.jstats.pitchlens_api.core.error.OrphanedRecordException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.HandlerMethodValidationException;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.net.URI;

import static org.springframework.http.HttpStatus.BAD_REQUEST;
import static org.springframework.http.HttpStatus.NOT_FOUND;

@RestControllerAdvice
public class ProblemHandler {

    private static final Logger log = LoggerFactory.getLogger(ProblemHandler.class);

    private static final String PROBLEMS = "https://api.jstats.org/problems/";

    @ExceptionHandler(ConfigurationException.class)
    public ProblemDetail configuration(ConfigurationException ex) {
        var pd = ProblemDetail.forStatusAndDetail(BAD_REQUEST, ex.getMessage());
        pd.setType(URI.create(PROBLEMS + "configuration"));
        pd.setTitle("Invalid Configuration");
        return pd;
    }

    @ExceptionHandler(OrientationException.class)
    public ProblemDetail orientation(OrientationException ex) {
        var pd = ProblemDetail.forStatusAndDetail(HttpStatus.UNPROCESSABLE_ENTITY, ex.getMessage());
        pd.setType(URI.create(PROBLEMS + "unresolvable-orientation"));
        pd.setTitle("Unresolvable Orientation");
        if (ex.recordId != null) {
            pd.setProperty("recordId", ex.recordId);
        }
        return pd;
    }

    @ExceptionHandler(OrphanedRecordException.class)
    public ProblemDetail orphaned(OrphanedRecordException ex) {
        var pd = ProblemDetail.forStatusAndDetail(NOT_FOUND, ex.getMessage());
        pd.setType(URI.create(PROBLEMS + "orphaned-record"));
        pd.setTitle("Orphaned Record");
        pd.setProperty("recordId", ex.recordId);
        return pd;
    }

    // Unreadable bodies include datasets whose values fail their own checks, e.g. a degenerate dimension
    @ExceptionHandler({
            HttpMessageNotReadableException.class,
            MethodArgumentTypeMismatchException.class,
            MissingServletRequestParameterException.class,
            HandlerMethodValidationException.class,
            ConstraintViolationException.class
    })
    public ProblemDetail badRequest(Exception ex) {
        var pd = ProblemDetail.forStatusAndDetail(BAD_REQUEST, rootMessage(ex));
        pd.setType(URI.create(PROBLEMS + BAD_REQUEST.value()));
        pd.setTitle("Bad Request");
        return pd;
    }

    // Catch any other unexpected exception as a 500 Problem (avoid leaking internals)
    @ExceptionHandler(Exception.class)
    public ProblemDetail handleGeneric(Exception ex) {
        log.error("Unhandled exception", ex);
        ProblemDetail pd = ProblemDetail.forStatusAndDetail(HttpStatus.INTERNAL_SERVER_ERROR,
                "Unexpected error. If this persists, contact support.");
        pd.setType(URI.create(PROBLEMS + "internal-error"));
        pd.setTitle("Internal Server Error");
        return pd;
    }

    private static String rootMessage(Throwable ex) {
        var cause = ex;
        while (cause.getCause() != null && cause.getCause() != cause) {
            cause = cause.getCause();
        }
        return cause.getMessage() != null ? cause.getMessage() : ex.getMessage();
    }
}
