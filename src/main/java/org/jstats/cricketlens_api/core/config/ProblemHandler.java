package org.jstats.cricketlens_api.core.config;

import jakarta.validation.ConstraintViolationException;
import org.jstats.cricketlens_api.modules.match_report.parse.MalformedMatchException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.ErrorResponseException;
import org.springframework.web.HttpMediaTypeNotAcceptableException;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.HandlerMethodValidationException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.net.URI;

import static org.springframework.http.HttpStatus.BAD_REQUEST;

@RestControllerAdvice
public class ProblemHandler {

    private static final Logger log = LoggerFactory.getLogger(ProblemHandler.class);

    // Spring MVC's own client errors (405, 406, 415, missing parameters, unknown paths) keep their status
    @ExceptionHandler({
            ErrorResponseException.class,
            HttpRequestMethodNotSupportedException.class,
            HttpMediaTypeNotSupportedException.class,
            HttpMediaTypeNotAcceptableException.class,
            MissingServletRequestParameterException.class,
            NoResourceFoundException.class
    })
    public ResponseEntity<ProblemDetail> handle(Exception ex) {
        ErrorResponse error = (ErrorResponse) ex;
        ProblemDetail pd = error.getBody();
        pd.setType(URI.create("https://api.jstats.org/problems/" + error.getStatusCode().value()));
        return ResponseEntity.status(error.getStatusCode())
                .headers(error.getHeaders())
                .body(pd);
    }

    @ExceptionHandler(MalformedMatchException.class)
    public ProblemDetail malformedMatch(MalformedMatchException ex) {
        var pd = ProblemDetail.forStatusAndDetail(HttpStatus.UNPROCESSABLE_ENTITY, ex.getMessage());
        pd.setType(URI.create("https://api.jstats.org/problems/malformed-match"));
        pd.setTitle("Malformed match record");
        pd.setProperty("fieldPath", ex.getFieldPath());
        return pd;
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ProblemDetail unreadable(HttpMessageNotReadableException ex) {
        var pd = ProblemDetail.forStatusAndDetail(BAD_REQUEST, "Request body is not valid JSON.");
        pd.setType(URI.create("https://api.jstats.org/problems/unreadable-body"));
        pd.setTitle("Bad Request");
        return pd;
    }

    @ExceptionHandler(ConstraintViolationException.class)
    public ProblemDetail constraintViolation(ConstraintViolationException ex) {
        var pd = ProblemDetail.forStatusAndDetail(BAD_REQUEST, ex.getMessage());
        pd.setTitle("Bad Request");
        return pd;
    }

    @ExceptionHandler(HandlerMethodValidationException.class)
    public ProblemDetail methodValidation(HandlerMethodValidationException ex) {
        var pd = ProblemDetail.forStatusAndDetail(BAD_REQUEST, ex.getMessage());
        pd.setTitle("Bad Request");
        return pd;
    }

    // Catch any other unexpected exception as a 500 Problem (avoid leaking internals)
    @ExceptionHandler(Exception.class)
    public ProblemDetail handleGeneric(Exception ex) {
        log.error("Unhandled error", ex);
        ProblemDetail pd = ProblemDetail.forStatusAndDetail(HttpStatus.INTERNAL_SERVER_ERROR,
                "Unexpected error. If this persists, contact support.");
        pd.setType(URI.create("https://api.jstats.org/problems/internal-error"));
        pd.setTitle("Internal Server Error");
        return pd;
    }
}
