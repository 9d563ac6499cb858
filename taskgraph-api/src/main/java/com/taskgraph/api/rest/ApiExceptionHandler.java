package com.taskgraph.api.rest;

import com.taskgraph.core.exception.CircularDependencyException;
import com.taskgraph.core.exception.NotFoundException;
import com.taskgraph.core.exception.TaskDefinitionException;
import com.taskgraph.core.exception.TaskGraphException;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;

/**
 * Maps task graph error codes to HTTP statuses.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    public static final String BAD_REQUEST_CODE = "BAD_REQUEST";
    public static final String UNAVAILABLE_CODE = "UNAVAILABLE";
    public static final String INTERNAL_CODE = "INTERNAL";

    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(NotFoundException ex, HttpServletRequest request) {
        return respond(HttpStatus.NOT_FOUND, ex.getErrorCode(), ex.getMessage(), request);
    }

    @ExceptionHandler({CircularDependencyException.class, TaskDefinitionException.class})
    public ResponseEntity<ErrorResponse> handleInvalidGraph(TaskGraphException ex, HttpServletRequest request) {
        return respond(HttpStatus.UNPROCESSABLE_ENTITY, ex.getErrorCode(), ex.getMessage(), request);
    }

    @ExceptionHandler(TaskGraphException.class)
    public ResponseEntity<ErrorResponse> handleTaskGraph(TaskGraphException ex, HttpServletRequest request) {
        return respond(HttpStatus.BAD_REQUEST, ex.getErrorCode(), ex.getMessage(), request);
    }

    @ExceptionHandler({
        IllegalArgumentException.class,
        HttpMessageNotReadableException.class,
        MethodArgumentTypeMismatchException.class
    })
    public ResponseEntity<ErrorResponse> handleBadRequest(Exception ex, HttpServletRequest request) {
        return respond(HttpStatus.BAD_REQUEST, BAD_REQUEST_CODE, ex.getMessage(), request);
    }

    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<ErrorResponse> handleUnavailable(IllegalStateException ex, HttpServletRequest request) {
        return respond(HttpStatus.SERVICE_UNAVAILABLE, UNAVAILABLE_CODE, ex.getMessage(), request);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnknown(Exception ex, HttpServletRequest request) {
        log.error("HTTP_ERROR {} {} failed", request.getMethod(), request.getRequestURI(), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(new ErrorResponse(INTERNAL_CODE, "Internal error", request.getRequestURI(), Instant.now()));
    }

    private ResponseEntity<ErrorResponse> respond(
            HttpStatus status, String code, String message, HttpServletRequest request) {
        log.warn("HTTP_ERROR {} {} -> {} {}: {}",
            request.getMethod(), request.getRequestURI(), status.value(), code, message);
        return ResponseEntity.status(status)
            .body(new ErrorResponse(code, message, request.getRequestURI(), Instant.now()));
    }

    public record ErrorResponse(
        String code,
        String message,
        String path,
        Instant timestamp
    ) {}
}
