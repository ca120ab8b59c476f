package com.subwayly.backend.exception;

import com.subwayly.backend.model.ErrorResponse;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.time.LocalDateTime;

@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(UnknownStopException.class)
    public ResponseEntity<ErrorResponse> handleUnknownStop(UnknownStopException ex, HttpServletRequest request) {
        log.warn("Unknown stop: {}", ex.getStop());
        return build(HttpStatus.NOT_FOUND, "Unknown Stop", ex.getMessage(), request);
    }

    @ExceptionHandler(NoRouteFoundException.class)
    public ResponseEntity<ErrorResponse> handleNoRoute(NoRouteFoundException ex, HttpServletRequest request) {
        log.info("No route between {} and {}", ex.getFromStop(), ex.getToStop());
        return build(HttpStatus.UNPROCESSABLE_ENTITY, "No Route Found", ex.getMessage(), request);
    }

    @ExceptionHandler(EmptyDatasetException.class)
    public ResponseEntity<ErrorResponse> handleEmptyDataset(EmptyDatasetException ex, HttpServletRequest request) {
        log.error("Empty dataset at {}: {}", request.getRequestURI(), ex.getMessage());
        return build(HttpStatus.SERVICE_UNAVAILABLE, "Empty Dataset", ex.getMessage(), request);
    }

    @ExceptionHandler(UpstreamFetchException.class)
    public ResponseEntity<ErrorResponse> handleUpstream(UpstreamFetchException ex, HttpServletRequest request) {
        log.error("MBTA fetch failed at {}: ", request.getRequestURI(), ex);
        return build(HttpStatus.BAD_GATEWAY, "Upstream Fetch Failed", ex.getMessage(), request);
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<ErrorResponse> handleMissingParams(MissingServletRequestParameterException ex,
            HttpServletRequest request) {
        log.warn("Bad Request: Missing parameter - {}", ex.getMessage());
        return build(HttpStatus.BAD_REQUEST, "Bad Request", ex.getMessage(), request);
    }

    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(NoResourceFoundException ex, HttpServletRequest request) {
        return build(HttpStatus.NOT_FOUND, "Not Found", ex.getMessage(), request);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGeneralException(Exception ex, HttpServletRequest request) {
        log.error("Internal Server Error at {}: ", request.getRequestURI(), ex);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error",
                "An unexpected error occurred. Please check logs.", request);
    }

    private ResponseEntity<ErrorResponse> build(HttpStatus status, String error, String message,
            HttpServletRequest request) {
        ErrorResponse body = ErrorResponse.builder()
                .timestamp(LocalDateTime.now())
                .status(status.value())
                .error(error)
                .message(message)
                .path(request.getRequestURI())
                .build();

        return new ResponseEntity<>(body, status);
    }
}
