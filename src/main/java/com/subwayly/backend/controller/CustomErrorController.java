package com.subwayly.backend.controller;

import com.subwayly.backend.model.ErrorResponse;
import jakarta.servlet.RequestDispatcher;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.boot.web.servlet.error.ErrorController;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDateTime;

@RestController
public class CustomErrorController implements ErrorController {

    @RequestMapping(value = "/error", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<ErrorResponse> handleErrorJson(HttpServletRequest request) {
        Object status = request.getAttribute(RequestDispatcher.ERROR_STATUS_CODE);
        int statusCode = HttpStatus.NOT_FOUND.value();

        if (status != null) {
            statusCode = Integer.parseInt(status.toString());
        }

        Object uri = request.getAttribute(RequestDispatcher.ERROR_REQUEST_URI);

        ErrorResponse error = ErrorResponse.builder()
                .timestamp(LocalDateTime.now())
                .status(statusCode)
                .error(HttpStatus.valueOf(statusCode).getReasonPhrase())
                .message("The resource you are looking for does not exist. See /docs for the available endpoints.")
                .path(uri != null ? uri.toString() : request.getRequestURI())
                .build();

        return new ResponseEntity<>(error, HttpStatus.valueOf(statusCode));
    }
}
