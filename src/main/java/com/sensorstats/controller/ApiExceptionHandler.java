package com.sensorstats.controller;

import com.sensorstats.cache.InvalidDateException;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.net.URI;

/**
 * Maps rejected queries to RFC 7807 problem responses.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(InvalidDateException.class)
    public ResponseEntity<ProblemDetail> handleInvalidDate(InvalidDateException ex, HttpServletRequest request) {
        log.warn("Request {} {} rejected: {}='{}' is not a valid date",
                request.getMethod(), uriWithQuery(request), ex.getParameter(), ex.getRawValue());

        ProblemDetail detail = ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, ex.getMessage());
        detail.setTitle(HttpStatus.BAD_REQUEST.getReasonPhrase());
        detail.setInstance(URI.create(request.getRequestURI()));
        detail.setProperty("parameter", ex.getParameter());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(detail);
    }

    private static String uriWithQuery(HttpServletRequest request) {
        String queryString = request.getQueryString();
        if (queryString == null || queryString.isBlank()) {
            return request.getRequestURI();
        }
        return request.getRequestURI() + "?" + queryString;
    }
}
