package com.sitesmith.dispatch.api;

import com.sitesmith.core.error.ErrorKind;
import com.sitesmith.core.error.SitesmithException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

import java.util.LinkedHashMap;
import java.util.Map;

@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(SitesmithException.class)
    public ResponseEntity<Map<String, Object>> handleSitesmith(SitesmithException e) {
        HttpStatus status = statusFor(e.kind());
        if (status.is5xxServerError()) {
            log.error("Request failed with {}: {}", e.kind(), e.getMessage());
        } else {
            log.debug("Request rejected with {}: {}", e.kind(), e.getMessage());
        }
        return ResponseEntity.status(status).body(body(e.kind().name(), e.getMessage()));
    }

    @ExceptionHandler({
            HttpMessageNotReadableException.class,
            MissingServletRequestParameterException.class,
            MissingServletRequestPartException.class,
            MethodArgumentTypeMismatchException.class
    })
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleBadRequest(Exception e) {
        return body(ErrorKind.VALIDATION.name(), e.getMessage());
    }

    static HttpStatus statusFor(ErrorKind kind) {
        return switch (kind) {
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
            case VALIDATION -> HttpStatus.BAD_REQUEST;
            case UNSUPPORTED_MEDIA_TYPE -> HttpStatus.UNSUPPORTED_MEDIA_TYPE;
            case DEPLOYMENT_FAILED, UPSTREAM_UNAVAILABLE -> HttpStatus.BAD_GATEWAY;
            case PERSISTENCE_FAILED -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }

    private static Map<String, Object> body(String error, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", false);
        body.put("error", error);
        body.put("message", message != null ? message : error);
        return body;
    }
}
