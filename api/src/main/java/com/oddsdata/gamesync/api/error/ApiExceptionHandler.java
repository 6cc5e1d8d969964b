package com.oddsdata.gamesync.api.error;

import com.oddsdata.gamesync.domain.exception.CircuitOpenException;
import com.oddsdata.gamesync.domain.exception.InvalidArgumentException;
import com.oddsdata.gamesync.domain.exception.StoreUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps domain errors to HTTP statuses
 */
@RestControllerAdvice
public class ApiExceptionHandler {
    
    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);
    
    private final Clock clock;
    
    public ApiExceptionHandler(Clock clock) {
        this.clock = clock;
    }
    
    @ExceptionHandler({InvalidArgumentException.class, MethodArgumentTypeMismatchException.class,
            MissingServletRequestParameterException.class})
    public ResponseEntity<Map<String, Object>> invalidArgument(Exception e) {
        log.debug("Rejected request: {}", e.getMessage());
        return ResponseEntity.badRequest().body(body("INVALID_ARGUMENT", e.getMessage()));
    }
    
    @ExceptionHandler(CircuitOpenException.class)
    public ResponseEntity<Map<String, Object>> circuitOpen(CircuitOpenException e) {
        Map<String, Object> body = body("CIRCUIT_OPEN", e.getMessage());
        body.put("retryAfter", e.getRetryAfter());
        ResponseEntity.BodyBuilder response = ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE);
        if (e.getRetryAfter() != null) {
            long seconds = Math.max(1, Duration.between(Instant.now(clock), e.getRetryAfter()).toSeconds());
            response.header(HttpHeaders.RETRY_AFTER, String.valueOf(seconds));
        }
        return response.body(body);
    }
    
    @ExceptionHandler(StoreUnavailableException.class)
    public ResponseEntity<Map<String, Object>> storeUnavailable(StoreUnavailableException e) {
        log.error("Store unavailable", e);
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(body("STORE_UNAVAILABLE", e.getMessage()));
    }
    
    private static Map<String, Object> body(String error, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", error);
        body.put("message", message);
        return body;
    }
}
