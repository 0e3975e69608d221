package com.podium.api.error;

import com.podium.domain.MarketException;
import jakarta.validation.ConstraintViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

@RestControllerAdvice
public class ApiExceptionHandler {

  private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

  /**
   * Engine errors keep their stable reason; the status comes from the error kind.
   */
  @ExceptionHandler(MarketException.class)
  public ResponseEntity<Map<String, Object>> market(MarketException ex) {
    int status = ex.error().httpStatus();
    if (status >= 500) {
      log.error("[API] market error reason={} msg={}", ex.reason(), ex.getMessage(), ex);
    } else {
      log.info("[API] rejected reason={} msg={}", ex.reason(), ex.getMessage());
    }
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("status", "error");
    body.put("reason", ex.reason());
    body.put("code", ex.error().name());
    body.put("message", ex.getMessage());
    body.put("ts", Instant.now().toString());
    return ResponseEntity.status(status).body(body);
  }

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<Map<String, Object>> badRequest(IllegalArgumentException ex) {
    return error(HttpStatus.BAD_REQUEST, "bad_request",
        ex.getMessage() == null ? "invalid_request" : ex.getMessage());
  }

  @ExceptionHandler({
      MissingServletRequestParameterException.class,
      MethodArgumentTypeMismatchException.class,
      HttpMessageNotReadableException.class
  })
  public ResponseEntity<Map<String, Object>> malformed(Exception ex) {
    return error(HttpStatus.BAD_REQUEST, "bad_request", "malformed_request");
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<Map<String, Object>> validation(MethodArgumentNotValidException ex) {
    Map<String, String> fields = new HashMap<>();
    for (FieldError fe : ex.getBindingResult().getFieldErrors()) {
      fields.put(fe.getField(), fe.getDefaultMessage() == null ? "invalid" : fe.getDefaultMessage());
    }
    return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(Map.of(
        "status", "error",
        "reason", "validation_error",
        "message", "invalid_request",
        "fields", fields,
        "ts", Instant.now().toString()
    ));
  }

  @ExceptionHandler(ConstraintViolationException.class)
  public ResponseEntity<Map<String, Object>> validation(ConstraintViolationException ex) {
    return error(HttpStatus.BAD_REQUEST, "validation_error",
        ex.getMessage() == null ? "invalid_request" : ex.getMessage());
  }

  private static ResponseEntity<Map<String, Object>> error(HttpStatus status, String reason, String message) {
    return ResponseEntity.status(status).body(Map.of(
        "status", "error",
        "reason", reason,
        "message", message,
        "ts", Instant.now().toString()
    ));
  }
}
