package com.example.vrf.web.rest.errors;

import com.example.vrf.exception.AttestationException;
import com.example.vrf.exception.PaymentRequiredException;
import com.example.vrf.exception.RandomnessValidationException;
import com.example.vrf.exception.UnauthorizedException;
import com.example.vrf.service.PaymentRequirementsService;
import com.example.vrf.web.rest.ApiConstants.Header;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Global Error Handler
 *
 * Provides consistent error responses without exposing sensitive information
 */
@Slf4j
@RestControllerAdvice
@RequiredArgsConstructor
@RequestMapping(produces = MediaType.APPLICATION_JSON_VALUE)
public class GlobalErrorHandler {

  private final PaymentRequirementsService requirementsService;
  private final Clock clock;

  @ExceptionHandler(RandomnessValidationException.class)
  public ResponseEntity<Map<String, Object>> handleRandomnessValidation(
      RandomnessValidationException ex, WebRequest request) {
    log.debug("Rejected request parameters: {}", ex.getMessage());

    Map<String, Object> body = createErrorBody(
        HttpStatus.BAD_REQUEST,
        "validation_error",
        ex.getMessage(),
        request
    );

    return new ResponseEntity<>(body, HttpStatus.BAD_REQUEST);
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<Map<String, Object>> handleUnreadableBody(
      HttpMessageNotReadableException ex, WebRequest request) {

    Map<String, Object> body = createErrorBody(
        HttpStatus.BAD_REQUEST,
        "validation_error",
        "Malformed or missing JSON body",
        request
    );

    return new ResponseEntity<>(body, HttpStatus.BAD_REQUEST);
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<Map<String, Object>> handleValidationException(
      MethodArgumentNotValidException ex, WebRequest request) {

    String errors = ex.getBindingResult().getFieldErrors().stream()
        .map(FieldError::getDefaultMessage)
        .collect(Collectors.joining(", "));

    Map<String, Object> body = createErrorBody(
        HttpStatus.BAD_REQUEST,
        "validation_error",
        errors,
        request
    );

    return new ResponseEntity<>(body, HttpStatus.BAD_REQUEST);
  }

  @ExceptionHandler(PaymentRequiredException.class)
  public ResponseEntity<Map<String, Object>> handlePaymentRequired(
      PaymentRequiredException ex, WebRequest request) {

    Map<String, Object> body = createErrorBody(
        HttpStatus.PAYMENT_REQUIRED,
        ex.reason().code(),
        ex.getMessage(),
        request
    );
    body.put("payment", ex.requirements());

    return ResponseEntity.status(HttpStatus.PAYMENT_REQUIRED)
        .header(Header.PAYMENT_REQUIRED, requirementsService.encodeHeader(ex.requirements()))
        .body(body);
  }

  @ExceptionHandler(UnauthorizedException.class)
  public ResponseEntity<Map<String, Object>> handleUnauthorized(
      UnauthorizedException ex, WebRequest request) {

    Map<String, Object> body = createErrorBody(
        HttpStatus.UNAUTHORIZED,
        "unauthorized",
        ex.getMessage(),
        request
    );

    return new ResponseEntity<>(body, HttpStatus.UNAUTHORIZED);
  }

  @ExceptionHandler(AttestationException.class)
  public ResponseEntity<Map<String, Object>> handleAttestationException(
      AttestationException ex, WebRequest request) {
    log.error("Attestation error", ex);

    Map<String, Object> body = createErrorBody(
        HttpStatus.INTERNAL_SERVER_ERROR,
        "attestation_unavailable",
        ex.getMessage(),
        request
    );

    return new ResponseEntity<>(body, HttpStatus.INTERNAL_SERVER_ERROR);
  }

  @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
  public ResponseEntity<Map<String, Object>> handleMethodNotSupported(
      HttpRequestMethodNotSupportedException ex, WebRequest request) {

    Map<String, Object> body = createErrorBody(
        HttpStatus.METHOD_NOT_ALLOWED,
        "method_not_allowed",
        String.format("Method %s not supported", ex.getMethod()),
        request
    );

    return new ResponseEntity<>(body, HttpStatus.METHOD_NOT_ALLOWED);
  }

  @ExceptionHandler(HttpMediaTypeNotSupportedException.class)
  public ResponseEntity<Map<String, Object>> handleMediaTypeNotSupported(
      HttpMediaTypeNotSupportedException ex, WebRequest request) {

    Map<String, Object> body = createErrorBody(
        HttpStatus.UNSUPPORTED_MEDIA_TYPE,
        "unsupported_media_type",
        "Request body must be application/json",
        request
    );

    return new ResponseEntity<>(body, HttpStatus.UNSUPPORTED_MEDIA_TYPE);
  }

  @ExceptionHandler(NoResourceFoundException.class)
  public ResponseEntity<Map<String, Object>> handleNotFound(
      NoResourceFoundException ex, WebRequest request) {

    Map<String, Object> body = createErrorBody(
        HttpStatus.NOT_FOUND,
        "not_found",
        "Not found",
        request
    );

    return new ResponseEntity<>(body, HttpStatus.NOT_FOUND);
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<Map<String, Object>> handleGenericException(
      Exception ex, WebRequest request) {
    log.error("Unexpected error", ex);

    Map<String, Object> body = createErrorBody(
        HttpStatus.INTERNAL_SERVER_ERROR,
        "internal_error",
        "An error occurred processing your request",
        request
    );

    return new ResponseEntity<>(body, HttpStatus.INTERNAL_SERVER_ERROR);
  }

  private Map<String, Object> createErrorBody(
      HttpStatus status, String error, String message, WebRequest request) {

    Map<String, Object> body = new LinkedHashMap<>();
    body.put("timestamp", Instant.now(clock));
    body.put("status", status.value());
    body.put("error", error);
    body.put("message", message);
    body.put("path", extractPath(request));

    return body;
  }

  private String extractPath(WebRequest request) {
    String description = request.getDescription(false);
    return description.replace("uri=", "");
  }
}
