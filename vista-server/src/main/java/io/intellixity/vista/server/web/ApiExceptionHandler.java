package io.intellixity.vista.server.web;

import io.intellixity.vista.error.InvalidViewInputException;
import io.intellixity.vista.error.UpstreamUnavailableException;
import io.intellixity.vista.error.ViewMatrixException;
import io.intellixity.vista.error.ViewNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

/** Maps the engine's error taxonomy to {@code {"error": code, "message": ...}} bodies. */
@RestControllerAdvice
public final class ApiExceptionHandler {
  private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

  @ExceptionHandler(ViewMatrixException.class)
  public ResponseEntity<Map<String, Object>> viewError(ViewMatrixException e) {
    HttpStatus status = statusOf(e);
    if (status.is5xxServerError()) log.warn("vista.api error={} message={}", e.code(), e.getMessage(), e);
    else log.debug("vista.api error={} message={}", e.code(), e.getMessage());
    return ResponseEntity.status(status).body(body(e.code(), e.getMessage()));
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<Map<String, Object>> unreadable(HttpMessageNotReadableException e) {
    return ResponseEntity.badRequest().body(body("invalid_input", "request body is not valid JSON"));
  }

  static HttpStatus statusOf(ViewMatrixException e) {
    if (e instanceof ViewNotFoundException) return HttpStatus.NOT_FOUND;
    if (e instanceof InvalidViewInputException) return HttpStatus.BAD_REQUEST;
    if (e instanceof UpstreamUnavailableException) return HttpStatus.SERVICE_UNAVAILABLE;
    return HttpStatus.INTERNAL_SERVER_ERROR;
  }

  private static Map<String, Object> body(String code, String message) {
    Map<String, Object> out = new LinkedHashMap<>();
    out.put("error", code);
    out.put("message", message);
    return out;
  }
}
