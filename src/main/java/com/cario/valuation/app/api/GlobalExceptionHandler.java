package com.cario.valuation.app.api;

import com.cario.valuation.app.exception.ValuationException;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import jakarta.servlet.http.HttpServletRequest;
import java.util.List;
import lombok.extern.log4j.Log4j2;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/** Maps every failure to the {@link ErrorResponse} envelope. */
@Log4j2
@RestControllerAdvice
public class GlobalExceptionHandler {

  /** Field errors are reported under the wire names, not the Java property names. */
  private static final PropertyNamingStrategies.NamingBase SNAKE_CASE =
      new PropertyNamingStrategies.SnakeCaseStrategy();

  @ExceptionHandler(ValuationException.class)
  public ResponseEntity<ErrorResponse> handleValuation(
      ValuationException ex, HttpServletRequest request) {
    HttpStatus status = ex.getStatus();
    if (status.is5xxServerError()) {
      log.error("api.error path={} status={}", request.getRequestURI(), status.value(), ex);
    } else {
      log.warn(
          "api.rejected path={} status={} reason={}",
          request.getRequestURI(),
          status.value(),
          ex.getMessage());
    }
    return respond(status, ex.getMessage(), request, null);
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ErrorResponse> handleInvalidBody(
      MethodArgumentNotValidException ex, HttpServletRequest request) {
    List<ErrorResponse.FieldError> fields =
        ex.getBindingResult().getFieldErrors().stream()
            .map(
                fe ->
                    ErrorResponse.FieldError.builder()
                        .field(SNAKE_CASE.translate(fe.getField()))
                        .message(fe.getDefaultMessage())
                        .build())
            .toList();
    String message =
        fields.isEmpty()
            ? "Request validation failed"
            : fields.get(0).getField() + " " + fields.get(0).getMessage();
    log.warn("api.invalid path={} fields={}", request.getRequestURI(), fields.size());
    return respond(HttpStatus.BAD_REQUEST, message, request, fields);
  }

  @ExceptionHandler({
    HttpMessageNotReadableException.class,
    MissingServletRequestParameterException.class,
    MethodArgumentTypeMismatchException.class
  })
  public ResponseEntity<ErrorResponse> handleUnreadable(
      Exception ex, HttpServletRequest request) {
    log.warn("api.unreadable path={} reason={}", request.getRequestURI(), ex.getMessage());
    return respond(HttpStatus.BAD_REQUEST, "Malformed request", request, null);
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ErrorResponse> handleUnexpected(Exception ex, HttpServletRequest request) {
    log.error("api.unexpected path={}", request.getRequestURI(), ex);
    return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Internal error", request, null);
  }

  private static ResponseEntity<ErrorResponse> respond(
      HttpStatus status,
      String message,
      HttpServletRequest request,
      List<ErrorResponse.FieldError> fields) {
    ErrorResponse body =
        ErrorResponse.builder()
            .error(message)
            .status(status.value())
            .path(request.getRequestURI())
            .fieldErrors(fields)
            .build();
    return ResponseEntity.status(status).body(body);
  }
}
