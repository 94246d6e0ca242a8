package com.cario.valuation.app.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Error envelope: {@code {"success": false, "error": "<message>"}} plus request details. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorResponse {

  @Builder.Default private boolean success = false;

  /** Caller-safe message. */
  private String error;

  private int status;

  private String path;

  @Builder.Default private Instant timestamp = Instant.now();

  /** Bean Validation failures, one per rejected field. */
  private List<FieldError> fieldErrors;

  @Data
  @Builder
  @NoArgsConstructor
  @AllArgsConstructor
  public static class FieldError {
    private String field;
    private String message;
  }
}
