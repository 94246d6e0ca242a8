package com.cario.valuation.app.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Success envelope: {@code {"success": true, "data": ..., "source": ..., "cached": ...}}. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiResponse<T> {

  @Builder.Default private boolean success = true;

  private T data;

  /** {@code database} or {@code api}; IDV responses only. */
  private String source;

  private Boolean cached;

  public static <T> ApiResponse<T> ok(T data) {
    return ApiResponse.<T>builder().data(data).build();
  }
}
