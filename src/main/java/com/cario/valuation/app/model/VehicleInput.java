package com.cario.valuation.app.model;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Vehicle attributes supplied directly by a caller rather than fetched from the RC registry.
 *
 * <p>{@code manufacturingDate} accepts {@code YYYY-MM}, {@code YYYY-MM-DD}, {@code MM/YYYY} or a
 * bare year. {@code vehicleType} is {@code 2W} or {@code 4W} and only matters for IDV.
 */
@Data
@NoArgsConstructor
public class VehicleInput {

  @NotBlank private String make;

  @NotBlank private String model;

  private String variant;

  @NotBlank private String fuelType;

  @NotBlank private String manufacturingDate;

  @NotBlank private String rtoCode;

  @NotBlank private String city;

  private String bodyType;

  private String vehicleType;

  private String color;

  @Min(1)
  private Integer ownerCount;

  @Min(0)
  private Integer odometer;
}
