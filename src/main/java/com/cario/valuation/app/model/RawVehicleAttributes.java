package com.cario.valuation.app.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Unnormalized vehicle attributes as returned by the RC (registration certificate) lookup.
 *
 * <p>Field names follow the RC provider's payload. Nothing here is validated; {@code
 * VehicleNormalizer} turns it into a {@link VehicleRecord}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class RawVehicleAttributes {

  @JsonProperty("rc_number")
  private String rcNumber;

  @JsonProperty("maker_description")
  private String makerDescription;

  @JsonProperty("maker_model")
  private String makerModel;

  /** Manufacturing month, typically {@code YYYY-MM}. */
  @JsonProperty("manufacturing_date_formatted")
  private String manufacturingDate;

  /** Registration date; informational only, never used for age. */
  @JsonProperty("registration_date")
  private String registrationDate;

  @JsonProperty("fuel_type")
  private String fuelType;

  @JsonProperty("registered_at")
  private String registeredAt;

  @JsonProperty("present_address")
  private String presentAddress;

  @JsonProperty("color")
  private String color;

  @JsonProperty("owner_number")
  private String ownerNumber;

  @JsonProperty("body_type")
  private String bodyType;

  @JsonProperty("vehicle_category_description")
  private String vehicleCategory;

  @JsonProperty("cubic_capacity")
  private String cubicCapacity;

  @JsonProperty("norms_type")
  private String normsType;
}
