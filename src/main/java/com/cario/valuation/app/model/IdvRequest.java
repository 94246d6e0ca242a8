package com.cario.valuation.app.model;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

/** Caller-supplied vehicle with a known on-road price, valued without any collaborator. */
@Data
@NoArgsConstructor
@EqualsAndHashCode(callSuper = true)
public class IdvRequest extends VehicleInput {

  @NotNull @Positive private Double originalOnRoadPrice;

  private Double marketMedianEstimate;
}
