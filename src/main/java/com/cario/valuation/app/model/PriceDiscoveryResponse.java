package com.cario.valuation.app.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyDescription;
import lombok.Data;

/** Shape the chat model is asked to return; also the source of its JSON schema. */
@Data
public class PriceDiscoveryResponse {

  @JsonProperty("on_road_price")
  @JsonPropertyDescription("On-road price in INR in the manufacturing year, for the base variant")
  private Double onRoadPrice;

  @JsonProperty("market_median_estimate")
  @JsonPropertyDescription("Median asking price in INR of current used listings, 0 if none found")
  private Double marketMedianEstimate;

  @JsonProperty("variant_guess")
  private String variantGuess;

  @JsonProperty("confidence_hint")
  @JsonPropertyDescription("Self-assessed confidence from 0 to 100")
  private Double confidenceHint;
}
