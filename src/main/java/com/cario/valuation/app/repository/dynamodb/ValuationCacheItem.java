package com.cario.valuation.app.repository.dynamodb;

import java.time.Instant;
import lombok.*;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.*;

/**
 * One cached IDV computation. Rows are never updated; each computation appends a new item under the
 * vehicle's partition.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@DynamoDbBean
public class ValuationCacheItem {

  /** GSI for history reads: partition {@code rcNumber}, sort {@code createdSort}. */
  public static final String RC_NUMBER_INDEX = "rcNumber-createdSort-index";

  /** Partition key: {@code MAKE#BASEMODEL#YEAR#CITY}. */
  private String cacheKey;

  /** Sort key: fixed-width UTC creation time followed by a random suffix. */
  private String createdSort;

  private String make;
  private String baseModel;
  private String manufacturingYear;
  private String city;

  private Instant createdAt;

  /** Epoch seconds after which DynamoDB TTL may delete the row. */
  private Long expiresAtEpoch;

  private String rcNumber;
  private String fullModel;
  private String vehicleType;
  private String fuelType;
  private Integer ownerCount;

  private Double calculatedIdv;
  private String validationStatus;
  private Double confidenceScore;
  private Double differencePercent;
  private Double depreciationPercent;

  private Double onRoadPrice;
  private Double marketMedianEstimate;
  private String variantGuess;
  private Double confidenceHint;
  private String priceSource;

  // ---------- DynamoDB mapping ----------

  @DynamoDbPartitionKey
  @DynamoDbAttribute("cacheKey")
  public String getCacheKey() {
    return cacheKey;
  }

  @DynamoDbSortKey
  @DynamoDbSecondarySortKey(indexNames = RC_NUMBER_INDEX)
  @DynamoDbAttribute("createdSort")
  public String getCreatedSort() {
    return createdSort;
  }

  @DynamoDbSecondaryPartitionKey(indexNames = RC_NUMBER_INDEX)
  @DynamoDbAttribute("rcNumber")
  public String getRcNumber() {
    return rcNumber;
  }

  @DynamoDbAttribute("createdAt")
  public Instant getCreatedAt() {
    return createdAt;
  }

  @DynamoDbAttribute("expiresAtEpoch")
  public Long getExpiresAtEpoch() {
    return expiresAtEpoch;
  }

  @DynamoDbAttribute("calculatedIdv")
  public Double getCalculatedIdv() {
    return calculatedIdv;
  }

  @DynamoDbAttribute("onRoadPrice")
  public Double getOnRoadPrice() {
    return onRoadPrice;
  }

  @DynamoDbAttribute("marketMedianEstimate")
  public Double getMarketMedianEstimate() {
    return marketMedianEstimate;
  }
}
