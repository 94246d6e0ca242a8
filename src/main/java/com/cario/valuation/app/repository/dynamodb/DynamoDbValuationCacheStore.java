package com.cario.valuation.app.repository.dynamodb;

import com.cario.valuation.app.model.CacheKey;
import com.cario.valuation.app.model.CacheRecord;
import com.cario.valuation.app.repository.ValuationCacheStore;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;
import lombok.extern.log4j.Log4j2;
import software.amazon.awssdk.enhanced.dynamodb.*;
import software.amazon.awssdk.enhanced.dynamodb.model.QueryConditional;
import software.amazon.awssdk.enhanced.dynamodb.model.QueryEnhancedRequest;
import software.amazon.awssdk.enhanced.dynamodb.model.ScanEnhancedRequest;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

/** Cache store over the Enhanced DynamoDB table for {@link ValuationCacheItem}. */
@Log4j2
public class DynamoDbValuationCacheStore implements ValuationCacheStore {

  /** Fixed width keeps lexical order of sort keys equal to time order. */
  static final DateTimeFormatter SORT_TIME =
      DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSS'Z'").withZone(ZoneOffset.UTC);

  private final DynamoDbTable<ValuationCacheItem> table;
  private final DynamoDbIndex<ValuationCacheItem> byRcNumber;
  private final Duration validity;
  private final Clock clock;

  public DynamoDbValuationCacheStore(
      DynamoDbClient ddb, String tableName, Duration validity, Clock clock) {
    DynamoDbEnhancedClient enhanced = DynamoDbEnhancedClient.builder().dynamoDbClient(ddb).build();
    this.table = enhanced.table(tableName, TableSchema.fromBean(ValuationCacheItem.class));
    this.byRcNumber = table.index(ValuationCacheItem.RC_NUMBER_INDEX);
    this.validity = Objects.requireNonNull(validity, "validity");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  @Override
  public Optional<CacheRecord> get(CacheKey key) {
    Instant cutoff = clock.instant().minus(validity);
    QueryEnhancedRequest request =
        QueryEnhancedRequest.builder()
            .queryConditional(
                QueryConditional.sortGreaterThanOrEqualTo(
                    Key.builder()
                        .partitionValue(key.asString())
                        .sortValue(SORT_TIME.format(cutoff))
                        .build()))
            .scanIndexForward(false)
            .limit(1)
            .build();
    Optional<ValuationCacheItem> newest =
        table.query(request).items().stream()
            .filter(i -> i.getCreatedAt() == null || !i.getCreatedAt().isBefore(cutoff))
            .findFirst();
    log.debug("cache.get store=dynamodb key={} hit={}", key, newest.isPresent());
    return newest.map(DynamoDbValuationCacheStore::toRecord);
  }

  @Override
  public void put(CacheRecord record) {
    Objects.requireNonNull(record, "record");
    Instant createdAt = record.getCreatedAt() == null ? clock.instant() : record.getCreatedAt();
    ValuationCacheItem item = toItem(record, createdAt, createdAt.plus(validity));
    table.putItem(item);
    log.debug("cache.put store=dynamodb key={} sort={}", item.getCacheKey(), item.getCreatedSort());
  }

  @Override
  public List<CacheRecord> findByRcNumber(String rcNumber) {
    QueryEnhancedRequest request =
        QueryEnhancedRequest.builder()
            .queryConditional(
                QueryConditional.keyEqualTo(Key.builder().partitionValue(rcNumber).build()))
            .scanIndexForward(false)
            .build();
    List<CacheRecord> history =
        byRcNumber.query(request).stream()
            .flatMap(page -> page.items().stream())
            .map(DynamoDbValuationCacheStore::toRecord)
            .collect(Collectors.toList());
    log.debug("cache.history store=dynamodb rc={} rows={}", rcNumber, history.size());
    return history;
  }

  /** No key orders rows across partitions, so this scans and sorts on the sort key. */
  @Override
  public List<CacheRecord> findRecent(int limit) {
    return table.scan().items().stream()
        .sorted(Comparator.comparing(ValuationCacheItem::getCreatedSort).reversed())
        .limit(Math.max(0, limit))
        .map(DynamoDbValuationCacheStore::toRecord)
        .collect(Collectors.toList());
  }

  /** Full-table scan; TTL normally removes rows first, this catches anything it has not reached. */
  @Override
  public int purgeExpired() {
    String cutoff = SORT_TIME.format(clock.instant().minus(validity));
    ScanEnhancedRequest scan =
        ScanEnhancedRequest.builder()
            .filterExpression(
                Expression.builder()
                    .expression("#s < :cutoff")
                    .putExpressionName("#s", "createdSort")
                    .putExpressionValue(":cutoff", AttributeValue.builder().s(cutoff).build())
                    .build())
            .build();
    int removed = 0;
    for (ValuationCacheItem item : table.scan(scan).items()) {
      table.deleteItem(
          Key.builder()
              .partitionValue(item.getCacheKey())
              .sortValue(item.getCreatedSort())
              .build());
      removed++;
    }
    return removed;
  }

  static ValuationCacheItem toItem(CacheRecord r, Instant createdAt, Instant expiresAt) {
    CacheKey key = r.getKey();
    return ValuationCacheItem.builder()
        .cacheKey(key.asString())
        .createdSort(SORT_TIME.format(createdAt) + "#" + randomSuffix())
        .make(key.getMake())
        .baseModel(key.getBaseModel())
        .manufacturingYear(key.getYear())
        .city(key.getCity())
        .createdAt(createdAt)
        .expiresAtEpoch(expiresAt.getEpochSecond())
        .rcNumber(r.getRcNumber())
        .fullModel(r.getFullModel())
        .vehicleType(r.getVehicleType())
        .fuelType(r.getFuelType())
        .ownerCount(r.getOwnerCount())
        .calculatedIdv(r.getCalculatedIdv())
        .validationStatus(r.getValidationStatus())
        .confidenceScore(r.getConfidenceScore())
        .differencePercent(r.getDifferencePercent())
        .depreciationPercent(r.getDepreciationPercent())
        .onRoadPrice(r.getOnRoadPrice())
        .marketMedianEstimate(r.getMarketMedianEstimate())
        .variantGuess(r.getVariantGuess())
        .confidenceHint(r.getConfidenceHint())
        .priceSource(r.getPriceSource())
        .build();
  }

  static CacheRecord toRecord(ValuationCacheItem i) {
    return CacheRecord.builder()
        .key(CacheKey.of(i.getMake(), i.getBaseModel(), i.getManufacturingYear(), i.getCity()))
        .createdAt(i.getCreatedAt())
        .rcNumber(i.getRcNumber())
        .fullModel(i.getFullModel())
        .vehicleType(i.getVehicleType())
        .fuelType(i.getFuelType())
        .ownerCount(i.getOwnerCount())
        .calculatedIdv(orZero(i.getCalculatedIdv()))
        .validationStatus(i.getValidationStatus())
        .confidenceScore(orZero(i.getConfidenceScore()))
        .differencePercent(i.getDifferencePercent())
        .depreciationPercent(orZero(i.getDepreciationPercent()))
        .onRoadPrice(orZero(i.getOnRoadPrice()))
        .marketMedianEstimate(i.getMarketMedianEstimate())
        .variantGuess(i.getVariantGuess())
        .confidenceHint(i.getConfidenceHint())
        .priceSource(i.getPriceSource())
        .build();
  }

  private static String randomSuffix() {
    return UUID.randomUUID().toString().substring(0, 8);
  }

  private static double orZero(Double d) {
    return d == null ? 0.0 : d;
  }
}
