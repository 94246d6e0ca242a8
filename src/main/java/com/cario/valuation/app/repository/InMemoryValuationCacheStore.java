package com.cario.valuation.app.repository;

import com.cario.valuation.app.model.CacheKey;
import com.cario.valuation.app.model.CacheRecord;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import lombok.extern.log4j.Log4j2;

/**
 * Process-local cache store. Used when no DynamoDB profile is active and as the fake in tests.
 *
 * <p>Rows are copied on the way in and out, so callers never share mutable state with the store.
 */
@Log4j2
public class InMemoryValuationCacheStore implements ValuationCacheStore {

  private final Map<CacheKey, List<CacheRecord>> rows = new ConcurrentHashMap<>();
  private final Duration validity;
  private final Clock clock;

  public InMemoryValuationCacheStore(Duration validity, Clock clock) {
    this.validity = Objects.requireNonNull(validity, "validity");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  @Override
  public Optional<CacheRecord> get(CacheKey key) {
    List<CacheRecord> candidates = rows.get(key);
    if (candidates == null) return Optional.empty();
    Instant cutoff = cutoff();
    CacheRecord newest = null;
    for (CacheRecord r : candidates) {
      if (r.getCreatedAt().isBefore(cutoff)) continue;
      if (newest == null || !r.getCreatedAt().isBefore(newest.getCreatedAt())) newest = r;
    }
    return Optional.ofNullable(newest).map(r -> r.toBuilder().build());
  }

  @Override
  public void put(CacheRecord record) {
    Objects.requireNonNull(record, "record");
    Objects.requireNonNull(record.getKey(), "record.key");
    CacheRecord copy = record.toBuilder().build();
    if (copy.getCreatedAt() == null) copy.setCreatedAt(clock.instant());
    rows.compute(
        copy.getKey(),
        (k, list) -> {
          List<CacheRecord> target = list == null ? new CopyOnWriteArrayList<>() : list;
          target.add(copy);
          return target;
        });
    log.debug("cache.put store=memory key={} createdAt={}", copy.getKey(), copy.getCreatedAt());
  }

  @Override
  public int purgeExpired() {
    Instant cutoff = cutoff();
    AtomicInteger removed = new AtomicInteger();
    // Per-key compute keeps a concurrent put from landing in a list that is being dropped.
    for (CacheKey key : rows.keySet()) {
      rows.computeIfPresent(
          key,
          (k, list) -> {
            int before = list.size();
            list.removeIf(r -> r.getCreatedAt().isBefore(cutoff));
            removed.addAndGet(before - list.size());
            return list.isEmpty() ? null : list;
          });
    }
    return removed.get();
  }

  @Override
  public List<CacheRecord> findByRcNumber(String rcNumber) {
    return newestFirst()
        .filter(r -> Objects.equals(r.getRcNumber(), rcNumber))
        .map(r -> r.toBuilder().build())
        .collect(Collectors.toList());
  }

  @Override
  public List<CacheRecord> findRecent(int limit) {
    return newestFirst()
        .limit(Math.max(0, limit))
        .map(r -> r.toBuilder().build())
        .collect(Collectors.toList());
  }

  private Stream<CacheRecord> newestFirst() {
    return rows.values().stream()
        .flatMap(List::stream)
        .sorted(Comparator.comparing(CacheRecord::getCreatedAt).reversed());
  }

  /** Number of rows held, live or expired. */
  public int size() {
    return rows.values().stream().mapToInt(List::size).sum();
  }

  private Instant cutoff() {
    return clock.instant().minus(validity);
  }
}
