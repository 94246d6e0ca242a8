package com.cario.valuation.app.repository;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.cario.valuation.app.MutableClock;
import com.cario.valuation.app.model.CacheKey;
import com.cario.valuation.app.model.CacheRecord;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.junit.jupiter.api.Test;

class InMemoryValuationCacheStoreTest {

  private static final CacheKey KEY = CacheKey.of("MARUTI SUZUKI", "SWIFT", "2020", "BANGALORE");
  private static final Duration VALIDITY = Duration.ofDays(90);

  private final MutableClock clock = new MutableClock(Instant.parse("2025-01-15T06:00:00Z"));
  private final InMemoryValuationCacheStore store =
      new InMemoryValuationCacheStore(VALIDITY, clock);

  private static CacheRecord row(double idv) {
    return CacheRecord.builder()
        .key(KEY)
        .rcNumber("KA01AB1234")
        .calculatedIdv(idv)
        .onRoadPrice(750_000)
        .build();
  }

  @Test
  void emptyStoreMisses() {
    assertTrue(store.get(KEY).isEmpty());
  }

  @Test
  void putStampsCreationTimeAndReturnsCopies() {
    CacheRecord original = row(400_000);
    store.put(original);

    CacheRecord hit = store.get(KEY).orElseThrow();
    assertEquals(Instant.parse("2025-01-15T06:00:00Z"), hit.getCreatedAt());
    assertEquals(400_000, hit.getCalculatedIdv());
    assertNotSame(original, hit);

    hit.setCalculatedIdv(1);
    assertEquals(400_000, store.get(KEY).orElseThrow().getCalculatedIdv());
  }

  @Test
  void newestValidRowWins() {
    store.put(row(400_000));
    clock.advance(Duration.ofDays(1));
    store.put(row(410_000));

    assertEquals(410_000, store.get(KEY).orElseThrow().getCalculatedIdv());
    assertEquals(2, store.size());
  }

  @Test
  void rowsWithSameTimestampResolveToLastInserted() {
    store.put(row(400_000));
    store.put(row(405_000));
    assertEquals(405_000, store.get(KEY).orElseThrow().getCalculatedIdv());
  }

  @Test
  void rowIsValidForExactlyNinetyDays() {
    store.put(row(400_000));

    clock.advance(VALIDITY);
    assertTrue(store.get(KEY).isPresent());

    clock.advance(Duration.ofMillis(1));
    assertTrue(store.get(KEY).isEmpty());
  }

  @Test
  void keysAreIsolated() {
    store.put(row(400_000));
    assertTrue(store.get(CacheKey.of("MARUTI SUZUKI", "SWIFT", "2020", "PUNE")).isEmpty());
    assertTrue(store.get(CacheKey.of("maruti suzuki", "swift", "2020", "bangalore")).isPresent());
  }

  @Test
  void purgeRemovesOnlyExpiredRows() {
    store.put(row(400_000));
    clock.advance(Duration.ofDays(60));
    store.put(row(410_000));
    clock.advance(Duration.ofDays(31));

    assertEquals(1, store.purgeExpired());
    assertEquals(1, store.size());
    assertEquals(410_000, store.get(KEY).orElseThrow().getCalculatedIdv());
  }

  @Test
  void concurrentWritersAllLand() throws Exception {
    ExecutorService pool = Executors.newFixedThreadPool(8);
    try {
      List<Future<?>> futures = new ArrayList<>();
      for (int i = 0; i < 200; i++) {
        double idv = 100_000 + i;
        futures.add(pool.submit(() -> store.put(row(idv))));
      }
      for (Future<?> f : futures) f.get(5, TimeUnit.SECONDS);
    } finally {
      pool.shutdownNow();
    }
    assertEquals(200, store.size());
    assertTrue(store.get(KEY).isPresent());
  }

  @Test
  void putsRacingAPurgeAreAllKept() throws Exception {
    int rowsToPut = 20_000;
    AtomicBoolean writing = new AtomicBoolean(true);
    ExecutorService pool = Executors.newFixedThreadPool(2);
    try {
      Future<?> purger =
          pool.submit(
              () -> {
                while (writing.get()) store.purgeExpired();
              });
      Future<?> writer =
          pool.submit(
              () -> {
                for (int i = 0; i < rowsToPut; i++) {
                  CacheKey key = CacheKey.of("TATA", "NEXON", "2022", "CITY" + i);
                  store.put(row(100_000).toBuilder().key(key).build());
                }
                writing.set(false);
              });
      writer.get(30, TimeUnit.SECONDS);
      purger.get(30, TimeUnit.SECONDS);
    } finally {
      writing.set(false);
      pool.shutdownNow();
    }

    assertEquals(rowsToPut, store.size());
    for (int i = 0; i < rowsToPut; i++) {
      assertTrue(store.get(CacheKey.of("TATA", "NEXON", "2022", "CITY" + i)).isPresent());
    }
  }

  @Test
  void historyIsNewestFirstAndIncludesExpiredRows() {
    store.put(row(400_000));
    clock.advance(Duration.ofDays(100));
    store.put(row(410_000));
    store.put(row(999_000).toBuilder().rcNumber("KA05XY0001").build());

    List<CacheRecord> history = store.findByRcNumber("KA01AB1234");

    assertEquals(2, history.size());
    assertEquals(410_000, history.get(0).getCalculatedIdv());
    assertEquals(400_000, history.get(1).getCalculatedIdv());
    assertTrue(store.findByRcNumber("MH01AA0000").isEmpty());
  }

  @Test
  void recentSpansKeysAndHonoursLimit() {
    store.put(row(400_000));
    clock.advance(Duration.ofMinutes(1));
    store.put(row(410_000).toBuilder().key(CacheKey.of("HONDA", "CITY", "2019", "PUNE")).build());
    clock.advance(Duration.ofMinutes(1));
    store.put(row(420_000));

    List<CacheRecord> recent = store.findRecent(2);

    assertEquals(2, recent.size());
    assertEquals(420_000, recent.get(0).getCalculatedIdv());
    assertEquals(410_000, recent.get(1).getCalculatedIdv());
    assertEquals(3, store.findRecent(10).size());
    assertTrue(store.findRecent(0).isEmpty());
  }
}
