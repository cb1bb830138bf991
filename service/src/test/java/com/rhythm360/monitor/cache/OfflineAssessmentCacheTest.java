package com.rhythm360.monitor.cache;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.rhythm360.monitor.support.Fixtures;
import com.rhythm360.monitor.support.MutableClock;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class OfflineAssessmentCacheTest {

  private static final Instant START = Instant.parse("2025-04-02T08:00:00Z");

  private final ObjectMapper mapper = new ObjectMapper().findAndRegisterModules();

  @Test
  void emptyCacheIsUnavailable() {
    var cache = new OfflineAssessmentCache(mapper, new MutableClock(START),
        OfflineAssessmentCache.DEFAULT_TTL, "");
    assertTrue(cache.latest().isEmpty());
    assertFalse(cache.available());
    assertTrue(cache.lastCachedAt().isEmpty());
  }

  @Test
  void entryExpiresAfterOneHour() {
    var clock = new MutableClock(START);
    var cache = new OfflineAssessmentCache(mapper, clock, OfflineAssessmentCache.DEFAULT_TTL, "");
    var snapshot = Fixtures.restingSnapshot();
    var assessment = Fixtures.assessment(snapshot, START);

    cache.store(assessment, snapshot);
    clock.advance(Duration.ofSeconds(3600));
    assertEquals(assessment, cache.latest().orElseThrow().assessment());

    clock.advance(Duration.ofSeconds(1));
    assertTrue(cache.latest().isEmpty());
    assertFalse(cache.available());
    assertEquals(START, cache.lastCachedAt().orElseThrow());
  }

  @Test
  void newerStoreReplacesOlderEntry() {
    var clock = new MutableClock(START);
    var cache = new OfflineAssessmentCache(mapper, clock, OfflineAssessmentCache.DEFAULT_TTL, "");
    var snapshot = Fixtures.restingSnapshot();
    cache.store(Fixtures.assessment(snapshot, START), snapshot);
    clock.advance(Duration.ofMinutes(5));
    var second = Fixtures.assessment(snapshot, clock.instant());
    cache.store(second, snapshot);
    assertEquals(second.id(), cache.latest().orElseThrow().assessment().id());
  }

  @Test
  void survivesRestartThroughFile(@TempDir Path dir) {
    var clock = new MutableClock(START);
    Path file = dir.resolve("cache").resolve("latest.json");
    var snapshot = Fixtures.restingSnapshot();
    var assessment = Fixtures.assessment(snapshot, START);

    new OfflineAssessmentCache(mapper, clock, OfflineAssessmentCache.DEFAULT_TTL, file.toString())
        .store(assessment, snapshot);
    assertTrue(Files.isRegularFile(file));

    var restarted = new OfflineAssessmentCache(
        mapper, clock, OfflineAssessmentCache.DEFAULT_TTL, file.toString());
    var entry = restarted.latest().orElseThrow();
    assertEquals(assessment, entry.assessment());
    assertEquals(snapshot, entry.snapshot());

    restarted.clear();
    assertFalse(Files.exists(file));
    assertFalse(restarted.available());
  }

  @Test
  void unreadableFileIsIgnored(@TempDir Path dir) throws Exception {
    Path file = dir.resolve("latest.json");
    Files.writeString(file, "{not json");
    var cache = new OfflineAssessmentCache(mapper, new MutableClock(START),
        OfflineAssessmentCache.DEFAULT_TTL, file.toString());
    assertTrue(cache.latest().isEmpty());
  }
}
