package com.rhythm360.monitor.cache;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.rhythm360.monitor.scoring.Assessment;
import com.rhythm360.monitor.scoring.HealthSnapshot;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Last good assessment, kept in memory and optionally mirrored to a JSON file so it survives a
 * restart. Entries older than the TTL are never returned. File errors are logged and leave the
 * in-memory copy authoritative.
 */
@Component
public class OfflineAssessmentCache {
  private static final Logger log = LoggerFactory.getLogger(OfflineAssessmentCache.class);

  public static final Duration DEFAULT_TTL = Duration.ofSeconds(3600);

  private final ObjectMapper objectMapper;
  private final Clock clock;
  private final Duration ttl;
  private final Path file;

  private volatile CachedAssessment current;

  public OfflineAssessmentCache(
      ObjectMapper objectMapper,
      Clock clock,
      @Value("${monitor.cache.ttl:PT1H}") Duration ttl,
      @Value("${monitor.cache.file:}") String file
  ) {
    this.objectMapper = objectMapper;
    this.clock = clock;
    this.ttl = ttl;
    this.file = (file == null || file.isBlank()) ? null : Path.of(file);
  }

  public CachedAssessment store(Assessment assessment, HealthSnapshot snapshot) {
    CachedAssessment entry = new CachedAssessment(assessment, snapshot, clock.instant());
    current = entry;
    writeFile(entry);
    return entry;
  }

  public Optional<CachedAssessment> latest() {
    CachedAssessment entry = current;
    if (entry == null) {
      entry = readFile();
      current = entry;
    }
    if (entry == null || entry.isExpired(clock.instant(), ttl)) {
      return Optional.empty();
    }
    return Optional.of(entry);
  }

  public boolean available() {
    return latest().isPresent();
  }

  public Optional<Instant> lastCachedAt() {
    CachedAssessment entry = current;
    return entry == null ? Optional.empty() : Optional.of(entry.cachedAt());
  }

  public void clear() {
    current = null;
    if (file != null) {
      try {
        Files.deleteIfExists(file);
      } catch (IOException ex) {
        log.warn("Could not delete offline cache file {}: {}", file, ex.getMessage());
      }
    }
  }

  private void writeFile(CachedAssessment entry) {
    if (file == null) return;
    try {
      Path parent = file.toAbsolutePath().getParent();
      if (parent != null) {
        Files.createDirectories(parent);
      }
      Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
      objectMapper.writeValue(tmp.toFile(), entry);
      Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
    } catch (IOException ex) {
      log.warn("Failed to write offline cache {}: {}", file, ex.getMessage());
    }
  }

  private CachedAssessment readFile() {
    if (file == null || !Files.isRegularFile(file)) return null;
    try {
      return objectMapper.readValue(file.toFile(), CachedAssessment.class);
    } catch (IOException ex) {
      log.warn("Ignoring unreadable offline cache {}: {}", file, ex.getMessage());
      return null;
    }
  }
}
