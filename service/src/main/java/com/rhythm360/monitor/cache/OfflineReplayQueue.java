package com.rhythm360.monitor.cache;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Assessments whose persistence write failed, keyed by assessment id so a retried cycle never
 * queues the same assessment twice. Replay is in insertion order and stops at the first failure.
 *
 * <p>The queue holds at most {@code capacity} entries; when full the oldest entry is dropped.
 * With a file configured every change is mirrored to it as JSON and the queue is reloaded from it
 * on startup.
 */
@Component
public class OfflineReplayQueue {
  private static final Logger log = LoggerFactory.getLogger(OfflineReplayQueue.class);

  public static final int DEFAULT_CAPACITY = 500;

  private static final TypeReference<List<PendingAssessment>> FILE_TYPE = new TypeReference<>() {
  };

  private final ObjectMapper objectMapper;
  private final int capacity;
  private final Path file;
  private final Map<UUID, PendingAssessment> pending = new LinkedHashMap<>();

  public OfflineReplayQueue(
      ObjectMapper objectMapper,
      @Value("${monitor.replay.capacity:500}") int capacity,
      @Value("${monitor.replay.file:}") String file
  ) {
    if (capacity < 1) {
      throw new IllegalArgumentException("monitor.replay.capacity must be positive: " + capacity);
    }
    this.objectMapper = objectMapper;
    this.capacity = capacity;
    this.file = (file == null || file.isBlank()) ? null : Path.of(file);
    for (PendingAssessment item : readFile()) {
      add(item);
    }
    if (!pending.isEmpty()) {
      log.info("Loaded {} pending assessment(s) from {}", pending.size(), this.file);
    }
  }

  public synchronized boolean enqueue(PendingAssessment item) {
    if (!add(item)) {
      return false;
    }
    writeFile();
    return true;
  }

  private boolean add(PendingAssessment item) {
    UUID id = item.assessment().id();
    if (pending.containsKey(id)) {
      return false;
    }
    if (pending.size() >= capacity) {
      Iterator<PendingAssessment> oldest = pending.values().iterator();
      PendingAssessment dropped = oldest.next();
      oldest.remove();
      log.warn("Replay queue full ({} entries), dropping assessment {} of device {}",
          capacity, dropped.assessment().id(), dropped.deviceId());
    }
    pending.put(id, item);
    return true;
  }

  /** Hands each pending item to {@code writer}; returns how many were written. */
  public synchronized int replay(Consumer<PendingAssessment> writer) {
    int written = 0;
    Iterator<PendingAssessment> it = pending.values().iterator();
    while (it.hasNext()) {
      PendingAssessment item = it.next();
      try {
        writer.accept(item);
      } catch (RuntimeException ex) {
        log.warn("Replay of assessment {} failed, {} still pending: {}",
            item.assessment().id(), pending.size(), ex.getMessage());
        break;
      }
      it.remove();
      written++;
    }
    if (written > 0) {
      writeFile();
    }
    return written;
  }

  public synchronized int size() {
    return pending.size();
  }

  public synchronized boolean isEmpty() {
    return pending.isEmpty();
  }

  public synchronized List<PendingAssessment> snapshot() {
    return new ArrayList<>(pending.values());
  }

  private void writeFile() {
    if (file == null) return;
    try {
      Path parent = file.toAbsolutePath().getParent();
      if (parent != null) {
        Files.createDirectories(parent);
      }
      Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
      objectMapper.writeValue(tmp.toFile(), new ArrayList<>(pending.values()));
      Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
    } catch (IOException ex) {
      log.warn("Failed to write replay queue {}: {}", file, ex.getMessage());
    }
  }

  private List<PendingAssessment> readFile() {
    if (file == null || !Files.isRegularFile(file)) return List.of();
    try {
      List<PendingAssessment> items = objectMapper.readValue(file.toFile(), FILE_TYPE);
      return items == null ? List.of() : items;
    } catch (IOException ex) {
      log.warn("Ignoring unreadable replay queue {}: {}", file, ex.getMessage());
      return List.of();
    }
  }
}
