package com.rhythm360.monitor.cache;

import com.rhythm360.monitor.scoring.Assessment;
import com.rhythm360.monitor.scoring.HealthSnapshot;
import java.time.Duration;
import java.time.Instant;

public record CachedAssessment(Assessment assessment, HealthSnapshot snapshot, Instant cachedAt) {

  public boolean isExpired(Instant now, Duration ttl) {
    return Duration.between(cachedAt, now).compareTo(ttl) > 0;
  }
}
