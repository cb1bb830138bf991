package com.rhythm360.monitor.assessment;

import com.rhythm360.monitor.scoring.Assessment;
import com.rhythm360.monitor.scoring.HealthSnapshot;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class AssessmentStore {
  private final AssessmentRecordRepository repository;
  private final Clock clock;

  public AssessmentStore(AssessmentRecordRepository repository, Clock clock) {
    this.repository = repository;
    this.clock = clock;
  }

  @Transactional
  public AssessmentRecord save(String deviceId, Assessment assessment, HealthSnapshot snapshot) {
    return repository.save(AssessmentRecord.of(deviceId, assessment, snapshot));
  }

  /** Records from the last {@code daysBack} days, newest first. */
  @Transactional(readOnly = true)
  public List<AssessmentRecord> query(int daysBack) {
    return query(daysBack, null);
  }

  @Transactional(readOnly = true)
  public List<AssessmentRecord> query(int daysBack, String deviceId) {
    Instant since = since(daysBack);
    if (deviceId == null) {
      return repository.findByRecordedAtGreaterThanEqualOrderByRecordedAtDesc(since);
    }
    return repository.findByDeviceIdAndRecordedAtGreaterThanEqualOrderByRecordedAtDesc(
        deviceId, since);
  }

  Instant since(int daysBack) {
    return clock.instant().minus(Duration.ofDays(daysBack));
  }
}
