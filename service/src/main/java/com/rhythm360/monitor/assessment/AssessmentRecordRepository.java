package com.rhythm360.monitor.assessment;

import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface AssessmentRecordRepository extends JpaRepository<AssessmentRecord, UUID> {

  List<AssessmentRecord> findByRecordedAtGreaterThanEqualOrderByRecordedAtDesc(Instant since);

  List<AssessmentRecord> findByDeviceIdAndRecordedAtGreaterThanEqualOrderByRecordedAtDesc(
      String deviceId, Instant since);
}
