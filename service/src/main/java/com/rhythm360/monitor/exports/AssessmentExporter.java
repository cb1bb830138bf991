package com.rhythm360.monitor.exports;

import com.rhythm360.monitor.assessment.AssessmentRecord;
import com.rhythm360.monitor.assessment.AssessmentStore;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

@Service
public class AssessmentExporter {
  private static final DateTimeFormatter DATE = DateTimeFormatter.ofPattern("yyyy-MM-dd");
  private static final DateTimeFormatter TIME = DateTimeFormatter.ofPattern("HH:mm:ss");

  private final AssessmentStore store;
  private final ZoneId zone;

  public AssessmentExporter(AssessmentStore store,
      @Value("${monitor.export.zone:UTC}") String zone) {
    this.store = store;
    this.zone = ZoneId.of(zone);
  }

  public CsvDocument<AssessmentCsvRow> export(int days) {
    List<AssessmentCsvRow> rows = store.query(days).stream().map(this::toRow).toList();
    return new CsvDocument<>(AssessmentCsvRow.class, rows);
  }

  AssessmentCsvRow toRow(AssessmentRecord r) {
    ZonedDateTime at = r.getRecordedAt().atZone(zone);
    return new AssessmentCsvRow(
        DATE.format(at),
        TIME.format(at),
        (int) r.getHeartRate(),
        (int) r.getHrvMean(),
        (int) r.getRespiratoryRate(),
        (int) r.getActivityLevel(),
        (int) (r.getSleepQuality() * 100) + "%",
        nullToEmpty(r.getRiskLevel()),
        nullToEmpty(r.getRhythmStatus()),
        nullToEmpty(r.getHrvPattern()));
  }

  private static String nullToEmpty(String value) {
    return value == null ? "" : value;
  }
}
