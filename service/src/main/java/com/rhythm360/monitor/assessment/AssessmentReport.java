package com.rhythm360.monitor.assessment;

import com.rhythm360.monitor.scoring.Assessment;
import com.rhythm360.monitor.scoring.CriticalSignal;
import com.rhythm360.monitor.scoring.HealthSnapshot;
import java.util.List;

/**
 * What a consumer receives from one assessment cycle. Critical signals are carried alongside the
 * ensemble result and never folded into it.
 */
public record AssessmentReport(
    String deviceId,
    Assessment assessment,
    HealthSnapshot snapshot,
    List<CriticalSignal> criticalSignals,
    boolean persisted
) {

  public AssessmentReport {
    criticalSignals = criticalSignals == null ? List.of() : List.copyOf(criticalSignals);
  }

  public boolean critical() {
    return !criticalSignals.isEmpty();
  }
}
