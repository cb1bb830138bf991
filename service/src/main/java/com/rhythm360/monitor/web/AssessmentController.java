package com.rhythm360.monitor.web;

import com.rhythm360.monitor.assessment.AssessmentStore;
import com.rhythm360.monitor.assessment.AssessmentTrendsDao;
import com.rhythm360.monitor.assessment.HealthTrends;
import com.rhythm360.monitor.assessment.StoredAssessment;
import com.rhythm360.monitor.cache.CachedAssessment;
import com.rhythm360.monitor.cache.OfflineAssessmentCache;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Pattern;
import java.util.List;
import java.util.NoSuchElementException;
import org.springframework.http.ProblemDetail;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/assessments")
@Validated
@Tag(name = "Assessments")
public class AssessmentController {

  private final AssessmentStore store;
  private final AssessmentTrendsDao trends;
  private final OfflineAssessmentCache cache;

  public AssessmentController(AssessmentStore store, AssessmentTrendsDao trends,
      OfflineAssessmentCache cache) {
    this.store = store;
    this.trends = trends;
    this.cache = cache;
  }

  @GetMapping
  @Operation(summary = "List stored assessments", description = "Newest first.")
  public List<StoredAssessment> list(
      @RequestParam(defaultValue = "7") @Min(1) @Max(365)
      @Parameter(description = "Days to look back", example = "7") int days,
      @RequestParam(required = false) @Pattern(regexp = DeviceIds.REGEX) String deviceId) {
    return store.query(days, deviceId).stream().map(StoredAssessment::from).toList();
  }

  @GetMapping("/latest")
  @Operation(summary = "Last cached assessment",
      description = "Served from the offline cache; expires one hour after it was cached.")
  @ApiResponses({
      @ApiResponse(responseCode = "200", description = "Cached assessment"),
      @ApiResponse(responseCode = "404", description = "Nothing cached or cache expired",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class)))
  })
  public CachedAssessment latest() {
    return cache.latest()
        .orElseThrow(() -> new NoSuchElementException("No cached assessment available"));
  }

  @GetMapping("/trends")
  @Operation(summary = "Health trends",
      description = "Averages, total activity and risk trend over the last N days.")
  public HealthTrends trends(
      @RequestParam(defaultValue = "7") @Min(1) @Max(365) int days) {
    return trends.trends(days);
  }
}
