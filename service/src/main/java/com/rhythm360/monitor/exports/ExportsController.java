package com.rhythm360.monitor.exports;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import java.time.LocalDate;
import java.time.ZoneOffset;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/exports")
@Validated
@Tag(name = "Exports")
public class ExportsController {

  private final AssessmentExporter exporter;

  public ExportsController(AssessmentExporter exporter) {
    this.exporter = exporter;
  }

  @GetMapping(value = "/assessments", produces = "text/csv")
  @Operation(summary = "Export assessments as CSV",
      description = "Stored assessments of the last N days, newest first, one row per cycle.")
  @ApiResponses({
      @ApiResponse(responseCode = "200", description = "CSV document",
          content = @Content(mediaType = "text/csv")),
      @ApiResponse(responseCode = "400", description = "Invalid day range",
          content = @Content(mediaType = "application/problem+json"))
  })
  public ResponseEntity<CsvDocument<AssessmentCsvRow>> assessments(
      @RequestParam(defaultValue = "30") @Min(1) @Max(365)
      @Parameter(description = "Days to look back", example = "30") int days) {
    String filename = "Rhythm360_HealthData_" + LocalDate.now(ZoneOffset.UTC) + ".csv";
    return ResponseEntity.ok()
        .contentType(CsvHttpMessageConverter.TEXT_CSV)
        .header(HttpHeaders.CONTENT_DISPOSITION,
            ContentDisposition.attachment().filename(filename).build().toString())
        .body(exporter.export(days));
  }
}
