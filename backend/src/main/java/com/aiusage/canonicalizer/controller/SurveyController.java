package com.aiusage.canonicalizer.controller;

import java.util.Map;

import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.aiusage.canonicalizer.dto.analysis.HeaderPreviewRequest;
import com.aiusage.canonicalizer.dto.analysis.SurveyAnalysisResponse;
import com.aiusage.canonicalizer.dto.analysis.TableCanonicalizationRequest;
import com.aiusage.canonicalizer.model.HeaderResolution;
import com.aiusage.canonicalizer.model.RawTable;
import com.aiusage.canonicalizer.model.RuleSet;
import com.aiusage.canonicalizer.service.SurveyAnalysisService;
import com.aiusage.canonicalizer.service.canonicalization.TableCanonicalizationService;
import com.aiusage.canonicalizer.service.data_processing.TableSourceService;
import com.aiusage.canonicalizer.service.rules.RuleSetRegistryService;
import com.aiusage.canonicalizer.service.storage.AnalysisStorageService;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Tag(name = "Survey Canonicalization", description = "Header and answer canonicalization")
public class SurveyController {

  private final TableSourceService tableSourceService;
  private final SurveyAnalysisService analysisService;
  private final TableCanonicalizationService tableCanonicalizationService;
  private final RuleSetRegistryService ruleSetRegistry;
  private final AnalysisStorageService analysisStorageService;

  @PostMapping(
      value = "/survey/canonicalize",
      consumes = MediaType.APPLICATION_JSON_VALUE,
      produces = MediaType.APPLICATION_JSON_VALUE)
  @Operation(
      summary = "Canonicalize a JSON table",
      description =
          "Runs the full analysis on a table sent as JSON, optionally with an inline rule set")
  @ApiResponses(
      value = {
        @ApiResponse(
            responseCode = "200",
            description = "Successful analysis",
            content = @Content(schema = @Schema(implementation = SurveyAnalysisResponse.class))),
        @ApiResponse(
            responseCode = "400",
            description = "Invalid request, empty table or invalid rule set",
            content = @Content),
        @ApiResponse(
            responseCode = "500",
            description = "Internal server error",
            content = @Content)
      })
  public ResponseEntity<SurveyAnalysisResponse> canonicalize(
      @Valid @RequestBody TableCanonicalizationRequest request) {
    log.info(
        "Received canonicalization request for table: {} with columns: {}",
        request.getTableName(),
        request.getColumns());

    RawTable table = tableSourceService.fromRequest(request);
    RuleSet ruleSet = ruleSetRegistry.resolve(request.getRules());
    SurveyAnalysisResponse response =
        request.getTopResponses() != null
            ? analysisService.analyze(table, ruleSet, request.getTopResponses())
            : analysisService.analyze(table, ruleSet);

    String analysisId = analysisStorageService.storeAnalysis(table.getSourceName(), response);
    log.info("Stored analysis with ID: {} for table: {}", analysisId, table.getSourceName());
    response.setAnalysisId(analysisId);

    return ResponseEntity.ok(response);
  }

  @PostMapping(
      value = "/survey/headers/preview",
      consumes = MediaType.APPLICATION_JSON_VALUE,
      produces = MediaType.APPLICATION_JSON_VALUE)
  @Operation(
      summary = "Preview header canonicalization",
      description = "Maps a header list to canonical names without processing any rows")
  @ApiResponses(
      value = {
        @ApiResponse(
            responseCode = "200",
            description = "Header mapping",
            content = @Content(schema = @Schema(implementation = HeaderResolution.class))),
        @ApiResponse(responseCode = "400", description = "Invalid request", content = @Content)
      })
  public ResponseEntity<HeaderResolution> previewHeaders(
      @Valid @RequestBody HeaderPreviewRequest request) {
    RuleSet ruleSet = ruleSetRegistry.resolve(request.getRules());
    return ResponseEntity.ok(
        tableCanonicalizationService.resolveHeaders(
            request.getHeaders(), ruleSet.getAliasTable()));
  }

  @GetMapping("/health")
  @Operation(summary = "Health check", description = "Check if the service is up")
  @ApiResponses(value = {@ApiResponse(responseCode = "200", description = "Service is healthy")})
  public ResponseEntity<Map<String, Object>> health() {
    return ResponseEntity.ok(Map.of("status", "UP", "timestamp", System.currentTimeMillis()));
  }
}
