package com.aiusage.canonicalizer.controller;

import java.util.List;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.aiusage.canonicalizer.exception.ResourceNotFoundException;
import com.aiusage.canonicalizer.model.HeaderResolution;
import com.aiusage.canonicalizer.service.storage.AnalysisStorageService;
import com.aiusage.canonicalizer.service.storage.AnalysisStorageService.StoredAnalysis;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@RestController
@RequestMapping("/api/analyses")
@RequiredArgsConstructor
@Tag(name = "Analyses", description = "Inspection of stored analyses")
public class AnalysisController {

  private final AnalysisStorageService analysisStorageService;

  @GetMapping
  @Operation(
      summary = "Get all stored analyses",
      description = "Retrieve the analyses kept in memory, oldest first")
  @ApiResponses(
      value = {@ApiResponse(responseCode = "200", description = "Successfully retrieved analyses")})
  public ResponseEntity<List<StoredAnalysis>> getAllAnalyses() {
    List<StoredAnalysis> storedAnalyses = analysisStorageService.getAllAnalyses();
    log.debug("Retrieved {} stored analyses", storedAnalyses.size());
    return ResponseEntity.ok(storedAnalyses);
  }

  @GetMapping("/latest/debug")
  @Operation(
      summary = "Header debug view of the last analysis",
      description = "Original headers, canonical headers and the mapping between them")
  @ApiResponses(
      value = {
        @ApiResponse(responseCode = "200", description = "Header resolution of the last run"),
        @ApiResponse(responseCode = "404", description = "No analysis has run yet")
      })
  public ResponseEntity<HeaderResolution> getLatestDebug() {
    return analysisStorageService
        .getLatestHeaderResolution()
        .map(ResponseEntity::ok)
        .orElseThrow(() -> new ResourceNotFoundException("No analysis has been run yet"));
  }

  @GetMapping("/{analysisId}")
  @Operation(summary = "Get a stored analysis", description = "Retrieve one analysis by id")
  @ApiResponses(
      value = {
        @ApiResponse(responseCode = "200", description = "Analysis found"),
        @ApiResponse(responseCode = "404", description = "Analysis not found")
      })
  public ResponseEntity<StoredAnalysis> getAnalysis(@PathVariable String analysisId) {
    StoredAnalysis analysis = analysisStorageService.getAnalysis(analysisId);
    if (analysis == null) {
      throw new ResourceNotFoundException("Analysis not found: " + analysisId);
    }
    return ResponseEntity.ok(analysis);
  }

  @DeleteMapping
  @Operation(
      summary = "Delete all stored analyses",
      description = "Remove all analyses stored in the system")
  @ApiResponses(
      value = {
        @ApiResponse(responseCode = "204", description = "Successfully deleted all analyses")
      })
  public ResponseEntity<Void> deleteAllAnalyses() {
    analysisStorageService.clearAnalyses();
    return ResponseEntity.noContent().build();
  }

  @DeleteMapping("/{analysisId}")
  @Operation(
      summary = "Delete a specific analysis",
      description = "Remove a specific analysis from the system")
  @ApiResponses(
      value = {
        @ApiResponse(responseCode = "204", description = "Successfully deleted the analysis"),
        @ApiResponse(responseCode = "404", description = "Analysis not found")
      })
  public ResponseEntity<Void> deleteAnalysis(@PathVariable String analysisId) {
    if (analysisStorageService.deleteAnalysis(analysisId)) {
      return ResponseEntity.noContent().build();
    }
    return ResponseEntity.notFound().build();
  }
}
