package com.aiusage.canonicalizer.controller;

import java.io.IOException;
import java.util.Set;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import com.aiusage.canonicalizer.dto.analysis.SurveyAnalysisResponse;
import com.aiusage.canonicalizer.exception.UnreadableSourceException;
import com.aiusage.canonicalizer.model.RawTable;
import com.aiusage.canonicalizer.service.SurveyAnalysisService;
import com.aiusage.canonicalizer.service.data_processing.TableSourceService;
import com.aiusage.canonicalizer.service.rules.RuleSetRegistryService;
import com.aiusage.canonicalizer.service.storage.AnalysisStorageService;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Tag(name = "File Upload", description = "Survey file upload and analysis endpoints")
public class FileUploadController {

  @Value("${app.upload.max-file-size:10485760}")
  private long maxFileSize;

  @Value("${app.upload.allowed-extensions:csv,xlsx,xls}")
  private Set<String> allowedExtensions;

  private final TableSourceService tableSourceService;
  private final SurveyAnalysisService analysisService;
  private final RuleSetRegistryService ruleSetRegistry;
  private final AnalysisStorageService analysisStorageService;

  @PostMapping(
      value = "/survey/analyze",
      consumes = MediaType.MULTIPART_FORM_DATA_VALUE,
      produces = MediaType.APPLICATION_JSON_VALUE)
  @Operation(
      summary = "Analyze uploaded survey",
      description =
          "Canonicalize the headers and answers of an uploaded CSV or Excel survey export and"
              + " compute its summary")
  @ApiResponses(
      value = {
        @ApiResponse(
            responseCode = "200",
            description = "Successful analysis",
            content = @Content(schema = @Schema(implementation = SurveyAnalysisResponse.class))),
        @ApiResponse(
            responseCode = "400",
            description = "Empty, unreadable or unsupported file",
            content = @Content),
        @ApiResponse(
            responseCode = "500",
            description = "Internal server error",
            content = @Content)
      })
  public ResponseEntity<SurveyAnalysisResponse> analyzeFile(
      @Parameter(description = "Survey export (CSV, XLSX or XLS)", required = true)
          @RequestParam("file")
          MultipartFile file,
      @Parameter(description = "Number of top feedback responses to return", required = false)
          @RequestParam(value = "topResponses", required = false)
          Integer topResponses) {
    validateFile(file);
    if (topResponses != null && topResponses <= 0) {
      throw new IllegalArgumentException("topResponses must be positive");
    }

    String fileName = file.getOriginalFilename();
    RawTable table;
    try {
      table = tableSourceService.read(file.getInputStream(), fileName);
    } catch (IOException e) {
      throw new UnreadableSourceException("Could not read uploaded file " + fileName, e);
    }

    SurveyAnalysisResponse response =
        topResponses != null
            ? analysisService.analyze(table, ruleSetRegistry.getActiveRuleSet(), topResponses)
            : analysisService.analyze(table, ruleSetRegistry.getActiveRuleSet());

    String analysisId = analysisStorageService.storeAnalysis(fileName, response);
    log.info("Stored analysis with ID: {} for file: {}", analysisId, fileName);
    response.setAnalysisId(analysisId);

    return ResponseEntity.ok(response);
  }

  private void validateFile(MultipartFile file) {
    if (file == null || file.isEmpty()) {
      throw new IllegalArgumentException("File is empty");
    }

    if (file.getSize() > maxFileSize) {
      throw new IllegalArgumentException(
          "File size exceeds maximum allowed size of " + maxFileSize + " bytes");
    }

    String fileName = file.getOriginalFilename();
    if (fileName == null || fileName.isEmpty()) {
      throw new IllegalArgumentException("File name is empty");
    }

    String extension = TableSourceService.extractFileExtension(fileName);
    if (!allowedExtensions.contains(extension)) {
      throw new UnreadableSourceException(
          "Unsupported file format '" + extension + "'. Please upload CSV or Excel.");
    }
  }
}
