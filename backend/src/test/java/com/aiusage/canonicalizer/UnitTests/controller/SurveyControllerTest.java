package com.aiusage.canonicalizer.UnitTests.controller;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import com.aiusage.canonicalizer.controller.SurveyController;
import com.aiusage.canonicalizer.dto.analysis.HeaderPreviewRequest;
import com.aiusage.canonicalizer.dto.analysis.SurveyAnalysisResponse;
import com.aiusage.canonicalizer.dto.analysis.TableCanonicalizationRequest;
import com.aiusage.canonicalizer.dto.rules.RuleSetDefinition;
import com.aiusage.canonicalizer.exception.InvalidRuleSetException;
import com.aiusage.canonicalizer.fixtures.TestFixtures;
import com.aiusage.canonicalizer.model.HeaderMapping;
import com.aiusage.canonicalizer.model.HeaderResolution;
import com.aiusage.canonicalizer.model.RawTable;
import com.aiusage.canonicalizer.model.RuleSet;
import com.aiusage.canonicalizer.service.SurveyAnalysisService;
import com.aiusage.canonicalizer.service.canonicalization.TableCanonicalizationService;
import com.aiusage.canonicalizer.service.data_processing.TableSourceService;
import com.aiusage.canonicalizer.service.rules.RuleSetRegistryService;
import com.aiusage.canonicalizer.service.storage.AnalysisStorageService;
import com.fasterxml.jackson.databind.ObjectMapper;

@WebMvcTest(SurveyController.class)
@DisplayName("Survey Controller Tests")
class SurveyControllerTest {

  @Autowired private MockMvc mockMvc;

  @Autowired private ObjectMapper objectMapper;

  @MockitoBean private TableSourceService tableSourceService;

  @MockitoBean private SurveyAnalysisService analysisService;

  @MockitoBean private TableCanonicalizationService tableCanonicalizationService;

  @MockitoBean private RuleSetRegistryService ruleSetRegistry;

  @MockitoBean private AnalysisStorageService analysisStorageService;

  private RuleSet activeRules;
  private TableCanonicalizationRequest request;

  @BeforeEach
  void setUp() {
    activeRules =
        RuleSet.builder()
            .version("2024.1")
            .aliasTable(TestFixtures.scenarioAliasTable())
            .build();
    request =
        TableCanonicalizationRequest.builder()
            .tableName("survey")
            .columns(List.of("AI Tool Used", "Usage Frequency"))
            .rows(List.of(List.of("ChatGPT", "Daily"), List.of("Claude", "weekly")))
            .build();
  }

  @Nested
  @DisplayName("POST /api/survey/canonicalize")
  class Canonicalize {

    @Test
    @DisplayName("Should analyze the table and store the result")
    void shouldCanonicalizeTable() throws Exception {
      // Given
      RawTable table =
          new RawTable("survey", request.getColumns(), List.of(TestFixtures.row("ChatGPT")));
      SurveyAnalysisResponse response =
          SurveyAnalysisResponse.builder()
              .tableName("survey")
              .columns(List.of("ai_tool", "usage_frequency"))
              .build();
      when(tableSourceService.fromRequest(any(TableCanonicalizationRequest.class)))
          .thenReturn(table);
      when(ruleSetRegistry.resolve(isNull())).thenReturn(activeRules);
      when(analysisService.analyze(table, activeRules)).thenReturn(response);
      when(analysisStorageService.storeAnalysis("survey", response)).thenReturn("analysis-1");

      // When & Then
      mockMvc
          .perform(
              post("/api/survey/canonicalize")
                  .contentType(MediaType.APPLICATION_JSON)
                  .content(objectMapper.writeValueAsString(request)))
          .andExpect(status().isOk())
          .andExpect(jsonPath("$.analysis_id").value("analysis-1"))
          .andExpect(jsonPath("$.table_name").value("survey"))
          .andExpect(jsonPath("$.columns[0]").value("ai_tool"))
          .andExpect(jsonPath("$.columns[1]").value("usage_frequency"));

      verify(analysisStorageService).storeAnalysis("survey", response);
    }

    @Test
    @DisplayName("Should use the inline rule set and top responses when given")
    void shouldUseInlineRules() throws Exception {
      request.setRules(TestFixtures.defaultRuleSetDefinition());
      request.setTopResponses(2);
      RawTable table = new RawTable("survey", request.getColumns(), List.of());
      SurveyAnalysisResponse response = SurveyAnalysisResponse.builder().build();
      when(tableSourceService.fromRequest(any(TableCanonicalizationRequest.class)))
          .thenReturn(table);
      when(ruleSetRegistry.resolve(any(RuleSetDefinition.class))).thenReturn(activeRules);
      when(analysisService.analyze(table, activeRules, 2)).thenReturn(response);
      when(analysisStorageService.storeAnalysis(anyString(), any())).thenReturn("analysis-2");

      mockMvc
          .perform(
              post("/api/survey/canonicalize")
                  .contentType(MediaType.APPLICATION_JSON)
                  .content(objectMapper.writeValueAsString(request)))
          .andExpect(status().isOk());

      verify(ruleSetRegistry).resolve(any(RuleSetDefinition.class));
      verify(analysisService).analyze(table, activeRules, 2);
    }

    @Test
    @DisplayName("Should reject a request without columns")
    void shouldRejectMissingColumns() throws Exception {
      mockMvc
          .perform(
              post("/api/survey/canonicalize")
                  .contentType(MediaType.APPLICATION_JSON)
                  .content("{\"table_name\":\"survey\",\"rows\":[[\"ChatGPT\"]]}"))
          .andExpect(status().isBadRequest())
          .andExpect(jsonPath("$.error").value("Validation Failed"))
          .andExpect(jsonPath("$.validationErrors.columns").exists());

      verifyNoInteractions(analysisService);
    }

    @Test
    @DisplayName("Should reject an invalid inline rule set")
    void shouldRejectInvalidInlineRules() throws Exception {
      request.setRules(RuleSetDefinition.builder().version("broken").build());
      when(tableSourceService.fromRequest(any(TableCanonicalizationRequest.class)))
          .thenReturn(new RawTable("survey", request.getColumns(), List.of()));
      when(ruleSetRegistry.resolve(any(RuleSetDefinition.class)))
          .thenThrow(new InvalidRuleSetException("Rule set defines no canonical fields"));

      mockMvc
          .perform(
              post("/api/survey/canonicalize")
                  .contentType(MediaType.APPLICATION_JSON)
                  .content(objectMapper.writeValueAsString(request)))
          .andExpect(status().isBadRequest())
          .andExpect(jsonPath("$.message").value("Rule set defines no canonical fields"));

      verifyNoInteractions(analysisService, analysisStorageService);
    }

    @Test
    @DisplayName("Should reject malformed JSON")
    void shouldRejectMalformedJson() throws Exception {
      mockMvc
          .perform(
              post("/api/survey/canonicalize")
                  .contentType(MediaType.APPLICATION_JSON)
                  .content("{\"columns\": ["))
          .andExpect(status().isBadRequest())
          .andExpect(jsonPath("$.message").value("Malformed JSON request"));
    }
  }

  @Nested
  @DisplayName("POST /api/survey/headers/preview")
  class PreviewHeaders {

    @Test
    @DisplayName("Should return the header mapping")
    void shouldPreviewHeaders() throws Exception {
      List<String> headers = List.of("Date", "Usage Frequency", "Usage Frequency");
      HeaderResolution resolution =
          HeaderResolution.builder()
              .originalHeaders(headers)
              .canonicalHeaders(List.of("timestamp", "usage_frequency", "usage_frequency_2"))
              .mapping(
                  List.of(
                      HeaderMapping.builder()
                          .position(0)
                          .original("Date")
                          .proposed("timestamp")
                          .canonical("timestamp")
                          .matchedAlias("date")
                          .recognized(true)
                          .build()))
              .build();
      when(ruleSetRegistry.resolve(isNull())).thenReturn(activeRules);
      when(tableCanonicalizationService.resolveHeaders(headers, activeRules.getAliasTable()))
          .thenReturn(resolution);

      mockMvc
          .perform(
              post("/api/survey/headers/preview")
                  .contentType(MediaType.APPLICATION_JSON)
                  .content(
                      objectMapper.writeValueAsString(
                          HeaderPreviewRequest.builder().headers(headers).build())))
          .andExpect(status().isOk())
          .andExpect(jsonPath("$.original_headers[2]").value("Usage Frequency"))
          .andExpect(jsonPath("$.canonical_headers[2]").value("usage_frequency_2"))
          .andExpect(jsonPath("$.mapping[0].matched_alias").value("date"))
          .andExpect(jsonPath("$.mapping[0].recognized").value(true));
    }

    @Test
    @DisplayName("Should reject a request without headers")
    void shouldRejectMissingHeaders() throws Exception {
      mockMvc
          .perform(
              post("/api/survey/headers/preview")
                  .contentType(MediaType.APPLICATION_JSON)
                  .content("{}"))
          .andExpect(status().isBadRequest())
          .andExpect(jsonPath("$.validationErrors.headers").exists());
    }
  }

  @Test
  @DisplayName("GET /api/health should report UP")
  void shouldReportHealth() throws Exception {
    mockMvc
        .perform(get("/api/health"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("UP"))
        .andExpect(jsonPath("$.timestamp").isNumber());
  }
}
