package com.aiusage.canonicalizer.UnitTests.service.storage;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.aiusage.canonicalizer.config.CanonicalizerProperties;
import com.aiusage.canonicalizer.dto.analysis.SurveyAnalysisResponse;
import com.aiusage.canonicalizer.model.HeaderResolution;
import com.aiusage.canonicalizer.service.storage.AnalysisStorageService;

class AnalysisStorageServiceTest {

  private CanonicalizerProperties properties;
  private AnalysisStorageService analysisStorageService;

  @BeforeEach
  void setUp() {
    properties = new CanonicalizerProperties();
    properties.getStorage().setMaxAnalyses(3);
    analysisStorageService = new AnalysisStorageService(properties);
  }

  private static SurveyAnalysisResponse response(String tableName) {
    return SurveyAnalysisResponse.builder()
        .tableName(tableName)
        .headerResolution(
            HeaderResolution.builder()
                .originalHeaders(List.of("AI Tool Used"))
                .canonicalHeaders(List.of("ai_tool"))
                .mapping(List.of())
                .build())
        .build();
  }

  @Test
  void shouldStoreAndRetrieveAnalysisSuccessfully() {
    SurveyAnalysisResponse response = response("survey.csv");

    String analysisId = analysisStorageService.storeAnalysis("survey.csv", response);

    AnalysisStorageService.StoredAnalysis stored = analysisStorageService.getAnalysis(analysisId);
    assertThat(stored).isNotNull();
    assertThat(stored.getAnalysisId()).isEqualTo(analysisId);
    assertThat(stored.getFileName()).isEqualTo("survey.csv");
    assertThat(stored.getResponse()).isSameAs(response);
    assertThat(stored.getTimestamp()).isNotNull();
  }

  @Test
  void shouldReturnNullForNonExistentAnalysis() {
    assertThat(analysisStorageService.getAnalysis("non-existent-id")).isNull();
  }

  @Test
  void shouldListAnalysesOldestFirst() {
    analysisStorageService.storeAnalysis("first.csv", response("first"));
    analysisStorageService.storeAnalysis("second.csv", response("second"));

    assertThat(analysisStorageService.getAllAnalyses())
        .extracting(AnalysisStorageService.StoredAnalysis::getFileName)
        .containsExactly("first.csv", "second.csv");
  }

  @Test
  void shouldEvictOldestBeyondLimit() {
    String oldest = analysisStorageService.storeAnalysis("1.csv", response("1"));
    analysisStorageService.storeAnalysis("2.csv", response("2"));
    analysisStorageService.storeAnalysis("3.csv", response("3"));
    analysisStorageService.storeAnalysis("4.csv", response("4"));

    assertThat(analysisStorageService.size()).isEqualTo(3);
    assertThat(analysisStorageService.getAnalysis(oldest)).isNull();
    assertThat(analysisStorageService.getAllAnalyses())
        .extracting(AnalysisStorageService.StoredAnalysis::getFileName)
        .containsExactly("2.csv", "3.csv", "4.csv");
  }

  @Test
  void shouldKeepAtLeastOneAnalysis() {
    properties.getStorage().setMaxAnalyses(0);

    analysisStorageService.storeAnalysis("1.csv", response("1"));
    analysisStorageService.storeAnalysis("2.csv", response("2"));

    assertThat(analysisStorageService.size()).isEqualTo(1);
    assertThat(analysisStorageService.getLatestAnalysis())
        .get()
        .extracting(AnalysisStorageService.StoredAnalysis::getFileName)
        .isEqualTo("2.csv");
  }

  @Test
  void shouldReturnLatestHeaderResolution() {
    assertThat(analysisStorageService.getLatestHeaderResolution()).isEmpty();

    analysisStorageService.storeAnalysis("survey.csv", response("survey"));

    assertThat(analysisStorageService.getLatestHeaderResolution())
        .get()
        .extracting(HeaderResolution::getCanonicalHeaders)
        .isEqualTo(List.of("ai_tool"));
  }

  @Test
  void shouldDeleteAnalysisSuccessfully() {
    String first = analysisStorageService.storeAnalysis("first.csv", response("first"));
    String second = analysisStorageService.storeAnalysis("second.csv", response("second"));

    assertThat(analysisStorageService.deleteAnalysis(second)).isTrue();

    assertThat(analysisStorageService.getAnalysis(second)).isNull();
    assertThat(analysisStorageService.getLatestAnalysis())
        .get()
        .extracting(AnalysisStorageService.StoredAnalysis::getAnalysisId)
        .isEqualTo(first);
  }

  @Test
  void shouldReturnFalseWhenDeletingNonExistentAnalysis() {
    assertThat(analysisStorageService.deleteAnalysis("non-existent-id")).isFalse();
  }

  @Test
  void shouldClearAllAnalyses() {
    analysisStorageService.storeAnalysis("first.csv", response("first"));
    analysisStorageService.storeAnalysis("second.csv", response("second"));

    analysisStorageService.clearAnalyses();

    assertThat(analysisStorageService.size()).isZero();
    assertThat(analysisStorageService.getAllAnalyses()).isEmpty();
    assertThat(analysisStorageService.getLatestAnalysis()).isEmpty();
  }
}
