package com.aiusage.canonicalizer.service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.springframework.stereotype.Service;

import com.aiusage.canonicalizer.config.CanonicalizerProperties;
import com.aiusage.canonicalizer.dto.analysis.SurveyAnalysisResponse;
import com.aiusage.canonicalizer.dto.analysis.SurveyAnalysisResponse.ProcessingMetadata;
import com.aiusage.canonicalizer.exception.EmptyInputException;
import com.aiusage.canonicalizer.exception.MissingRequiredFieldException;
import com.aiusage.canonicalizer.model.CanonicalTable;
import com.aiusage.canonicalizer.model.CanonicalizationResult;
import com.aiusage.canonicalizer.model.ClassificationRule;
import com.aiusage.canonicalizer.model.DiagnosticKind;
import com.aiusage.canonicalizer.model.FeedbackClassification;
import com.aiusage.canonicalizer.model.FieldDiagnostic;
import com.aiusage.canonicalizer.model.FieldNormalization;
import com.aiusage.canonicalizer.model.HeaderMapping;
import com.aiusage.canonicalizer.model.NormalizationRule;
import com.aiusage.canonicalizer.model.RawTable;
import com.aiusage.canonicalizer.model.RuleSet;
import com.aiusage.canonicalizer.service.canonicalization.TableCanonicalizationService;
import com.aiusage.canonicalizer.service.classification.FeedbackClassifier;
import com.aiusage.canonicalizer.service.normalization.CategoricalValueNormalizer;
import com.aiusage.canonicalizer.service.reporting.SurveySummaryService;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Runs one complete analysis: canonicalize the table, normalize every configured categorical
 * field, classify every configured free-text field, then build the summary. Field-level problems
 * become diagnostics; only an empty table fails the whole analysis.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SurveyAnalysisService {

  private static final String VALUE_NORMALIZATION = "value_normalization";
  private static final String FEEDBACK_CLASSIFICATION = "feedback_classification";

  private final TableCanonicalizationService tableCanonicalizationService;
  private final CategoricalValueNormalizer valueNormalizer;
  private final FeedbackClassifier feedbackClassifier;
  private final SurveySummaryService summaryService;
  private final CanonicalizerProperties properties;

  public SurveyAnalysisResponse analyze(RawTable rawTable, RuleSet ruleSet) {
    return analyze(rawTable, ruleSet, properties.getFeedback().getTopResponses());
  }

  public SurveyAnalysisResponse analyze(RawTable rawTable, RuleSet ruleSet, int topResponses) {
    long startTime = System.currentTimeMillis();
    if (rawTable.isEmpty()) {
      throw new EmptyInputException("Table " + rawTable.getSourceName() + " has no rows");
    }

    log.info(
        "Starting analysis of {} with {} columns and {} rows",
        rawTable.getSourceName(),
        rawTable.getHeaders().size(),
        rawTable.rowCount());

    CanonicalizationResult canonical =
        tableCanonicalizationService.canonicalize(rawTable, ruleSet.getAliasTable());
    CanonicalTable table = canonical.getTable();
    List<FieldDiagnostic> diagnostics = new ArrayList<>();

    Map<String, FieldNormalization> normalizations = new LinkedHashMap<>();
    for (NormalizationRule rule : ruleSet.getValueRules().values()) {
      try {
        FieldNormalization normalization =
            valueNormalizer.normalizeColumn(table.requireColumn(rule.getField()), rule);
        normalizations.put(rule.getField(), normalization);
        if (normalization.getUnmatchedCount() > 0) {
          diagnostics.add(unmatchedValues(rule, normalization));
        }
      } catch (MissingRequiredFieldException e) {
        log.warn("Value normalization skipped: {}", e.getMessage());
        diagnostics.add(FieldDiagnostic.missingField(VALUE_NORMALIZATION, e));
      }
    }

    Map<String, FeedbackClassification> feedback = new LinkedHashMap<>();
    for (ClassificationRule rule : ruleSet.getFeedbackRules().values()) {
      try {
        FeedbackClassification classification =
            feedbackClassifier.classifyColumn(
                table.requireColumn(rule.getField()), rule, topResponses);
        feedback.put(rule.getField(), classification);
        if (classification.getUnclassifiedCount() > 0) {
          diagnostics.add(unclassifiedText(rule, classification));
        }
      } catch (MissingRequiredFieldException e) {
        log.warn("Feedback classification skipped: {}", e.getMessage());
        diagnostics.add(FieldDiagnostic.missingField(FEEDBACK_CLASSIFICATION, e));
      }
    }

    SurveyAnalysisResponse.SurveySummary summary =
        summaryService.summarize(table, normalizations, feedback, diagnostics);

    int recognized =
        (int)
            canonical.getResolution().getMapping().stream()
                .filter(HeaderMapping::isRecognized)
                .count();
    long processingTime = System.currentTimeMillis() - startTime;

    log.info(
        "Finished analysis of {} in {} ms with {} diagnostic(s)",
        rawTable.getSourceName(),
        processingTime,
        diagnostics.size());

    return SurveyAnalysisResponse.builder()
        .tableName(rawTable.getSourceName())
        .columns(table.getHeaders())
        .data(table.getRows())
        .headerResolution(canonical.getResolution())
        .normalizations(normalizations)
        .feedback(feedback)
        .summary(summary)
        .diagnostics(diagnostics)
        .processingMetadata(
            ProcessingMetadata.builder()
                .totalColumns(table.getHeaders().size())
                .recognizedColumns(recognized)
                .totalRowsProcessed(table.rowCount())
                .processingTimeMs(processingTime)
                .ruleSetVersion(ruleSet.getVersion())
                .build())
        .build();
  }

  private FieldDiagnostic unmatchedValues(NormalizationRule rule, FieldNormalization result) {
    return FieldDiagnostic.builder()
        .kind(DiagnosticKind.UNCLASSIFIABLE_VALUE)
        .field(rule.getField())
        .message(
            String.format(
                "Field '%s': %d value(s) matched no rule and were labeled '%s'",
                rule.getField(), result.getUnmatchedCount(), rule.getFallbackLabel()))
        .affectedRows(result.getUnmatchedCount())
        .samples(result.getUnmatchedSamples())
        .build();
  }

  private FieldDiagnostic unclassifiedText(
      ClassificationRule rule, FeedbackClassification result) {
    return FieldDiagnostic.builder()
        .kind(DiagnosticKind.UNCLASSIFIABLE_TEXT)
        .field(rule.getField())
        .message(
            String.format(
                "Field '%s': %d response(s) matched no category and were labeled '%s'",
                rule.getField(), result.getUnclassifiedCount(), rule.getCatchAllLabel()))
        .affectedRows(result.getUnclassifiedCount())
        .build();
  }
}
