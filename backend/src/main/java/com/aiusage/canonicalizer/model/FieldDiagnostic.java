package com.aiusage.canonicalizer.model;

import java.util.List;

import com.aiusage.canonicalizer.exception.MissingRequiredFieldException;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** A non-fatal condition scoped to one field or feature. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class FieldDiagnostic {

  @JsonProperty("kind")
  private DiagnosticKind kind;

  @JsonProperty("field")
  private String field;

  /** Reporting feature that was skipped, if any. */
  @JsonProperty("feature")
  private String feature;

  @JsonProperty("message")
  private String message;

  @JsonProperty("available_fields")
  private List<String> availableFields;

  @JsonProperty("affected_rows")
  private Long affectedRows;

  @JsonProperty("samples")
  private List<String> samples;

  public static FieldDiagnostic missingField(String feature, MissingRequiredFieldException e) {
    return FieldDiagnostic.builder()
        .kind(DiagnosticKind.MISSING_REQUIRED_FIELD)
        .field(e.getField())
        .feature(feature)
        .message(String.format("Skipped %s: %s", feature, e.getMessage()))
        .availableFields(e.getAvailableFields())
        .build();
  }
}
