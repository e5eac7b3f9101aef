package com.aiusage.canonicalizer.exception;

import java.util.List;

import lombok.Getter;

/** A canonical field needed by one feature is absent after canonicalization. */
@Getter
public class MissingRequiredFieldException extends RuntimeException {

  private final String field;
  private final List<String> availableFields;

  public MissingRequiredFieldException(String field, List<String> availableFields) {
    super(
        String.format(
            "Required field '%s' not found. Available fields: %s", field, availableFields));
    this.field = field;
    this.availableFields = List.copyOf(availableFields);
  }
}
