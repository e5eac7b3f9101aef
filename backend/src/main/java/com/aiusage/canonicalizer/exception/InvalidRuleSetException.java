package com.aiusage.canonicalizer.exception;

/** A rule set definition that cannot be compiled (duplicate field, bad regex, blank label). */
public class InvalidRuleSetException extends IllegalArgumentException {

  public InvalidRuleSetException(String message) {
    super(message);
  }

  public InvalidRuleSetException(String message, Throwable cause) {
    super(message, cause);
  }
}
