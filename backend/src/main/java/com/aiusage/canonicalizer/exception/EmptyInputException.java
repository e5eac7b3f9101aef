package com.aiusage.canonicalizer.exception;

/** The source parsed but contains no data rows. */
public class EmptyInputException extends RuntimeException {

  public EmptyInputException(String message) {
    super(message);
  }
}
