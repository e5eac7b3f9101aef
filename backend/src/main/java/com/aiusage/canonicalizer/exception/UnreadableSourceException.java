package com.aiusage.canonicalizer.exception;

/** The table structure could not be read at all. No partial result is produced. */
public class UnreadableSourceException extends RuntimeException {

  public UnreadableSourceException(String message) {
    super(message);
  }

  public UnreadableSourceException(String message, Throwable cause) {
    super(message, cause);
  }
}
