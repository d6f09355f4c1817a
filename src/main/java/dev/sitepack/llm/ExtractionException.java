package dev.sitepack.llm;

/** Raised when a structured-extraction call fails or returns something unusable. */
public class ExtractionException extends RuntimeException {

  public ExtractionException(String message) {
    super(message);
  }

  public ExtractionException(String message, Throwable cause) {
    super(message, cause);
  }
}
