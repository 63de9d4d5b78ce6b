package com.example.jmxscenario.exception;

/**
 * Base of the fatal conversion errors. The message reads {@code summary: details} when details exist.
 */
public class JmxConverterException extends RuntimeException {
  private final String summary;
  private final String details;

  public JmxConverterException(String message, String details) {
    super(details == null ? message : message + ": " + details);
    this.summary = message;
    this.details = details;
  }

  public JmxConverterException(String message, String details, Throwable cause) {
    super(details == null ? message : message + ": " + details, cause);
    this.summary = message;
    this.details = details;
  }

  public String getSummary() {
    return summary;
  }

  public String getDetails() {
    return details;
  }
}
