package com.example.jmxscenario.exception;

/** Raised when writing the scenario failed. */
public class OutputException extends JmxConverterException {
  public OutputException(String message, String details) {
    super(message, details);
  }

  public OutputException(String message, String details, Throwable cause) {
    super(message, details, cause);
  }
}
