package com.example.jmxscenario.exception;

/** Raised when the JMX document could not be parsed. */
public class JmxParseException extends JmxConverterException {
  public JmxParseException(String message, String details) {
    super(message, details);
  }

  public JmxParseException(String message, String details, Throwable cause) {
    super(message, details, cause);
  }
}
