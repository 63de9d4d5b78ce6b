package com.example.jmxscenario.exception;

/** Raised when the conversion of the parsed plan failed. */
public class ConversionException extends JmxConverterException {
  public ConversionException(String message, String details) {
    super(message, details);
  }

  public ConversionException(String message, String details, Throwable cause) {
    super(message, details, cause);
  }
}
