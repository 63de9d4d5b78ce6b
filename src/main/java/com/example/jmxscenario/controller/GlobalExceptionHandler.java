package com.example.jmxscenario.controller;

import com.example.jmxscenario.exception.ConversionException;
import com.example.jmxscenario.exception.JmxConverterException;
import com.example.jmxscenario.exception.JmxParseException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(JmxParseException.class)
    public ResponseEntity<ErrorResponse> handleParseException(JmxParseException ex) {
        return respond(HttpStatus.BAD_REQUEST, "JMX_PARSE_ERROR", ex);
    }

    @ExceptionHandler(ConversionException.class)
    public ResponseEntity<ErrorResponse> handleConversionException(ConversionException ex) {
        return respond(HttpStatus.UNPROCESSABLE_ENTITY, "CONVERSION_ERROR", ex);
    }

    @ExceptionHandler(JmxConverterException.class)
    public ResponseEntity<ErrorResponse> handleConverterException(JmxConverterException ex) {
        log.error("Conversion failed", ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR", ex);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgumentException(IllegalArgumentException ex) {
        ErrorResponse error = ErrorResponse.builder()
                .code("INVALID_ARGUMENT")
                .message(ex.getMessage())
                .build();
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception ex) {
        log.error("Unexpected error occurred", ex);
        ErrorResponse error = ErrorResponse.builder()
                .code("INTERNAL_ERROR")
                .message("An unexpected error occurred")
                .details(ex.getMessage())
                .build();
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(error);
    }

    private ResponseEntity<ErrorResponse> respond(HttpStatus status, String code, JmxConverterException ex) {
        ErrorResponse error = ErrorResponse.builder()
                .code(code)
                .message(ex.getSummary())
                .details(ex.getDetails())
                .build();
        return ResponseEntity.status(status).body(error);
    }
}
