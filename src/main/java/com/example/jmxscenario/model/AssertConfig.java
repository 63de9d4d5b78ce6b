package com.example.jmxscenario.model;

import java.util.LinkedHashMap;
import java.util.Map;

public class AssertConfig {
  public Integer status;
  public Map<String, Object> body = new LinkedHashMap<>();
  public Map<String, String> headers = new LinkedHashMap<>();

  public boolean isEmpty() {
    return status == null && body.isEmpty() && headers.isEmpty();
  }
}
