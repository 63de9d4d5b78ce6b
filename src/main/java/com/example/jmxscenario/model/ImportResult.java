package com.example.jmxscenario.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Everything extracted from one JMX document, plus the warnings recorded while doing it.
 * One instance per conversion; warnings are only ever appended.
 */
public class ImportResult {
  public String name;
  public String description;
  public ScenarioSettings settings = new ScenarioSettings();
  public JmxDefaults defaults = new JmxDefaults();
  public Map<String, String> variables = new LinkedHashMap<>();
  public List<ExtractedSampler> samplers = new ArrayList<>();

  private final List<String> warnings = new ArrayList<>();

  public void warn(String warning) {
    warnings.add(warning);
  }

  public List<String> getWarnings() {
    return Collections.unmodifiableList(warnings);
  }
}
