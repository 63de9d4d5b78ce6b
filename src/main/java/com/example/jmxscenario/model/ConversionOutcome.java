package com.example.jmxscenario.model;

import java.util.List;

public class ConversionOutcome {
  public final ParsedScenario scenario;
  public final String yaml;
  public final List<String> warnings;

  public ConversionOutcome(ParsedScenario scenario, String yaml, List<String> warnings) {
    this.scenario = scenario;
    this.yaml = yaml;
    this.warnings = warnings;
  }
}
