package com.example.jmxscenario.model;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class ParsedScenario {
  public String name;
  public String description;
  public ScenarioSettings settings = new ScenarioSettings();
  public Map<String, String> variables = new LinkedHashMap<>();
  public List<ScenarioStep> steps = new ArrayList<>();
}
