package com.example.jmxscenario.model;

/**
 * Tunables of one conversion run.
 */
public class ConverterOptions {

  public static final String DEFAULT_OUTPUT = "pt_scenario.yaml";

  private int whileMaxIterations = LoopConfig.DEFAULT_MAX_ITERATIONS;
  private Integer whileIntervalMs;
  private String openApiLocation;

  public ConverterOptions() {
  }

  public static ConverterOptions fromEnvironment() {
    ConverterOptions o = new ConverterOptions();
    String max = System.getenv().getOrDefault("JMX_WHILE_MAX", "");
    if (!max.isEmpty()) o.setWhileMaxIterations(Integer.parseInt(max.trim()));
    String interval = System.getenv().getOrDefault("JMX_WHILE_INTERVAL_MS", "");
    if (!interval.isEmpty()) o.setWhileIntervalMs(Integer.parseInt(interval.trim()));
    String openApi = System.getenv().getOrDefault("JMX_OPENAPI", "");
    if (!openApi.isEmpty()) o.setOpenApiLocation(openApi);
    return o;
  }

  public int getWhileMaxIterations() {
    return whileMaxIterations;
  }

  public void setWhileMaxIterations(int whileMaxIterations) {
    if (whileMaxIterations < 1) {
      throw new IllegalArgumentException("while max iterations must be positive: " + whileMaxIterations);
    }
    this.whileMaxIterations = whileMaxIterations;
  }

  public Integer getWhileIntervalMs() {
    return whileIntervalMs;
  }

  public void setWhileIntervalMs(Integer whileIntervalMs) {
    this.whileIntervalMs = whileIntervalMs;
  }

  public String getOpenApiLocation() {
    return openApiLocation;
  }

  public void setOpenApiLocation(String openApiLocation) {
    this.openApiLocation = openApiLocation;
  }
}
