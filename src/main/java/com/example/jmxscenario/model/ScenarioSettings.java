package com.example.jmxscenario.model;

public class ScenarioSettings {
  public int threads = 1;
  public int rampup = 0;
  public Integer loops;
  public Integer duration; // seconds, null means unlimited
  public String baseUrl;
}
