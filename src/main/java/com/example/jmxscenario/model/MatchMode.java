package com.example.jmxscenario.model;

public enum MatchMode {
  FIRST("first"),
  ALL("all");

  private final String value;

  MatchMode(String value) {
    this.value = value;
  }

  public String getValue() {
    return value;
  }
}
