package com.example.jmxscenario.model;

public class JmxDefaults {
  public String domain = "";
  public String port = "";
  public String protocol = "http";
}
