package com.example.jmxscenario.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class ScenarioStep {
  public String name;
  public String endpoint; // operationId or "METHOD /path"
  public boolean enabled = true;
  public Map<String, String> params = new LinkedHashMap<>();
  public Map<String, String> headers = new LinkedHashMap<>();
  public JsonNode payload;
  public List<FileUpload> files = new ArrayList<>();
  public List<CaptureConfig> capture = new ArrayList<>();
  public AssertConfig assertions;
  public LoopConfig loop;
  public Integer thinkTime;
}
