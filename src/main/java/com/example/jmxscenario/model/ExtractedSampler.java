package com.example.jmxscenario.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class ExtractedSampler {
  public String name;
  public String method;
  public String path;
  public boolean enabled = true;
  public String domain = "";
  public String port = "";
  public String protocol = "";
  public JsonNode payload; // raw JSON body, null when absent or unparseable
  public Map<String, String> params = new LinkedHashMap<>();
  public Map<String, String> headers = new LinkedHashMap<>();
  public List<FileUpload> files = new ArrayList<>();
  public List<CaptureConfig> captures = new ArrayList<>();
  public AssertConfig assertions;
  public LoopConfig loop;
  public Integer thinkTime;
}
