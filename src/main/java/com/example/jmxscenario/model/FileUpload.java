package com.example.jmxscenario.model;

public class FileUpload {
  public final String path;
  public final String param;
  public final String mimeType;

  public FileUpload(String path, String param, String mimeType) {
    this.path = path;
    this.param = param;
    this.mimeType = mimeType;
  }
}
