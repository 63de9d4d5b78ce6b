package com.example.jmxscenario.model;

/**
 * One capture rule taken from a JSON extractor. Exactly one of the three shapes:
 * {@link Simple} (path left to inference), {@link Field} (top-level field of the
 * response) or {@link Explicit} (JSONPath plus match mode).
 */
public abstract class CaptureConfig {
  public final String variableName;

  private CaptureConfig(String variableName) {
    this.variableName = variableName;
  }

  public abstract String describe();

  public MatchMode matchMode() {
    return MatchMode.FIRST;
  }

  public static Simple simple(String variableName) {
    return new Simple(variableName);
  }

  public static Field field(String variableName, String field) {
    return new Field(variableName, field);
  }

  public static Explicit explicit(String variableName, String jsonPath, MatchMode match) {
    return new Explicit(variableName, jsonPath, match == null ? MatchMode.FIRST : match);
  }

  public static final class Simple extends CaptureConfig {
    private Simple(String variableName) {
      super(variableName);
    }

    @Override
    public String describe() {
      return variableName;
    }
  }

  public static final class Field extends CaptureConfig {
    public final String field;

    private Field(String variableName, String field) {
      super(variableName);
      this.field = field;
    }

    @Override
    public String describe() {
      return variableName + " <- " + field;
    }
  }

  public static final class Explicit extends CaptureConfig {
    public final String jsonPath;
    public final MatchMode match;

    private Explicit(String variableName, String jsonPath, MatchMode match) {
      super(variableName);
      this.jsonPath = jsonPath;
      this.match = match;
    }

    @Override
    public String describe() {
      return variableName + " <- " + jsonPath + " (" + match.getValue() + ")";
    }

    @Override
    public MatchMode matchMode() {
      return match;
    }
  }
}
