package com.example.jmxscenario.model;

/**
 * Loop applied to a step. The variants are mutually exclusive: a fixed {@link Count},
 * a {@link ForEach} over an array variable, or a {@link While} condition with a safety bound.
 */
public abstract class LoopConfig {
  public static final int DEFAULT_MAX_ITERATIONS = 100;

  private LoopConfig() {
  }

  public static Count count(int count, String variable) {
    return new Count(count, variable);
  }

  public static ForEach forEach(String items, String variable) {
    return new ForEach(items, variable);
  }

  public static While whileLoop(String condition, int maxIterations, Integer intervalMs) {
    return new While(condition, maxIterations, intervalMs);
  }

  public static final class Count extends LoopConfig {
    public final int count;
    public final String variable;

    private Count(int count, String variable) {
      this.count = count;
      this.variable = variable;
    }
  }

  public static final class ForEach extends LoopConfig {
    public final String items;
    public final String variable;

    private ForEach(String items, String variable) {
      this.items = items;
      this.variable = variable;
    }
  }

  public static final class While extends LoopConfig {
    public final String condition;
    public final int maxIterations;
    public final Integer intervalMs;

    private While(String condition, int maxIterations, Integer intervalMs) {
      this.condition = condition;
      this.maxIterations = maxIterations;
      this.intervalMs = intervalMs;
    }
  }
}
