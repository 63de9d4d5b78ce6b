package com.example.jmxscenario.util;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Where a capture that only names a variable is expected to find its value. The scenario
 * generator resolves simple captures against a live response; at conversion time no response
 * exists, so only the ordering is fixed here.
 *
 * <p>Search order: {@code $.<name>}, then {@code $.id} for id-like names ({@code userId},
 * {@code user_id}), then {@code $.data.<name>}, then {@code $.result.<name>}. The first
 * candidate is the one a simple capture stands for.
 */
public final class CapturePaths {

  private static final Pattern SIMPLE_FIELD = Pattern.compile("^\\$\\.([A-Za-z_][\\w-]*)$");

  private CapturePaths() {
  }

  public static List<String> candidates(String variableName) {
    List<String> out = new ArrayList<>();
    out.add("$." + variableName);
    if (isIdLike(variableName)) out.add("$.id");
    out.add("$.data." + variableName);
    out.add("$.result." + variableName);
    return out;
  }

  public static String inferredPath(String variableName) {
    return candidates(variableName).get(0);
  }

  /** The field name when {@code jsonPath} addresses a single top-level field, else null. */
  public static String topLevelField(String jsonPath) {
    if (jsonPath == null) return null;
    Matcher m = SIMPLE_FIELD.matcher(jsonPath.trim());
    return m.matches() ? m.group(1) : null;
  }

  private static boolean isIdLike(String name) {
    if (name.equalsIgnoreCase("id")) return false;
    return name.endsWith("Id") || name.endsWith("ID") || name.toLowerCase().endsWith("_id");
  }
}
