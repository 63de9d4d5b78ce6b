package com.example.jmxscenario.util;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rewrites JMeter scripted conditions (Groovy, JavaScript, JEXL function calls, or plain
 * {@code ${var}} comparisons) into the {@code ${var} op literal} form used by scenario
 * {@code while} loops. This is a syntactic rewrite only; nothing is evaluated.
 *
 * <p>Recognised shapes:
 * <ul>
 *   <li>a variable compared to a string or numeric literal with {@code == != < <= > >=},
 *       the variable written as {@code vars.get('x')}, {@code ${x}} or a quoted {@code "${x}"};</li>
 *   <li>{@code vars.get('x').equals('v')}, optionally negated;</li>
 *   <li>the boolean literals {@code true} and {@code false}.</li>
 * </ul>
 * Anything else is returned unchanged together with a warning.
 */
public final class ConditionTranslator {

  private static final String VAR =
      "(?:vars\\.get\\(\\s*['\"](\\w+)['\"]\\s*\\)|['\"]?\\$\\{(\\w+)\\}['\"]?)";
  private static final String LITERAL = "(?:'([^']*)'|\"([^\"]*)\"|(-?\\d+(?:\\.\\d+)?))";

  private static final Pattern WRAPPER =
      Pattern.compile("^\\$\\{__(?:groovy|javaScript|jexl2|jexl3)\\((.*)\\)\\}$", Pattern.DOTALL);
  private static final Pattern COMPARISON =
      Pattern.compile(VAR + "\\s*(==|!=|<=|>=|<|>)\\s*" + LITERAL);
  private static final Pattern EQUALS_CALL =
      Pattern.compile("(!)?\\s*vars\\.get\\(\\s*['\"](\\w+)['\"]\\s*\\)\\.equals\\(\\s*" + LITERAL + "\\s*\\)");
  private static final Pattern ITERATION_LIMIT =
      Pattern.compile("getIteration\\(\\)\\s*(<=|<)\\s*(\\d+)");
  private static final Pattern NUMBER = Pattern.compile("-?\\d+(?:\\.\\d+)?");

  public static class Translation {
    public final String condition;
    public final Integer maxIterations;
    public final String warning;

    Translation(String condition, Integer maxIterations, String warning) {
      this.condition = condition;
      this.maxIterations = maxIterations;
      this.warning = warning;
    }

    public boolean isRecognized() {
      return warning == null;
    }
  }

  public Translation translate(String expression) {
    if (expression == null || expression.trim().isEmpty()) {
      return new Translation("", null, "Empty while condition");
    }
    String original = expression;
    String inner = unwrap(expression.trim());
    Integer limit = iterationLimit(inner);

    if ("true".equalsIgnoreCase(inner) || "false".equalsIgnoreCase(inner)) {
      return new Translation(inner.toLowerCase(), limit, null);
    }

    Matcher eq = EQUALS_CALL.matcher(inner);
    if (eq.find()) {
      String op = eq.group(1) == null ? "==" : "!=";
      return new Translation(render(eq.group(2), op, eq.group(3), eq.group(4), eq.group(5)), limit, null);
    }

    Matcher m = COMPARISON.matcher(inner);
    if (m.find()) {
      String var = m.group(1) != null ? m.group(1) : m.group(2);
      return new Translation(render(var, m.group(3), m.group(4), m.group(5), m.group(6)), limit, null);
    }

    return new Translation(original, limit, "Could not convert while condition: " + original);
  }

  /** Strips {@code ${__groovy(...)}}-style wrappers, including a trailing empty argument. */
  private String unwrap(String expression) {
    String s = expression;
    Matcher m = WRAPPER.matcher(s);
    while (m.matches()) {
      s = m.group(1).trim();
      if (s.endsWith(",")) s = s.substring(0, s.length() - 1).trim();
      m = WRAPPER.matcher(s);
    }
    return s;
  }

  private Integer iterationLimit(String expression) {
    Matcher m = ITERATION_LIMIT.matcher(expression);
    if (!m.find()) return null;
    int n = Integer.parseInt(m.group(2));
    return "<".equals(m.group(1)) ? Math.max(1, n - 1) : n;
  }

  private String render(String var, String op, String singleQuoted, String doubleQuoted, String number) {
    String literal;
    if (number != null) {
      literal = number;
    } else {
      String text = singleQuoted != null ? singleQuoted : doubleQuoted;
      boolean relational = !"==".equals(op) && !"!=".equals(op);
      literal = relational && NUMBER.matcher(text).matches() ? text : "'" + text + "'";
    }
    return "${" + var + "} " + op + " " + literal;
  }
}
