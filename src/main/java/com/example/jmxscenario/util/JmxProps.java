package com.example.jmxscenario.util;

import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;

import java.util.ArrayList;
import java.util.List;

/**
 * Typed accessors over JMX property elements ({@code stringProp}, {@code boolProp},
 * {@code intProp}, {@code elementProp}, {@code collectionProp}). Only direct children of the
 * given element are inspected. Missing or blank values resolve to the supplied default, and so
 * do values that cannot be coerced to the requested type.
 */
public final class JmxProps {

  private JmxProps() {
  }

  public static List<Element> childElements(Element parent) {
    List<Element> out = new ArrayList<>();
    if (parent == null) return out;
    NodeList children = parent.getChildNodes();
    for (int i = 0; i < children.getLength(); i++) {
      Node n = children.item(i);
      if (n.getNodeType() == Node.ELEMENT_NODE) out.add((Element) n);
    }
    return out;
  }

  public static Element findProp(Element parent, String tag, String name) {
    for (Element el : childElements(parent)) {
      if (tag.equals(el.getTagName()) && name.equals(el.getAttribute("name"))) {
        return el;
      }
    }
    return null;
  }

  public static String getString(Element element, String name) {
    return getString(element, name, "");
  }

  public static String getString(Element element, String name, String defaultValue) {
    Element prop = findProp(element, "stringProp", name);
    if (prop == null) return defaultValue;
    String text = prop.getTextContent();
    return text == null || text.isEmpty() ? defaultValue : text;
  }

  public static boolean getBool(Element element, String name, boolean defaultValue) {
    Element prop = findProp(element, "boolProp", name);
    if (prop == null) return defaultValue;
    String text = prop.getTextContent();
    if (text == null || text.trim().isEmpty()) return defaultValue;
    return "true".equalsIgnoreCase(text.trim());
  }

  /**
   * JMeter stores numbers either as {@code intProp} or as {@code stringProp}; both are tried,
   * in that order.
   */
  public static int getInt(Element element, String name, int defaultValue) {
    Integer v = getOptionalInt(element, name);
    return v == null ? defaultValue : v;
  }

  public static Integer getOptionalInt(Element element, String name) {
    Element prop = findProp(element, "intProp", name);
    if (prop != null) {
      Integer v = parseInt(prop.getTextContent(), null);
      if (v != null) return v;
    }
    prop = findProp(element, "stringProp", name);
    if (prop != null) return parseInt(prop.getTextContent(), null);
    return null;
  }

  public static Integer parseInt(String text, Integer defaultValue) {
    if (text == null || text.trim().isEmpty()) return defaultValue;
    try {
      return Integer.parseInt(text.trim());
    } catch (NumberFormatException e) {
      return defaultValue;
    }
  }

  public static String getAttribute(Element element, String name, String defaultValue) {
    if (element == null || !element.hasAttribute(name)) return defaultValue;
    return element.getAttribute(name);
  }

  public static String testName(Element element, String defaultValue) {
    String name = getAttribute(element, "testname", "");
    return name.trim().isEmpty() ? defaultValue : name;
  }

  public static boolean isEnabled(Element element) {
    return "true".equalsIgnoreCase(getAttribute(element, "enabled", "true").trim());
  }

  public static Element findElementProp(Element parent, String name) {
    return findProp(parent, "elementProp", name);
  }

  public static Element findCollection(Element parent, String name) {
    return findProp(parent, "collectionProp", name);
  }

  /**
   * The {@code elementProp} entries of a named collection, or an empty list when the
   * collection is missing.
   */
  public static List<Element> collectionEntries(Element parent, String collectionName) {
    List<Element> out = new ArrayList<>();
    Element collection = findCollection(parent, collectionName);
    if (collection == null) return out;
    for (Element el : childElements(collection)) {
      if ("elementProp".equals(el.getTagName())) out.add(el);
    }
    return out;
  }

  /** JMX escapes {@code ${x}} as {@code $${x}} in some places. */
  public static String normalizeVariableRefs(String text) {
    if (text == null || text.isEmpty()) return text;
    return text.replace("$${", "${");
  }

  public static String stripCarriageReturns(String text) {
    if (text == null || text.isEmpty()) return text;
    return text.replace("\r", "");
  }
}
