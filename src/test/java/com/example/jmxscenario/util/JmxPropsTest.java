package com.example.jmxscenario.util;

import org.junit.jupiter.api.Test;
import org.w3c.dom.Element;
import org.xml.sax.InputSource;

import javax.xml.parsers.DocumentBuilderFactory;
import java.io.StringReader;

import static org.junit.jupiter.api.Assertions.*;

class JmxPropsTest {

  private static Element parse(String xml) throws Exception {
    return DocumentBuilderFactory.newInstance().newDocumentBuilder()
        .parse(new InputSource(new StringReader(xml))).getDocumentElement();
  }

  @Test
  void readsTypedPropertiesWithDefaults() throws Exception {
    Element el = parse("<ThreadGroup testname='Users' enabled='false'>"
        + "<stringProp name='ThreadGroup.num_threads'>12</stringProp>"
        + "<stringProp name='ThreadGroup.ramp_time'>soon</stringProp>"
        + "<intProp name='ThreadGroup.delay'>7</intProp>"
        + "<boolProp name='ThreadGroup.scheduler'>TRUE</boolProp>"
        + "<stringProp name='empty'></stringProp>"
        + "</ThreadGroup>");

    assertEquals("12", JmxProps.getString(el, "ThreadGroup.num_threads"));
    assertEquals("fallback", JmxProps.getString(el, "empty", "fallback"));
    assertEquals("", JmxProps.getString(el, "missing"));
    assertEquals(12, JmxProps.getInt(el, "ThreadGroup.num_threads", 1));
    assertEquals(3, JmxProps.getInt(el, "ThreadGroup.ramp_time", 3));
    assertEquals(7, JmxProps.getOptionalInt(el, "ThreadGroup.delay"));
    assertNull(JmxProps.getOptionalInt(el, "missing"));
    assertTrue(JmxProps.getBool(el, "ThreadGroup.scheduler", false));
    assertTrue(JmxProps.getBool(el, "missing", true));
    assertEquals("Users", JmxProps.testName(el, "x"));
    assertFalse(JmxProps.isEnabled(el));
  }

  @Test
  void onlyDirectChildrenAreInspected() throws Exception {
    Element el = parse("<HTTPSamplerProxy>"
        + "<elementProp name='HTTPsampler.Arguments'>"
        + "<collectionProp name='Arguments.arguments'>"
        + "<elementProp name='a'><stringProp name='Argument.name'>a</stringProp></elementProp>"
        + "<stringProp name='noise'>x</stringProp>"
        + "<elementProp name='b'><stringProp name='Argument.name'>b</stringProp></elementProp>"
        + "</collectionProp></elementProp>"
        + "</HTTPSamplerProxy>");

    assertEquals("", JmxProps.getString(el, "Argument.name"));
    Element args = JmxProps.findElementProp(el, "HTTPsampler.Arguments");
    assertNotNull(args);
    assertEquals(2, JmxProps.collectionEntries(args, "Arguments.arguments").size());
    assertTrue(JmxProps.collectionEntries(args, "missing").isEmpty());
  }

  @Test
  void missingAttributesUseDefaults() throws Exception {
    Element el = parse("<HTTPSamplerProxy testname='  '/>");
    assertTrue(JmxProps.isEnabled(el));
    assertEquals("HTTP Request", JmxProps.testName(el, "HTTP Request"));
  }

  @Test
  void normalizesEscapedVariableReferences() {
    assertEquals("/users/${id}", JmxProps.normalizeVariableRefs("/users/$${id}"));
    assertEquals("a\nb", JmxProps.stripCarriageReturns("a\r\nb"));
    assertNull(JmxProps.parseInt("4x", null));
    assertEquals(-1, JmxProps.parseInt(" -1 ", 0));
  }
}
