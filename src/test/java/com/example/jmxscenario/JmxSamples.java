package com.example.jmxscenario;

import java.net.URISyntaxException;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Small builders for inline JMX documents used across tests.
 */
public final class JmxSamples {

  private JmxSamples() {
  }

  public static Path fixture(String name) {
    try {
      return Paths.get(JmxSamples.class.getResource("/jmx/" + name).toURI());
    } catch (URISyntaxException e) {
      throw new IllegalStateException(e);
    }
  }

  /** A test plan named {@code name} whose logical children are {@code tree}. */
  public static String plan(String name, String tree) {
    return "<?xml version=\"1.0\" encoding=\"UTF-8\"?>"
        + "<jmeterTestPlan version=\"1.2\"><hashTree>"
        + "<TestPlan testclass=\"TestPlan\" testname=\"" + name + "\" enabled=\"true\"/>"
        + "<hashTree>" + tree + "</hashTree>"
        + "</hashTree></jmeterTestPlan>";
  }

  public static String sampler(String name, String method, String path) {
    return sampler(name, method, path, "", "");
  }

  public static String sampler(String name, String method, String path, String props, String children) {
    return "<HTTPSamplerProxy testclass=\"HTTPSamplerProxy\" testname=\"" + name + "\" enabled=\"true\">"
        + "<stringProp name=\"HTTPSampler.path\">" + path + "</stringProp>"
        + "<stringProp name=\"HTTPSampler.method\">" + method + "</stringProp>"
        + props
        + "</HTTPSamplerProxy>"
        + "<hashTree>" + children + "</hashTree>";
  }

  public static String rawBody(String body) {
    return "<boolProp name=\"HTTPSampler.postBodyRaw\">true</boolProp>"
        + "<elementProp name=\"HTTPsampler.Arguments\" elementType=\"Arguments\">"
        + "<collectionProp name=\"Arguments.arguments\">"
        + "<elementProp name=\"\" elementType=\"HTTPArgument\">"
        + "<stringProp name=\"Argument.value\">" + body + "</stringProp>"
        + "</elementProp></collectionProp></elementProp>";
  }

  public static String defaults(String name, String protocol, String host, String port) {
    return "<ConfigTestElement guiclass=\"HttpDefaultsGui\" testclass=\"ConfigTestElement\" testname=\"" + name + "\" enabled=\"true\">"
        + "<stringProp name=\"HTTPSampler.domain\">" + host + "</stringProp>"
        + "<stringProp name=\"HTTPSampler.port\">" + port + "</stringProp>"
        + "<stringProp name=\"HTTPSampler.protocol\">" + protocol + "</stringProp>"
        + "</ConfigTestElement><hashTree/>";
  }

  public static String jsonExtractor(String names, String paths, String matches) {
    return "<JSONPostProcessor testclass=\"JSONPostProcessor\" testname=\"Extract\" enabled=\"true\">"
        + "<stringProp name=\"JSONPostProcessor.referenceNames\">" + names + "</stringProp>"
        + "<stringProp name=\"JSONPostProcessor.jsonPathExprs\">" + paths + "</stringProp>"
        + (matches == null ? "" : "<stringProp name=\"JSONPostProcessor.match_numbers\">" + matches + "</stringProp>")
        + "</JSONPostProcessor><hashTree/>";
  }

  public static String whileController(String name, String condition, String children) {
    return "<WhileController testclass=\"WhileController\" testname=\"" + name + "\" enabled=\"true\">"
        + "<stringProp name=\"WhileController.condition\">" + condition + "</stringProp>"
        + "</WhileController><hashTree>" + children + "</hashTree>";
  }
}
