package com.example.jmxscenario;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class AppTest {

  private final ByteArrayOutputStream out = new ByteArrayOutputStream();
  private final ByteArrayOutputStream err = new ByteArrayOutputStream();

  private int run(String... args) {
    App app = new App(new PrintStream(out, true, StandardCharsets.UTF_8), new PrintStream(err, true, StandardCharsets.UTF_8));
    return app.run(args);
  }

  private String stdout() {
    return out.toString(StandardCharsets.UTF_8);
  }

  @Test
  void successWritesOutputAndSummary(@TempDir Path dir) throws Exception {
    Path output = dir.resolve("scenario.yaml");
    int code = run(JmxSamples.fixture("order-flow.jmx").toString(), "-o", output.toString(), "--while-max", "10");

    assertEquals(App.OK, code);
    assertTrue(Files.exists(output));
    String yaml = Files.readString(output, StandardCharsets.UTF_8);
    assertTrue(yaml.contains("max: 10"), yaml);
    assertTrue(stdout().contains("Scenario: Order Flow"));
    assertTrue(stdout().contains("Steps: 7"));
    assertTrue(stdout().contains("Warnings (6):"));
    assertTrue(stdout().trim().endsWith("Conversion complete!"));
  }

  @Test
  void verboseMentionsStages(@TempDir Path dir) {
    int code = run("-v", JmxSamples.fixture("basic.jmx").toString(), "--output", dir.resolve("o.yaml").toString());
    assertEquals(App.OK, code);
    assertTrue(stdout().contains("Parsing JMX file"));
    assertTrue(stdout().contains("Writing YAML file"));
    assertTrue(stdout().indexOf("Building scenario") < stdout().indexOf("Writing YAML file"));
    assertTrue(stdout().indexOf("Writing YAML file") < stdout().indexOf("Conversion complete!"));
  }

  @Test
  void verboseStopsAtTheFailingStage(@TempDir Path dir) {
    assertEquals(App.PARSE_ERROR, run("-v", JmxSamples.fixture("malformed.jmx").toString(), "-o", dir.resolve("a.yaml").toString()));
    assertTrue(stdout().contains("Parsing JMX file"));
    assertFalse(stdout().contains("Building scenario"));

    out.reset();
    assertEquals(App.CONVERSION_ERROR, run("-v", JmxSamples.fixture("no-samplers.jmx").toString(), "-o", dir.resolve("b.yaml").toString()));
    assertTrue(stdout().contains("Building scenario"));
    assertFalse(stdout().contains("Writing YAML file"));
  }

  @Test
  void parseErrorExitsWithOne(@TempDir Path dir) {
    assertEquals(App.PARSE_ERROR, run(JmxSamples.fixture("malformed.jmx").toString(), "-o", dir.resolve("o.yaml").toString()));
    assertFalse(Files.exists(dir.resolve("o.yaml")));
    assertTrue(err.toString(StandardCharsets.UTF_8).startsWith("Parse error"));
  }

  @Test
  void conversionErrorExitsWithTwo(@TempDir Path dir) {
    assertEquals(App.CONVERSION_ERROR, run(JmxSamples.fixture("no-samplers.jmx").toString(), "-o", dir.resolve("o.yaml").toString()));
  }

  @Test
  void outputErrorExitsWithThree(@TempDir Path dir) throws Exception {
    Path blocker = dir.resolve("blocker");
    Files.writeString(blocker, "x");
    assertEquals(App.OUTPUT_ERROR, run(JmxSamples.fixture("basic.jmx").toString(), "-o", blocker.resolve("o.yaml").toString()));
  }

  @Test
  void usageErrors() {
    assertEquals(App.PARSE_ERROR, run());
    assertEquals(App.PARSE_ERROR, run("a.jmx", "b.jmx"));
    assertEquals(App.PARSE_ERROR, run("--no-such-option", "a.jmx"));
    assertEquals(App.PARSE_ERROR, run("a.jmx", "--while-max", "0"));
    assertEquals(App.PARSE_ERROR, run("a.jmx", "--while-max", "lots"));
  }

  @Test
  void helpExitsWithZero() {
    assertEquals(App.OK, run("-h"));
    assertTrue(stdout().contains("--while-max"));
  }
}
