package com.example.jmxscenario.service;

import com.example.jmxscenario.JmxSamples;
import com.example.jmxscenario.exception.ConversionException;
import com.example.jmxscenario.exception.JmxParseException;
import com.example.jmxscenario.exception.OutputException;
import com.example.jmxscenario.model.ConversionOutcome;
import com.example.jmxscenario.model.ConverterOptions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static com.example.jmxscenario.JmxSamples.*;
import static org.junit.jupiter.api.Assertions.*;

class ConversionServiceTest {

    private final ConversionService service = ConversionService.standalone();

    @Test
    void convertsFileToYaml() {
        ConversionOutcome outcome = service.convert(JmxSamples.fixture("basic.jmx"), new ConverterOptions());

        assertEquals("Basic API", outcome.scenario.name);
        assertTrue(outcome.yaml.contains("base_url: http://api.example.com"), outcome.yaml);
        assertTrue(outcome.yaml.contains("endpoint: GET /items"), outcome.yaml);
        assertTrue(outcome.warnings.isEmpty());
    }

    @Test
    void whileLoopUsesConfiguredMaximum() {
        ConverterOptions options = new ConverterOptions();
        options.setWhileMaxIterations(10);
        options.setWhileIntervalMs(250);
        String xml = plan("Poll", whileController("Wait", "${status} != 'done'", JmxSamples.sampler("Check", "GET", "/status")));

        ConversionOutcome outcome = service.convert(xml, options);
        assertTrue(outcome.yaml.contains("max: 10"), outcome.yaml);
        assertTrue(outcome.yaml.contains("interval: 250"), outcome.yaml);
        assertTrue(outcome.warnings.isEmpty());
    }

    @Test
    void openApiDocumentResolvesOperationIds(@TempDir Path dir) throws Exception {
        Path spec = dir.resolve("openapi.json");
        Files.writeString(spec, "{\"openapi\":\"3.0.0\",\"paths\":{\"/items\":{\"get\":{\"operationId\":\"listItems\"}}}}",
                StandardCharsets.UTF_8);
        ConverterOptions options = new ConverterOptions();
        options.setOpenApiLocation(spec.toString());

        ConversionOutcome outcome = service.convert(JmxSamples.fixture("basic.jmx"), options);
        assertEquals("listItems", outcome.scenario.steps.get(0).endpoint);
    }

    @Test
    void unreadableOpenApiDocumentIsOnlyAWarning(@TempDir Path dir) {
        ConverterOptions options = new ConverterOptions();
        options.setOpenApiLocation(dir.resolve("missing.yaml").toString());

        ConversionOutcome outcome = service.convert(JmxSamples.fixture("basic.jmx"), options);
        assertEquals("GET /items", outcome.scenario.steps.get(0).endpoint);
        assertEquals(1, outcome.warnings.size());
        assertTrue(outcome.warnings.get(0).startsWith("OpenAPI document"));
    }

    @Test
    void fatalErrorsWriteNothing(@TempDir Path dir) {
        Path out = dir.resolve("pt_scenario.yaml");
        assertThrows(JmxParseException.class,
                () -> service.convertToFile(JmxSamples.fixture("malformed.jmx"), out, new ConverterOptions()));
        assertThrows(ConversionException.class,
                () -> service.convertToFile(JmxSamples.fixture("no-samplers.jmx"), out, new ConverterOptions()));
        assertFalse(Files.exists(out));
    }

    @Test
    void parseErrors(@TempDir Path dir) {
        assertThrows(JmxParseException.class, () -> service.convert(dir.resolve("absent.jmx"), new ConverterOptions()));
        assertThrows(JmxParseException.class, () -> service.convert("", new ConverterOptions()));
        assertThrows(JmxParseException.class, () -> service.convert("<testPlan><hashTree/></testPlan>", new ConverterOptions()));
        assertThrows(JmxParseException.class, () -> service.convert("<jmeterTestPlan/>", new ConverterOptions()));
    }

    @Test
    void doctypeIsRefused() {
        String xml = "<?xml version=\"1.0\"?><!DOCTYPE x [<!ENTITY e SYSTEM \"file:///etc/passwd\">]>"
                + "<jmeterTestPlan><hashTree/></jmeterTestPlan>";
        assertThrows(JmxParseException.class, () -> service.convert(xml, new ConverterOptions()));
    }

    @Test
    void writesYamlFile(@TempDir Path dir) throws Exception {
        Path out = dir.resolve("pt_scenario.yaml");
        ConversionOutcome outcome = service.convertToFile(JmxSamples.fixture("basic.jmx"), out, new ConverterOptions());
        assertEquals(outcome.yaml, Files.readString(out, StandardCharsets.UTF_8));
    }

    @Test
    void outputFailureIsAnOutputException(@TempDir Path dir) throws Exception {
        Path blocker = dir.resolve("blocker");
        Files.writeString(blocker, "x");
        assertThrows(OutputException.class, () -> service.convertToFile(JmxSamples.fixture("basic.jmx"),
                blocker.resolve("out.yaml"), new ConverterOptions()));
    }
}
