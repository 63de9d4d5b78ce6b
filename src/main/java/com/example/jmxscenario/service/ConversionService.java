package com.example.jmxscenario.service;

import com.example.jmxscenario.model.ConversionOutcome;
import com.example.jmxscenario.model.ConverterOptions;
import com.example.jmxscenario.model.ImportResult;
import com.example.jmxscenario.model.ParsedScenario;
import com.example.jmxscenario.util.OpenApiExtractor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.w3c.dom.Document;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Runs one conversion: parse, extract, build, render. Each call owns its own
 * {@link ImportResult}, so warnings never carry over between runs.
 */
@Service("jmxConversionService")
public class ConversionService {

    private static final org.slf4j.Logger log = org.slf4j.LoggerFactory.getLogger(ConversionService.class);

    @Autowired
    private JmxReader reader;

    @Autowired
    private JmxExtractor extractor;

    @Autowired
    private ScenarioBuilder builder;

    @Autowired
    private ScenarioWriter writer;

    public ConversionService() {
    }

    public ConversionService(JmxReader reader, JmxExtractor extractor, ScenarioBuilder builder, ScenarioWriter writer) {
        this.reader = reader;
        this.extractor = extractor;
        this.builder = builder;
        this.writer = writer;
    }

    /** Wires the default collaborators without a Spring context. */
    public static ConversionService standalone() {
        return new ConversionService(new JmxReader(), new JmxExtractor(), new ScenarioBuilder(), new ScenarioWriter());
    }

    public Document parse(Path jmx) {
        log.info("Parsing JMX file: {}", jmx);
        return reader.read(jmx);
    }

    public ConversionOutcome convert(Path jmx, ConverterOptions options) {
        return convert(parse(jmx), options);
    }

    public ConversionOutcome convert(String jmxText, ConverterOptions options) {
        log.info("Parsing JMX document ({} chars)", jmxText == null ? 0 : jmxText.length());
        return convert(reader.read(jmxText), options);
    }

    public ConversionOutcome convert(Document document, ConverterOptions options) {
        ImportResult result = extractor.extract(document, options);
        OpenApiExtractor.OpenApiInfo openApi = loadOpenApi(options, result);

        log.info("Building scenario...");
        ParsedScenario scenario = builder.build(result, openApi);
        String yaml = writer.toYaml(scenario);
        if (!result.getWarnings().isEmpty()) {
            log.info("Conversion finished with {} warning(s)", result.getWarnings().size());
        }
        return new ConversionOutcome(scenario, yaml, result.getWarnings());
    }

    public void write(ConversionOutcome outcome, Path output) {
        log.info("Writing YAML file: {}", output);
        writer.write(outcome.yaml, output);
    }

    /** Converts and writes the YAML to {@code output}; nothing is written if conversion fails. */
    public ConversionOutcome convertToFile(Path jmx, Path output, ConverterOptions options) {
        ConversionOutcome outcome = convert(jmx, options);
        write(outcome, output);
        return outcome;
    }

    private OpenApiExtractor.OpenApiInfo loadOpenApi(ConverterOptions options, ImportResult result) {
        String location = options.getOpenApiLocation();
        if (location == null || location.trim().isEmpty()) return null;
        try {
            return new OpenApiExtractor().load(location.trim());
        } catch (IOException | RuntimeException e) {
            String warning = "OpenAPI document " + location + " could not be loaded (" + e.getMessage()
                    + "); endpoints use METHOD /path";
            log.warn(warning);
            result.warn(warning);
            return null;
        }
    }
}
