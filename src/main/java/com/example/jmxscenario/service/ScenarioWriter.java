package com.example.jmxscenario.service;

import com.example.jmxscenario.exception.OutputException;
import com.example.jmxscenario.model.AssertConfig;
import com.example.jmxscenario.model.CaptureConfig;
import com.example.jmxscenario.model.FileUpload;
import com.example.jmxscenario.model.LoopConfig;
import com.example.jmxscenario.model.MatchMode;
import com.example.jmxscenario.model.ParsedScenario;
import com.example.jmxscenario.model.ScenarioSettings;
import com.example.jmxscenario.model.ScenarioStep;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Map;

/**
 * Renders a {@link ParsedScenario} as pt_scenario YAML. Keys are emitted in a fixed order and
 * fields holding their default value are left out, so the same scenario always renders to the
 * same text.
 */
@Service
@Slf4j
public class ScenarioWriter {

    private final ObjectMapper yaml = new ObjectMapper(YAMLFactory.builder()
            .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
            .enable(YAMLGenerator.Feature.MINIMIZE_QUOTES)
            .enable(YAMLGenerator.Feature.ALWAYS_QUOTE_NUMBERS_AS_STRINGS)
            .enable(YAMLGenerator.Feature.LITERAL_BLOCK_STYLE)
            .build());
    private final JsonNodeFactory nodes = JsonNodeFactory.instance;

    public String toYaml(ParsedScenario scenario) {
        try {
            return yaml.writeValueAsString(toTree(scenario));
        } catch (JsonProcessingException e) {
            throw new OutputException("Unable to render YAML", e.getOriginalMessage(), e);
        }
    }

    public void write(ParsedScenario scenario, Path target) {
        write(toYaml(scenario), target);
    }

    /** Writes to a sibling temp file first, so the target is either complete or untouched. */
    public void write(String text, Path target) {
        Path absolute = target.toAbsolutePath();
        Path dir = absolute.getParent();
        Path tmp = null;
        try {
            if (dir != null) Files.createDirectories(dir);
            tmp = Files.createTempFile(dir, absolute.getFileName().toString(), ".tmp");
            Files.writeString(tmp, text, StandardCharsets.UTF_8);
            try {
                Files.move(tmp, absolute, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, absolute, StandardCopyOption.REPLACE_EXISTING);
            }
            log.info("Wrote scenario to {}", absolute);
        } catch (IOException e) {
            deleteQuietly(tmp);
            throw new OutputException("Unable to write output file", absolute + " (" + e.getMessage() + ")", e);
        }
    }

    private void deleteQuietly(Path tmp) {
        if (tmp == null) return;
        try {
            Files.deleteIfExists(tmp);
        } catch (IOException e) {
            log.debug("Could not remove temp file {}: {}", tmp, e.getMessage());
        }
    }

    // ==== Tree ====

    ObjectNode toTree(ParsedScenario scenario) {
        ObjectNode root = nodes.objectNode();
        root.put("name", scenario.name);
        if (scenario.description != null && !scenario.description.isEmpty()) {
            root.put("description", scenario.description);
        }
        ObjectNode settings = settings(scenario.settings);
        if (!settings.isEmpty()) root.set("settings", settings);
        if (!scenario.variables.isEmpty()) root.set("variables", strings(scenario.variables));
        ArrayNode steps = root.putArray("scenario");
        for (ScenarioStep step : scenario.steps) {
            steps.add(step(step));
        }
        return root;
    }

    private ObjectNode settings(ScenarioSettings s) {
        ObjectNode out = nodes.objectNode();
        if (s == null) return out;
        if (s.threads != 1) out.put("threads", s.threads);
        if (s.rampup != 0) out.put("rampup", s.rampup);
        if (s.loops != null && s.loops != 1) out.put("loops", s.loops);
        if (s.duration != null) out.put("duration", s.duration);
        if (s.baseUrl != null && !s.baseUrl.isEmpty()) out.put("base_url", s.baseUrl);
        return out;
    }

    private ObjectNode step(ScenarioStep step) {
        ObjectNode out = nodes.objectNode();
        out.put("name", step.name);
        out.put("endpoint", step.endpoint);
        if (!step.enabled) out.put("enabled", false);
        if (!step.params.isEmpty()) out.set("params", strings(step.params));
        if (!step.headers.isEmpty()) out.set("headers", strings(step.headers));
        if (step.payload != null && !step.payload.isNull()) out.set("payload", step.payload.deepCopy());
        if (!step.files.isEmpty()) {
            ArrayNode files = out.putArray("files");
            for (FileUpload f : step.files) {
                ObjectNode file = files.addObject();
                file.put("path", f.path);
                file.put("param", f.param);
                if (f.mimeType != null) file.put("mime_type", f.mimeType);
            }
        }
        if (!step.capture.isEmpty()) {
            ArrayNode capture = out.putArray("capture");
            for (CaptureConfig c : step.capture) {
                capture.add(capture(c));
            }
        }
        if (step.assertions != null && !step.assertions.isEmpty()) out.set("assert", assertions(step.assertions));
        if (step.loop != null) out.set("loop", loop(step.loop));
        if (step.thinkTime != null && step.thinkTime > 0) out.put("think_time", step.thinkTime);
        return out;
    }

    private JsonNode capture(CaptureConfig c) {
        if (c instanceof CaptureConfig.Simple) {
            return nodes.textNode(c.variableName);
        }
        ObjectNode out = nodes.objectNode();
        if (c instanceof CaptureConfig.Field) {
            out.put(c.variableName, ((CaptureConfig.Field) c).field);
            return out;
        }
        CaptureConfig.Explicit e = (CaptureConfig.Explicit) c;
        ObjectNode spec = out.putObject(c.variableName);
        spec.put("path", e.jsonPath);
        if (e.match != MatchMode.FIRST) spec.put("match", e.match.getValue());
        return out;
    }

    private ObjectNode assertions(AssertConfig a) {
        ObjectNode out = nodes.objectNode();
        if (a.status != null) out.put("status", a.status);
        if (!a.body.isEmpty()) {
            ObjectNode body = out.putObject("body");
            a.body.forEach((k, v) -> body.set(k, yaml.valueToTree(v)));
        }
        if (!a.headers.isEmpty()) out.set("headers", strings(a.headers));
        return out;
    }

    private ObjectNode loop(LoopConfig loop) {
        ObjectNode out = nodes.objectNode();
        if (loop instanceof LoopConfig.Count) {
            LoopConfig.Count c = (LoopConfig.Count) loop;
            out.put("count", c.count);
            if (c.variable != null) out.put("variable", c.variable);
        } else if (loop instanceof LoopConfig.ForEach) {
            LoopConfig.ForEach f = (LoopConfig.ForEach) loop;
            out.put("foreach", f.items);
            out.put("variable", f.variable);
        } else {
            LoopConfig.While w = (LoopConfig.While) loop;
            out.put("while", w.condition);
            if (w.maxIterations != LoopConfig.DEFAULT_MAX_ITERATIONS) out.put("max", w.maxIterations);
            if (w.intervalMs != null) out.put("interval", w.intervalMs);
        }
        return out;
    }

    private ObjectNode strings(Map<String, String> values) {
        ObjectNode out = nodes.objectNode();
        values.forEach(out::put);
        return out;
    }
}
