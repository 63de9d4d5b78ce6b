package com.example.jmxscenario.service;

import com.example.jmxscenario.model.CaptureConfig;
import com.example.jmxscenario.model.ExtractedSampler;
import com.example.jmxscenario.model.ImportResult;
import com.example.jmxscenario.model.JmxDefaults;
import com.example.jmxscenario.model.MatchMode;
import com.example.jmxscenario.model.ParsedScenario;
import com.example.jmxscenario.model.ScenarioStep;
import com.example.jmxscenario.util.CapturePaths;
import com.example.jmxscenario.util.OpenApiExtractor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Maps extracted samplers onto scenario steps. Step order is sampler order; disabled samplers
 * become steps with {@code enabled: false}.
 */
@Service
@Slf4j
public class ScenarioBuilder {

    public ParsedScenario build(ImportResult result, OpenApiExtractor.OpenApiInfo openApi) {
        ParsedScenario scenario = new ParsedScenario();
        scenario.name = result.name;
        scenario.description = result.description;
        scenario.settings = result.settings;
        scenario.variables = new LinkedHashMap<>(result.variables);

        Origin base = baseOrigin(result);
        scenario.settings.baseUrl = base == null ? null : base.toUrl();
        log.debug("Base URL: {}", scenario.settings.baseUrl);

        for (ExtractedSampler sampler : result.samplers) {
            if (base != null) checkOrigin(sampler, base, result);
            scenario.steps.add(toStep(sampler, openApi));
        }
        log.info("Built scenario '{}' with {} steps", scenario.name, scenario.steps.size());
        return scenario;
    }

    ScenarioStep toStep(ExtractedSampler sampler, OpenApiExtractor.OpenApiInfo openApi) {
        ScenarioStep step = new ScenarioStep();
        step.name = sampler.name;
        step.endpoint = endpoint(sampler, openApi);
        step.enabled = sampler.enabled;
        step.params = nonEmpty(sampler.params);
        step.headers = nonEmpty(sampler.headers);
        step.payload = sampler.payload;
        step.files = new ArrayList<>(sampler.files);
        for (CaptureConfig capture : sampler.captures) {
            step.capture.add(normalize(capture));
        }
        step.assertions = sampler.assertions;
        step.loop = sampler.loop;
        step.thinkTime = sampler.thinkTime;
        return step;
    }

    private String endpoint(ExtractedSampler sampler, OpenApiExtractor.OpenApiInfo openApi) {
        String method = sampler.method == null || sampler.method.isEmpty() ? "GET" : sampler.method.toUpperCase(Locale.ROOT);
        if (openApi != null) {
            String operationId = openApi.findOperationId(method, sampler.path);
            if (operationId != null) return operationId;
        }
        return method + " " + sampler.path;
    }

    /**
     * Collapses an explicit first-match capture into the shortest equivalent form: the simple form
     * when its path is the one inferred from the variable name, the field form for any other
     * top-level field.
     */
    CaptureConfig normalize(CaptureConfig capture) {
        if (!(capture instanceof CaptureConfig.Explicit)) return capture;
        CaptureConfig.Explicit explicit = (CaptureConfig.Explicit) capture;
        if (explicit.match != MatchMode.FIRST) return capture;
        String path = explicit.jsonPath.trim();
        if (path.equals(CapturePaths.inferredPath(explicit.variableName))) {
            return CaptureConfig.simple(explicit.variableName);
        }
        String field = CapturePaths.topLevelField(path);
        return field == null ? capture : CaptureConfig.field(explicit.variableName, field);
    }

    private static Map<String, String> nonEmpty(Map<String, String> in) {
        Map<String, String> out = new LinkedHashMap<>();
        in.forEach((k, v) -> {
            if (k != null && !k.trim().isEmpty() && v != null && !v.isEmpty()) out.put(k, v);
        });
        return out;
    }

    // ==== Base URL ====

    private static final class Origin {
        final String scheme;
        final String host;
        final String port;

        Origin(String scheme, String host, String port) {
            this.scheme = scheme;
            this.host = host;
            this.port = port;
        }

        String toUrl() {
            boolean defaultPort = port.isEmpty()
                    || ("http".equals(scheme) && "80".equals(port))
                    || ("https".equals(scheme) && "443".equals(port));
            return scheme + "://" + host + (defaultPort ? "" : ":" + port);
        }
    }

    private Origin baseOrigin(ImportResult result) {
        JmxDefaults defaults = result.defaults;
        if (defaults != null && !defaults.domain.isEmpty()) {
            return new Origin(scheme(defaults.protocol), defaults.domain, defaults.port);
        }
        for (ExtractedSampler s : result.samplers) {
            if (!s.domain.isEmpty()) {
                String protocol = s.protocol.isEmpty() && defaults != null ? defaults.protocol : s.protocol;
                String port = s.port.isEmpty() && defaults != null ? defaults.port : s.port;
                log.debug("No HTTP Request Defaults host, using host of '{}'", s.name);
                return new Origin(scheme(protocol), s.domain, port);
            }
        }
        return null;
    }

    private void checkOrigin(ExtractedSampler s, Origin base, ImportResult result) {
        String scheme = s.protocol.isEmpty() ? base.scheme : scheme(s.protocol);
        String host = s.domain.isEmpty() ? base.host : s.domain;
        String port = s.port.isEmpty() ? base.port : s.port;
        Origin own = new Origin(scheme, host, port);
        if (!own.toUrl().equalsIgnoreCase(base.toUrl())) {
            String warning = "Request '" + s.name + "' targets " + own.toUrl() + " but the scenario base_url is "
                    + base.toUrl() + "; only its path is kept";
            log.warn(warning);
            result.warn(warning);
        }
    }

    private static String scheme(String protocol) {
        return protocol == null || protocol.trim().isEmpty() ? "http" : protocol.trim().toLowerCase(Locale.ROOT);
    }
}
