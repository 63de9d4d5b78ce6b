package com.example.jmxscenario.controller;

import com.example.jmxscenario.model.ConversionOutcome;
import com.example.jmxscenario.model.ConverterOptions;
import com.example.jmxscenario.service.ConversionService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.*;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

@RestController
@RequestMapping("/api")
public class ConversionController {

    @Autowired
    private ConversionService conversionService;

    @Value("${converter.while.max-iterations:100}")
    private int whileMaxIterations;

    @Value("${converter.while.interval-ms:#{null}}")
    private Integer whileIntervalMs;

    /** Hosts an {@code openapi} URL may point at; empty disables the parameter. */
    @Value("${converter.openapi.allowed-hosts:}")
    private String allowedHosts;

    @PostMapping(value = "/convert",
            consumes = {MediaType.APPLICATION_XML_VALUE, MediaType.TEXT_XML_VALUE, MediaType.TEXT_PLAIN_VALUE},
            produces = MediaType.APPLICATION_JSON_VALUE)
    public ConvertResponse convert(@RequestBody String jmx,
                                   @RequestParam(value = "openapi", required = false) String openApi) {
        ConverterOptions options = new ConverterOptions();
        options.setWhileMaxIterations(whileMaxIterations);
        options.setWhileIntervalMs(whileIntervalMs);
        if (openApi != null && !openApi.trim().isEmpty()) {
            options.setOpenApiLocation(checkOpenApiUrl(openApi.trim()));
        }
        ConversionOutcome outcome = conversionService.convert(jmx, options);
        return new ConvertResponse(outcome.scenario.name, outcome.yaml, outcome.warnings);
    }

    private String checkOpenApiUrl(String location) {
        URI uri;
        try {
            uri = new URI(location);
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException("openapi must be an http(s) URL: " + location);
        }
        String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
        if ((!scheme.equals("http") && !scheme.equals("https")) || uri.getHost() == null) {
            throw new IllegalArgumentException("openapi must be an http(s) URL: " + location);
        }
        Set<String> allowed = new HashSet<>();
        for (String host : allowedHosts.split(",")) {
            if (!host.trim().isEmpty()) allowed.add(host.trim().toLowerCase(Locale.ROOT));
        }
        if (!allowed.contains(uri.getHost().toLowerCase(Locale.ROOT))) {
            throw new IllegalArgumentException("openapi host " + uri.getHost() + " is not in converter.openapi.allowed-hosts");
        }
        return location;
    }

    public static class ConvertResponse {
        public String name;
        public String yaml;
        public List<String> warnings;

        public ConvertResponse(String name, String yaml, List<String> warnings) {
            this.name = name;
            this.yaml = yaml;
            this.warnings = warnings;
        }
    }
}
