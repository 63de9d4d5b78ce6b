package com.example.jmxscenario.service;

import com.example.jmxscenario.exception.ConversionException;
import com.example.jmxscenario.model.AssertConfig;
import com.example.jmxscenario.model.CaptureConfig;
import com.example.jmxscenario.model.ConverterOptions;
import com.example.jmxscenario.model.ExtractedSampler;
import com.example.jmxscenario.model.FileUpload;
import com.example.jmxscenario.model.ImportResult;
import com.example.jmxscenario.model.JmxDefaults;
import com.example.jmxscenario.model.LoopConfig;
import com.example.jmxscenario.model.MatchMode;
import com.example.jmxscenario.model.ScenarioSettings;
import com.example.jmxscenario.util.CapturePaths;
import com.example.jmxscenario.util.ConditionTranslator;
import com.example.jmxscenario.util.HashTreeIndex;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NodeList;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static com.example.jmxscenario.util.JmxProps.*;

/**
 * Walks the logical JMX tree and pulls out everything the scenario needs: plan name and
 * description, HTTP defaults, user variables, thread settings and one {@link ExtractedSampler}
 * per {@code HTTPSamplerProxy}, in document order.
 */
@Service
@Slf4j
public class JmxExtractor {

    static final String DEFAULT_NAME = "Converted Test Plan";
    static final String SAMPLER = "HTTPSamplerProxy";

    private static final Map<String, String> UNSUPPORTED = new LinkedHashMap<>();

    static {
        UNSUPPORTED.put("JSR223Sampler", "Groovy/JavaScript scripts are not portable");
        UNSUPPORTED.put("BeanShellSampler", "BeanShell scripts are not portable");
        UNSUPPORTED.put("RegexExtractor", "regex extraction is not supported in pt_scenario");
        UNSUPPORTED.put("CSVDataSet", "external data sources are not supported");
        UNSUPPORTED.put("TransactionController", "transaction grouping is not supported in pt_scenario");
    }

    // scheme, host, port, path, query; host and port may be ${...} references
    private static final Pattern ABSOLUTE_URL = Pattern.compile(
            "(?i)(https?)://((?:[^/:?#$]|\\$\\{[^}]*})+)(?::(\\d+|\\$\\{[^}]*}))?((?:/[^?#]*)?)(?:\\?([^#]*))?(?:#.*)?");

    private final ObjectMapper mapper = new ObjectMapper()
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    private final ConditionTranslator conditions = new ConditionTranslator();

    public ImportResult extract(Document document, ConverterOptions options) {
        ImportResult result = new ImportResult();
        Element root = document.getDocumentElement();
        HashTreeIndex index = HashTreeIndex.build(root);
        log.debug("Reconstructed hash tree with {} elements", index.size());

        Element testPlan = first(root, "TestPlan");
        result.name = testPlan == null ? "" : testName(testPlan, "");
        if (result.name.isEmpty()) {
            warn(result, "Test plan has no name, using '" + DEFAULT_NAME + "'");
            result.name = DEFAULT_NAME;
        }
        String comments = testPlan == null ? "" : getString(testPlan, "TestPlan.comments").trim();
        result.description = comments.isEmpty() ? null : comments;

        result.defaults = extractDefaults(root, result);
        result.variables = extractVariables(root, testPlan);
        result.settings = extractThreadSettings(root, result);

        Scope scope = new Scope(new LinkedHashMap<>(), null, null, true);
        walk(index.roots(), index, scope, options, result);

        if (result.samplers.isEmpty()) {
            throw new ConversionException("No HTTP samplers found", "the test plan contains no " + SAMPLER + " elements");
        }
        log.info("Extracted {} HTTP samplers", result.samplers.size());
        return result;
    }

    // ==== Plan level ====

    private JmxDefaults extractDefaults(Element root, ImportResult result) {
        JmxDefaults defaults = new JmxDefaults();
        List<Element> found = new ArrayList<>();
        for (Element config : all(root, "ConfigTestElement")) {
            if (getAttribute(config, "guiclass", "").contains("HttpDefaultsGui") && isEnabled(config)) {
                found.add(config);
            }
        }
        if (found.isEmpty()) return defaults;
        if (found.size() > 1) {
            warn(result, "Multiple HTTP Request Defaults found (" + found.size() + "), using '"
                    + testName(found.get(0), "HTTP Request Defaults") + "' and ignoring the rest");
        }
        Element config = found.get(0);
        defaults.domain = getString(config, "HTTPSampler.domain").trim();
        defaults.port = getString(config, "HTTPSampler.port").trim();
        defaults.protocol = getString(config, "HTTPSampler.protocol", "http").trim();
        return defaults;
    }

    private Map<String, String> extractVariables(Element root, Element testPlan) {
        Map<String, String> variables = new LinkedHashMap<>();
        if (testPlan != null) {
            Element udv = findElementProp(testPlan, "TestPlan.user_defined_variables");
            if (udv != null) readArguments(udv, variables);
        }
        for (Element args : all(root, "Arguments")) {
            if (getAttribute(args, "guiclass", "").contains("ArgumentsPanel")
                    && !getAttribute(args, "guiclass", "").contains("HTTPArgumentsPanel")
                    && isEnabled(args)) {
                readArguments(args, variables);
            }
        }
        return variables;
    }

    private void readArguments(Element arguments, Map<String, String> into) {
        for (Element arg : collectionEntries(arguments, "Arguments.arguments")) {
            String name = getString(arg, "Argument.name").trim();
            if (!name.isEmpty()) into.put(name, normalizeVariableRefs(getString(arg, "Argument.value")));
        }
    }

    private ScenarioSettings extractThreadSettings(Element root, ImportResult result) {
        ScenarioSettings settings = new ScenarioSettings();
        List<Element> groups = new ArrayList<>();
        for (Element tg : all(root, "ThreadGroup")) {
            if (isEnabled(tg)) groups.add(tg);
        }
        if (groups.isEmpty()) return settings;
        if (groups.size() > 1) {
            warn(result, "Multiple ThreadGroups found (" + groups.size() + "), using settings of '"
                    + testName(groups.get(0), "Thread Group") + "' only");
        }
        Element tg = groups.get(0);
        settings.threads = getInt(tg, "ThreadGroup.num_threads", 1);
        settings.rampup = getInt(tg, "ThreadGroup.ramp_time", 0);
        if (getBool(tg, "ThreadGroup.scheduler", false)) {
            Integer duration = getOptionalInt(tg, "ThreadGroup.duration");
            settings.duration = duration == null || duration <= 0 ? null : duration;
        }
        Element controller = findElementProp(tg, "ThreadGroup.main_controller");
        if (controller != null) {
            String loops = getString(controller, "LoopController.loops", "1").trim();
            int count = parseInt(loops, 1);
            settings.loops = count < 0 ? 0 : count;
        }
        return settings;
    }

    // ==== Tree walk ====

    private static final class Scope {
        final Map<String, String> headers;
        final LoopConfig loop;
        final String loopOwner;
        final boolean enabled;

        Scope(Map<String, String> headers, LoopConfig loop, String loopOwner, boolean enabled) {
            this.headers = headers;
            this.loop = loop;
            this.loopOwner = loopOwner;
            this.enabled = enabled;
        }
    }

    private void walk(List<Element> children, HashTreeIndex index, Scope scope, ConverterOptions options, ImportResult result) {
        Map<String, String> headers = new LinkedHashMap<>(scope.headers);
        for (Element child : children) {
            if ("HeaderManager".equals(child.getTagName()) && isEnabled(child)) {
                headers.putAll(readHeaders(child));
            }
        }
        Scope local = new Scope(headers, scope.loop, scope.loopOwner, scope.enabled);

        Integer pendingPause = null;
        for (Element child : children) {
            String tag = child.getTagName();
            if (SAMPLER.equals(tag)) {
                ExtractedSampler sampler = extractSampler(child, index, local, result);
                if (pendingPause != null && sampler.thinkTime == null) sampler.thinkTime = pendingPause;
                pendingPause = null;
                result.samplers.add(sampler);
                log.debug("Sampler {} -> {} {}", sampler.name, sampler.method, sampler.path);
            } else if (UNSUPPORTED.containsKey(tag)) {
                warnUnsupported(child, result);
            } else if ("TestAction".equals(tag)) {
                if (isEnabled(child) && getInt(child, "TestAction.action", 0) == 1) {
                    int duration = getInt(child, "TestAction.duration", 0);
                    if (duration > 0) pendingPause = duration;
                }
                walk(index.childrenOf(child), index, local, options, result);
            } else if (isLoopController(tag)) {
                boolean enabled = local.enabled && isEnabled(child);
                LoopConfig loop = enabled ? buildLoop(child, index, options, result) : null;
                Scope inner;
                if (loop == null) {
                    inner = new Scope(local.headers, local.loop, local.loopOwner, enabled);
                } else {
                    String owner = testName(child, tag);
                    if (local.loop != null) {
                        warn(result, "Nested loop '" + owner + "' inside '" + local.loopOwner + "': only the innermost loop is kept");
                    }
                    inner = new Scope(local.headers, loop, owner, enabled);
                }
                walk(index.childrenOf(child), index, inner, options, result);
            } else {
                boolean enabled = local.enabled && isEnabled(child);
                Scope inner = enabled == local.enabled ? local : new Scope(local.headers, local.loop, local.loopOwner, false);
                walk(index.childrenOf(child), index, inner, options, result);
            }
        }
    }

    private boolean isLoopController(String tag) {
        return "LoopController".equals(tag) || "ForeachController".equals(tag) || "WhileController".equals(tag);
    }

    private void warnUnsupported(Element element, ImportResult result) {
        String tag = element.getTagName();
        warn(result, testName(element, tag) + " (" + tag + ") ignored: " + UNSUPPORTED.get(tag));
    }

    // ==== Loops ====

    private LoopConfig buildLoop(Element controller, HashTreeIndex index, ConverterOptions options, ImportResult result) {
        String tag = controller.getTagName();
        String name = testName(controller, tag);
        if ("LoopController".equals(tag)) {
            String raw = getString(controller, "LoopController.loops").trim();
            Integer count = parseInt(raw, null);
            if (count == null) {
                warn(result, "Loop controller '" + name + "' has a non-numeric loop count '" + raw + "'; loop dropped");
                return null;
            }
            if (count < 0) {
                warn(result, "Loop controller '" + name + "' loops forever; loop dropped");
                return null;
            }
            return LoopConfig.count(count, null);
        }
        if ("ForeachController".equals(tag)) {
            String items = getString(controller, "ForeachController.inputVal").trim();
            String variable = getString(controller, "ForeachController.returnVal").trim();
            if (items.isEmpty() || variable.isEmpty()) {
                warn(result, "ForEach controller '" + name + "' lacks an input or output variable; loop dropped");
                return null;
            }
            return LoopConfig.forEach(items, variable);
        }
        String condition = getString(controller, "WhileController.condition").trim();
        if (condition.isEmpty()) {
            warn(result, "While controller '" + name + "' has no condition; loop dropped");
            return null;
        }
        ConditionTranslator.Translation t = conditions.translate(condition);
        if (!t.isRecognized()) warn(result, t.warning);
        int max = t.maxIterations != null ? t.maxIterations : options.getWhileMaxIterations();
        Integer interval = options.getWhileIntervalMs();
        for (Element child : index.childrenOf(controller)) {
            if ("ConstantTimer".equals(child.getTagName()) && isEnabled(child)) {
                Integer delay = parseInt(getString(child, "ConstantTimer.delay"), null);
                if (delay != null && delay > 0) {
                    interval = delay;
                    break;
                }
            }
        }
        return LoopConfig.whileLoop(t.condition, max, interval);
    }

    // ==== Samplers ====

    private ExtractedSampler extractSampler(Element el, HashTreeIndex index, Scope scope, ImportResult result) {
        ExtractedSampler s = new ExtractedSampler();
        s.name = testName(el, "HTTP Request");
        s.enabled = scope.enabled && isEnabled(el);
        s.method = getString(el, "HTTPSampler.method", "GET").trim().toUpperCase();
        s.domain = getString(el, "HTTPSampler.domain").trim();
        s.port = getString(el, "HTTPSampler.port").trim();
        s.protocol = getString(el, "HTTPSampler.protocol").trim();
        s.path = normalizeVariableRefs(getString(el, "HTTPSampler.path", "/").trim());
        if (s.path.startsWith("http://") || s.path.startsWith("https://")) splitAbsoluteUrl(s, result);
        if (s.path.isEmpty()) s.path = "/";

        readBody(el, s, result);
        s.files = readFiles(el);

        s.headers.putAll(scope.headers);
        List<Element> children = index.childrenOf(el);
        for (Element child : children) {
            if ("HeaderManager".equals(child.getTagName()) && isEnabled(child)) s.headers.putAll(readHeaders(child));
        }

        AssertConfig assertions = new AssertConfig();
        for (Element child : children) {
            String tag = child.getTagName();
            if (UNSUPPORTED.containsKey(tag)) {
                warnUnsupported(child, result);
                continue;
            }
            if (!isEnabled(child)) continue;
            switch (tag) {
                case "JSONPostProcessor":
                    readCaptures(child, s, result);
                    break;
                case "ResponseAssertion":
                    readResponseAssertion(child, assertions);
                    break;
                case "JSONPathAssertion":
                    readJsonPathAssertion(child, s, assertions, result);
                    break;
                case "ConstantTimer":
                case "UniformRandomTimer":
                    readTimer(child, s, result);
                    break;
                default:
                    break;
            }
        }
        s.assertions = assertions.isEmpty() ? null : assertions;
        s.loop = scope.loop;
        return s;
    }

    private void splitAbsoluteUrl(ExtractedSampler s, ImportResult result) {
        Matcher m = ABSOLUTE_URL.matcher(s.path);
        if (!m.matches()) {
            warn(result, "Request '" + s.name + "' has an unparseable URL in its path: " + s.path);
            return;
        }
        if (s.protocol.isEmpty()) s.protocol = m.group(1).toLowerCase();
        if (s.domain.isEmpty()) s.domain = m.group(2);
        if (s.port.isEmpty() && m.group(3) != null) s.port = m.group(3);
        String path = m.group(4).isEmpty() ? "/" : m.group(4);
        s.path = m.group(5) == null ? path : path + "?" + m.group(5);
    }

    private void readBody(Element el, ExtractedSampler s, ImportResult result) {
        Element arguments = findElementProp(el, "HTTPsampler.Arguments");
        if (arguments == null) return;
        List<Element> entries = collectionEntries(arguments, "Arguments.arguments");
        if (getBool(el, "HTTPSampler.postBodyRaw", false)) {
            for (Element arg : entries) {
                String value = stripCarriageReturns(getString(arg, "Argument.value")).trim();
                if (value.isEmpty()) continue;
                try {
                    JsonNode node = mapper.readTree(value);
                    if (node != null && node.isContainerNode()) {
                        s.payload = node;
                    } else {
                        warn(result, "Request '" + s.name + "' raw body is not a JSON object or array; payload dropped");
                    }
                } catch (JsonProcessingException e) {
                    warn(result, "Request '" + s.name + "' raw body is not valid JSON (" + e.getOriginalMessage() + "); payload dropped");
                }
                return;
            }
            return;
        }
        for (Element arg : entries) {
            String name = getString(arg, "Argument.name").trim();
            if (!name.isEmpty()) s.params.put(name, normalizeVariableRefs(getString(arg, "Argument.value")));
        }
    }

    private List<FileUpload> readFiles(Element el) {
        List<FileUpload> files = new ArrayList<>();
        Element fileArgs = findElementProp(el, "HTTPsampler.Files");
        if (fileArgs == null) return files;
        for (Element file : collectionEntries(fileArgs, "HTTPFileArgs.files")) {
            if (!"HTTPFileArg".equals(getAttribute(file, "elementType", ""))) continue;
            String path = getString(file, "File.path").trim();
            String param = getString(file, "File.paramname").trim();
            String mime = getString(file, "File.mimetype").trim();
            if (!path.isEmpty() && !param.isEmpty()) {
                files.add(new FileUpload(normalizeVariableRefs(path), param, mime.isEmpty() ? null : mime));
            }
        }
        return files;
    }

    private Map<String, String> readHeaders(Element manager) {
        Map<String, String> headers = new LinkedHashMap<>();
        for (Element header : collectionEntries(manager, "HeaderManager.headers")) {
            String name = getString(header, "Header.name").replaceAll("^[-\\s]+", "").trim();
            if (!name.isEmpty()) headers.put(name, normalizeVariableRefs(getString(header, "Header.value")));
        }
        return headers;
    }

    // ==== Post-processors, assertions, timers ====

    private void readCaptures(Element extractor, ExtractedSampler s, ImportResult result) {
        List<String> names = split(getString(extractor, "JSONPostProcessor.referenceNames"));
        List<String> paths = split(getString(extractor, "JSONPostProcessor.jsonPathExprs"));
        List<String> matches = split(getString(extractor, "JSONPostProcessor.match_numbers"));
        if (names.isEmpty()) {
            warn(result, "JSON extractor '" + testName(extractor, "JSONPostProcessor") + "' on request '"
                    + s.name + "' declares no variable names; ignored");
            return;
        }
        for (int i = 0; i < names.size(); i++) {
            String name = names.get(i);
            String path = i < paths.size() ? paths.get(i) : "";
            String match = i < matches.size() ? matches.get(i) : (matches.size() == 1 ? matches.get(0) : "");
            CaptureConfig capture;
            if (path.isEmpty()) {
                capture = CaptureConfig.simple(name);
            } else if (!match.isEmpty()) {
                capture = CaptureConfig.explicit(name, path, matchMode(match, name, result));
            } else {
                String field = CapturePaths.topLevelField(path);
                if (name.equals(field)) {
                    capture = CaptureConfig.simple(name);
                } else if (field != null) {
                    capture = CaptureConfig.field(name, field);
                } else {
                    capture = CaptureConfig.explicit(name, path, MatchMode.FIRST);
                }
            }
            s.captures.add(capture);
        }
    }

    /** Match number 1 is the first match; 0, negative or greater than 1 are treated as all matches. */
    MatchMode matchMode(String raw, String variable, ImportResult result) {
        if (raw == null || raw.trim().isEmpty()) return MatchMode.FIRST;
        Integer n = parseInt(raw, null);
        if (n == null) {
            warn(result, "Capture '" + variable + "' has an invalid match number '" + raw + "'; using 'first'");
            return MatchMode.FIRST;
        }
        return n == 1 ? MatchMode.FIRST : MatchMode.ALL;
    }

    private void readResponseAssertion(Element assertion, AssertConfig into) {
        String field = getString(assertion, "Assertion.test_field");
        int type = getInt(assertion, "Assertion.test_type", 8);
        boolean negated = (type & 4) != 0;
        if (negated) return;
        Element strings = findCollection(assertion, "Asserion.test_strings");
        if (strings == null) strings = findCollection(assertion, "Assertion.test_strings");
        if (strings == null) return;
        List<String> values = new ArrayList<>();
        for (Element prop : childElements(strings)) {
            String text = prop.getTextContent();
            if (text != null && !text.trim().isEmpty()) values.add(text.trim());
        }
        if ("Assertion.response_code".equals(field) && (type & 9) != 0) {
            for (String v : values) {
                Integer code = parseInt(v, null);
                if (code != null) {
                    if (into.status == null) into.status = code;
                    break;
                }
            }
        } else if ("Assertion.response_headers".equals(field) && (type & 8) != 0) {
            for (String v : values) {
                int colon = v.indexOf(':');
                if (colon > 0) into.headers.put(v.substring(0, colon).trim(), v.substring(colon + 1).trim());
            }
        }
    }

    private void readJsonPathAssertion(Element assertion, ExtractedSampler s, AssertConfig into, ImportResult result) {
        String path = getString(assertion, "JSON_PATH").trim();
        String expected = getString(assertion, "EXPECTED_VALUE");
        if (path.isEmpty() || expected.isEmpty() || !getBool(assertion, "JSONVALIDATION", true)) return;
        if (getBool(assertion, "INVERT", false)) return;
        String key = path.startsWith("$.") ? path.substring(2) : path;
        if (key.isEmpty() || key.contains(".") || key.contains("[") || key.contains("*") || key.startsWith("$")) {
            warn(result, "JSON assertion '" + testName(assertion, "JSONPathAssertion") + "' on request '" + s.name
                    + "' uses path " + path + " which cannot be expressed as a body field; ignored");
            return;
        }
        into.body.put(key, typedValue(expected));
    }

    private Object typedValue(String text) {
        String t = text.trim();
        try {
            JsonNode node = mapper.readTree(t);
            if (node != null && node.isNumber()) return node.numberValue();
            if (node != null && node.isBoolean()) return node.booleanValue();
        } catch (JsonProcessingException e) {
            log.trace("Expected value {} kept as text", t);
        }
        return text;
    }

    private void readTimer(Element timer, ExtractedSampler s, ImportResult result) {
        String name = testName(timer, timer.getTagName());
        String rawDelay = getString(timer, "ConstantTimer.delay").trim();
        Integer delay = parseInt(rawDelay, null);
        if (delay == null && !rawDelay.isEmpty()) {
            warn(result, "Timer '" + name + "' on request '" + s.name + "' has a non-numeric delay '" + rawDelay + "'; ignored");
            return;
        }
        int ms = delay == null ? 0 : delay;
        if ("UniformRandomTimer".equals(timer.getTagName())) {
            double range = parseDouble(getString(timer, "RandomTimer.range"));
            ms += (int) (range / 2);
        }
        if (ms <= 0) return;
        if (s.thinkTime != null) {
            warn(result, "Request '" + s.name + "' has more than one timer; keeping " + s.thinkTime + " ms and ignoring '" + name + "'");
            return;
        }
        s.thinkTime = ms;
    }

    // ==== Helpers ====

    private static double parseDouble(String text) {
        if (text == null || text.trim().isEmpty()) return 0;
        try {
            return Double.parseDouble(text.trim());
        } catch (NumberFormatException e) {
            return 0;
        }
    }

    private static List<String> split(String csv) {
        List<String> out = new ArrayList<>();
        if (csv == null) return out;
        for (String part : csv.split("[,;]")) {
            if (!part.trim().isEmpty()) out.add(part.trim());
        }
        return out;
    }

    private static Element first(Element root, String tag) {
        NodeList nodes = root.getElementsByTagName(tag);
        return nodes.getLength() == 0 ? null : (Element) nodes.item(0);
    }

    private static List<Element> all(Element root, String tag) {
        List<Element> out = new ArrayList<>();
        NodeList nodes = root.getElementsByTagName(tag);
        for (int i = 0; i < nodes.getLength(); i++) out.add((Element) nodes.item(i));
        return out;
    }

    private void warn(ImportResult result, String warning) {
        log.warn(warning);
        result.warn(warning);
    }
}
