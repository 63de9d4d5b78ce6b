package com.example.jmxscenario.util;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.extern.slf4j.Slf4j;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.TimeUnit;

/**
 * Loads an OpenAPI / Swagger document (JSON or YAML, from a file or an http(s) URL) and
 * resolves request method + path pairs to their operationId.
 */
@Slf4j
public class OpenApiExtractor {
  private static final List<String> METHODS = List.of("get", "put", "post", "delete", "options", "head", "patch", "trace");

  public static class Operation {
    public final String method;
    public final String path;
    public final String operationId;
    public Operation(String method, String path, String operationId) {
      this.method = method;
      this.path = path;
      this.operationId = operationId;
    }
  }

  public static class OpenApiInfo {
    public final String basePath;
    public final List<Operation> operations;
    public OpenApiInfo(String basePath, List<Operation> operations) {
      this.basePath = basePath;
      this.operations = operations;
    }

    /**
     * Literal path matches win over template matches; among templates, the one with the
     * most literal segments wins. Returns null when nothing matches.
     */
    public String findOperationId(String method, String path) {
      if (method == null || path == null) return null;
      String[] actual = segments(stripBase(stripQuery(path)));
      Operation best = null;
      int bestScore = -1;
      for (Operation op : operations) {
        if (!op.method.equalsIgnoreCase(method)) continue;
        int score = score(segments(op.path), actual);
        if (score > bestScore) {
          best = op;
          bestScore = score;
        }
      }
      return best == null ? null : best.operationId;
    }

    private String stripBase(String path) {
      if (basePath == null || basePath.isEmpty() || "/".equals(basePath)) return path;
      return path.startsWith(basePath + "/") ? path.substring(basePath.length()) : path;
    }
  }

  private final OkHttpClient http = new OkHttpClient.Builder()
      .connectTimeout(30, TimeUnit.SECONDS)
      .readTimeout(60, TimeUnit.SECONDS)
      .build();
  private final ObjectMapper jsonMapper = new ObjectMapper();
  private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());

  public OpenApiInfo load(String location) throws IOException {
    String raw;
    if (location.startsWith("http://") || location.startsWith("https://")) {
      log.info("Downloading OpenAPI document: {}", location);
      Request req = new Request.Builder().url(location).get().build();
      try (Response resp = http.newCall(req).execute()) {
        if (!resp.isSuccessful()) throw new IOException("OpenAPI download failed: HTTP " + resp.code());
        raw = resp.body() == null ? "" : resp.body().string();
      }
    } else {
      Path file = Paths.get(location);
      log.info("Reading OpenAPI document: {}", file.toAbsolutePath());
      raw = Files.readString(file, StandardCharsets.UTF_8);
    }
    return parse(raw);
  }

  public OpenApiInfo parse(String raw) throws IOException {
    String trimmed = raw == null ? "" : raw.trim();
    JsonNode root = trimmed.startsWith("{") ? jsonMapper.readTree(trimmed) : yamlMapper.readTree(trimmed);
    if (root == null || !root.isObject()) throw new IOException("OpenAPI document is not an object");
    List<Operation> ops = new ArrayList<>();
    JsonNode paths = root.path("paths");
    if (paths.isObject()) {
      paths.fieldNames().forEachRemaining(p -> {
        JsonNode item = paths.path(p);
        item.fieldNames().forEachRemaining(m -> {
          if (!METHODS.contains(m.toLowerCase(Locale.ROOT))) return;
          String operationId = item.path(m).path("operationId").asText("");
          if (!operationId.isEmpty()) ops.add(new Operation(m.toUpperCase(Locale.ROOT), p, operationId));
        });
      });
    }
    log.debug("OpenAPI operations with operationId: {}", ops.size());
    return new OpenApiInfo(basePath(root), ops);
  }

  // Swagger 2 basePath, or the path part of the first OpenAPI 3 server url
  private String basePath(JsonNode root) {
    String base = root.path("basePath").asText("");
    if (base.isEmpty()) {
      JsonNode servers = root.path("servers");
      if (servers.isArray() && servers.size() > 0) {
        String url = servers.get(0).path("url").asText("");
        int scheme = url.indexOf("://");
        if (scheme >= 0) {
          int slash = url.indexOf('/', scheme + 3);
          base = slash >= 0 ? url.substring(slash) : "";
        } else {
          base = url;
        }
      }
    }
    if (base.endsWith("/")) base = base.substring(0, base.length() - 1);
    return base;
  }

  private static String stripQuery(String path) {
    int q = path.indexOf('?');
    return q >= 0 ? path.substring(0, q) : path;
  }

  private static String[] segments(String path) {
    String p = path.startsWith("/") ? path.substring(1) : path;
    if (p.endsWith("/")) p = p.substring(0, p.length() - 1);
    return p.isEmpty() ? new String[0] : p.split("/");
  }

  // -1 when the template does not match, otherwise the number of literal segments
  private static int score(String[] template, String[] actual) {
    if (template.length != actual.length) return -1;
    int literal = 0;
    for (int i = 0; i < template.length; i++) {
      String t = template[i];
      String a = actual[i];
      boolean param = t.startsWith("{") && t.endsWith("}");
      if (param) continue;
      if (a.startsWith("${") && a.endsWith("}")) return -1;
      if (!t.equals(a)) return -1;
      literal++;
    }
    return literal;
  }
}
