package com.example.jmxscenario.util;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class OpenApiExtractorTest {

  private static final String YAML = "openapi: 3.0.1\n"
      + "servers:\n"
      + "  - url: https://shop.example.com/api\n"
      + "paths:\n"
      + "  /orders:\n"
      + "    post:\n"
      + "      operationId: createOrder\n"
      + "  /orders/{id}:\n"
      + "    get:\n"
      + "      operationId: getOrder\n"
      + "  /orders/latest:\n"
      + "    get:\n"
      + "      operationId: getLatestOrder\n"
      + "  /health:\n"
      + "    get:\n"
      + "      summary: no operation id\n";

  @Test
  void resolvesOperationIdsPreferringLiteralSegments() throws Exception {
    OpenApiExtractor.OpenApiInfo info = new OpenApiExtractor().parse(YAML);

    assertEquals("/api", info.basePath);
    assertEquals(3, info.operations.size());
    assertEquals("createOrder", info.findOperationId("POST", "/api/orders"));
    assertEquals("getLatestOrder", info.findOperationId("GET", "/orders/latest"));
    assertEquals("getOrder", info.findOperationId("get", "/orders/42?expand=items"));
    assertEquals("getOrder", info.findOperationId("GET", "/orders/${orderId}"));
    assertNull(info.findOperationId("DELETE", "/orders/42"));
    assertNull(info.findOperationId("GET", "/health"));
  }

  @Test
  void variableSegmentDoesNotMatchLiteral() throws Exception {
    String json = "{\"swagger\":\"2.0\",\"basePath\":\"/v1\",\"paths\":{"
        + "\"/users/me\":{\"get\":{\"operationId\":\"me\"}}}}";
    OpenApiExtractor.OpenApiInfo info = new OpenApiExtractor().parse(json);

    assertEquals("/v1", info.basePath);
    assertEquals("me", info.findOperationId("GET", "/v1/users/me"));
    assertNull(info.findOperationId("GET", "/v1/users/${who}"));
  }

  @Test
  void loadsFromFile(@TempDir Path dir) throws Exception {
    Path file = dir.resolve("openapi.yaml");
    Files.writeString(file, YAML, StandardCharsets.UTF_8);
    OpenApiExtractor.OpenApiInfo info = new OpenApiExtractor().load(file.toString());
    assertEquals("createOrder", info.findOperationId("POST", "/orders"));
  }
}
