package com.companyintel.research.http;

import static org.assertj.core.api.Assertions.assertThat;

import com.companyintel.config.ResearchProperties;
import com.companyintel.research.model.HttpFetchResult;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okio.Buffer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class PoliteHttpClientMaxBytesTest {
  private MockWebServer server;
  private ExecutorService executor;

  @AfterEach
  void tearDown() throws Exception {
    if (server != null) {
      server.shutdown();
    }
    if (executor != null) {
      executor.shutdownNow();
    }
  }

  @Test
  void returnsBodyTooLargeWhenResponseExceedsMaxBytes() throws Exception {
    server = new MockWebServer();
    server.enqueue(new MockResponse().setResponseCode(200).setBody("a".repeat(5000)));
    server.start();

    ResearchProperties properties = new ResearchProperties();
    properties.setGlobalConcurrency(1);
    properties.setPerHostDelayMs(1);
    properties.setRequestTimeoutSeconds(5);
    properties.setRequestMaxRetries(0);

    executor = Executors.newFixedThreadPool(1);
    PoliteHttpClient client = new PoliteHttpClient(properties, executor);

    String url = server.url("/big").toString();
    HttpFetchResult result = client.get(url, "text/plain", 1024);

    assertThat(result.errorCode()).isEqualTo("body_too_large");
    assertThat(result.body()).isNull();
    assertThat(result.isSuccessful()).isFalse();
    assertThat(server.getRequestCount()).isEqualTo(1);
  }

  @Test
  void decodesBodyWithDeclaredCharset() throws Exception {
    server = new MockWebServer();
    server.enqueue(
        new MockResponse()
            .setResponseCode(200)
            .setHeader("Content-Type", "text/html; charset=ISO-8859-1")
            .setBody(new Buffer().write("café".getBytes(StandardCharsets.ISO_8859_1))));
    server.start();

    ResearchProperties properties = new ResearchProperties();
    properties.setPerHostDelayMs(1);
    properties.setRequestMaxRetries(0);
    executor = Executors.newFixedThreadPool(1);
    PoliteHttpClient client = new PoliteHttpClient(properties, executor);

    HttpFetchResult result = client.get(server.url("/latin").toString(), "text/html");

    assertThat(result.body()).isEqualTo("café");
  }
}
