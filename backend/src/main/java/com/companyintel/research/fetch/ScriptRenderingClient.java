package com.companyintel.research.fetch;

import com.companyintel.config.ResearchProperties;
import com.companyintel.research.http.PoliteHttpClient;
import com.companyintel.research.model.HttpFetchResult;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

@Service
public class ScriptRenderingClient {
    private static final Logger log = LoggerFactory.getLogger(ScriptRenderingClient.class);

    private final ResearchProperties properties;
    private final PoliteHttpClient httpClient;
    private final ObjectMapper objectMapper;

    public ScriptRenderingClient(ResearchProperties properties, PoliteHttpClient httpClient, ObjectMapper objectMapper) {
        this.properties = properties;
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
    }

    public boolean isEnabled() {
        return properties.getRender().isEnabled();
    }

    public HttpFetchResult render(String url, Duration timeout) {
        Instant startedAt = Instant.now();
        String endpoint = trimTrailingSlash(properties.getRender().getBaseUrl()) + "/crawl";
        String payload;
        try {
            payload = objectMapper.writeValueAsString(Map.of(
                "urls", List.of(url),
                "browser_config", Map.of("type", "BrowserConfig", "params", Map.of("headless", true)),
                "crawler_config", Map.of("type", "CrawlerRunConfig", "params", Map.of("cache_mode", "bypass"))
            ));
        } catch (JsonProcessingException e) {
            return HttpFetchResult.error(url, startedAt, "render_error", e.getMessage());
        }

        Duration renderTimeout = timeout == null ? Duration.ofSeconds(properties.getRender().getTimeoutSeconds()) : timeout;
        HttpFetchResult response = httpClient.postJson(endpoint, payload, "application/json", renderTimeout);
        if ("interrupted".equals(response.errorCode())) {
            return response;
        }
        if (!response.isSuccessful()) {
            log.debug("render sidecar failed url={} status={} errorCode={}", url, response.statusCode(), response.errorCode());
            return HttpFetchResult.error(url, startedAt, "render_error", "sidecar status " + response.statusCode());
        }
        try {
            JsonNode root = objectMapper.readTree(response.body());
            JsonNode page = root.path("results").path(0);
            if (!root.path("success").asBoolean(true) || page.isMissingNode() || !page.path("success").asBoolean(true)) {
                return HttpFetchResult.error(url, startedAt, "render_error", page.path("error_message").asText("no results"));
            }
            String html = page.path("html").asText("");
            if (html.isBlank()) {
                html = page.path("cleaned_html").asText("");
            }
            byte[] bytes = html.getBytes(StandardCharsets.UTF_8);
            return new HttpFetchResult(
                url,
                null,
                page.path("status_code").asInt(200),
                html,
                bytes,
                "text/html; charset=utf-8",
                null,
                Instant.now(),
                Duration.between(startedAt, Instant.now()),
                null,
                null
            );
        } catch (JsonProcessingException e) {
            return HttpFetchResult.error(url, startedAt, "render_error", "invalid sidecar payload: " + e.getOriginalMessage());
        }
    }

    private String trimTrailingSlash(String value) {
        if (value == null) {
            return "";
        }
        return value.endsWith("/") ? value.substring(0, value.length() - 1) : value;
    }
}
