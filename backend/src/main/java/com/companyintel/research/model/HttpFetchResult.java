package com.companyintel.research.model;

import java.net.URI;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;

public record HttpFetchResult(
    String requestedUrl,
    URI finalUri,
    int statusCode,
    String body,
    byte[] bodyBytes,
    String contentType,
    String contentEncoding,
    Instant fetchedAt,
    Duration duration,
    String errorCode,
    String errorMessage
) {
    public boolean isSuccessful() {
        return statusCode >= 200 && statusCode < 300 && errorCode == null;
    }

    public String finalUrlOrRequested() {
        return finalUri != null ? finalUri.toString() : requestedUrl;
    }

    public long byteLength() {
        if (bodyBytes != null) {
            return bodyBytes.length;
        }
        return body == null ? 0 : body.length();
    }

    public boolean isHtmlLike() {
        if (contentType == null || contentType.isBlank()) {
            return true;
        }
        String lower = contentType.toLowerCase(Locale.ROOT);
        return lower.contains("html") || lower.contains("xml") || lower.startsWith("text/");
    }

    public static HttpFetchResult error(String url, Instant startedAt, String errorCode, String errorMessage) {
        return new HttpFetchResult(
            url,
            null,
            0,
            null,
            null,
            null,
            null,
            Instant.now(),
            Duration.between(startedAt, Instant.now()),
            errorCode,
            errorMessage
        );
    }
}
