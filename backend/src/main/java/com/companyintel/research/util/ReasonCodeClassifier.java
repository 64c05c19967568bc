package com.companyintel.research.util;

import com.companyintel.research.model.HttpFetchResult;
import com.companyintel.research.model.PageStatus;
import java.util.Locale;

public final class ReasonCodeClassifier {
  public static final String TIMEOUT = "TIMEOUT";
  public static final String DNS_FAILURE = "DNS_FAILURE";
  public static final String TLS_FAILURE = "TLS_FAILURE";
  public static final String CONNECTION_FAILURE = "CONNECTION_FAILURE";
  public static final String INVALID_URL = "INVALID_URL";
  public static final String BODY_TOO_LARGE = "BODY_TOO_LARGE";
  public static final String INTERRUPTED = "INTERRUPTED";
  public static final String HTTP_401_403 = "HTTP_401_403";
  public static final String HTTP_404 = "HTTP_404";
  public static final String HTTP_429_RATE_LIMIT = "HTTP_429_RATE_LIMIT";
  public static final String HTTP_5XX = "HTTP_5XX";
  public static final String UNKNOWN = "UNKNOWN";

  private ReasonCodeClassifier() {}

  public static String fromHttpStatus(Integer status) {
    if (status == null || status <= 0) {
      return UNKNOWN;
    }
    if (status == 401 || status == 403) {
      return HTTP_401_403;
    }
    if (status == 404) {
      return HTTP_404;
    }
    if (status == 408) {
      return TIMEOUT;
    }
    if (status == 429) {
      return HTTP_429_RATE_LIMIT;
    }
    if (status >= 500 && status < 600) {
      return HTTP_5XX;
    }
    return UNKNOWN;
  }

  public static String fromErrorCode(String errorCode, String errorMessage) {
    if (errorCode == null || errorCode.isBlank()) {
      return UNKNOWN;
    }
    String code = errorCode.toLowerCase(Locale.ROOT);
    if (code.contains("timeout")) {
      return TIMEOUT;
    }
    if (code.equals("invalid_url")) {
      return INVALID_URL;
    }
    if (code.equals("body_too_large")) {
      return BODY_TOO_LARGE;
    }
    if (code.equals("interrupted")) {
      return INTERRUPTED;
    }
    if (code.contains("io_error")) {
      String lower = errorMessage == null ? "" : errorMessage.toLowerCase(Locale.ROOT);
      if (lower.contains("unknownhost")
          || lower.contains("name or service not known")
          || lower.contains("no such host")) {
        return DNS_FAILURE;
      }
      if (lower.contains("ssl") || lower.contains("handshake")) {
        return TLS_FAILURE;
      }
      if (lower.contains("connect")) {
        return CONNECTION_FAILURE;
      }
      return UNKNOWN;
    }
    return UNKNOWN;
  }

  public static String fromFetch(HttpFetchResult fetch) {
    if (fetch.errorCode() != null) {
      return fromErrorCode(fetch.errorCode(), fetch.errorMessage());
    }
    return fromHttpStatus(fetch.statusCode());
  }

  public static PageStatus pageStatusFor(HttpFetchResult fetch) {
    String reason = fromFetch(fetch);
    if (TIMEOUT.equals(reason) || INTERRUPTED.equals(reason)) {
      return PageStatus.TIMEOUT;
    }
    return PageStatus.FETCH_ERROR;
  }

  public static boolean isRetryable(String reasonCode) {
    if (reasonCode == null) {
      return false;
    }
    return switch (reasonCode) {
      case TIMEOUT, DNS_FAILURE, TLS_FAILURE, CONNECTION_FAILURE, HTTP_429_RATE_LIMIT, HTTP_5XX -> true;
      default -> false;
    };
  }
}
