package com.companyintel.research.util;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.companyintel.research.model.HttpFetchResult;
import com.companyintel.research.model.PageStatus;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class ReasonCodeClassifierTest {

  @Test
  void classifiesIoErrorsByMessage() {
    assertEquals(
        ReasonCodeClassifier.DNS_FAILURE,
        ReasonCodeClassifier.fromErrorCode("io_error", "UnknownHostException: nope.example"));
    assertEquals(
        ReasonCodeClassifier.TLS_FAILURE,
        ReasonCodeClassifier.fromErrorCode("io_error", "SSLHandshakeException: bad cert"));
    assertEquals(
        ReasonCodeClassifier.CONNECTION_FAILURE,
        ReasonCodeClassifier.fromErrorCode("io_error", "ConnectException: Connection refused"));
  }

  @Test
  void mapsFailedFetchesToPageStatuses() {
    HttpFetchResult timeout = HttpFetchResult.error("https://example.com", Instant.now(), "timeout", "slow");
    HttpFetchResult dns = HttpFetchResult.error("https://example.com", Instant.now(), "io_error", "UnknownHostException");

    assertEquals(PageStatus.TIMEOUT, ReasonCodeClassifier.pageStatusFor(timeout));
    assertEquals(PageStatus.FETCH_ERROR, ReasonCodeClassifier.pageStatusFor(dns));
  }

  @Test
  void onlyTransientReasonsAreRetryable() {
    assertTrue(ReasonCodeClassifier.isRetryable(ReasonCodeClassifier.fromHttpStatus(503)));
    assertTrue(ReasonCodeClassifier.isRetryable(ReasonCodeClassifier.fromHttpStatus(429)));
    assertFalse(ReasonCodeClassifier.isRetryable(ReasonCodeClassifier.fromHttpStatus(404)));
    assertFalse(ReasonCodeClassifier.isRetryable(ReasonCodeClassifier.BODY_TOO_LARGE));
  }
}
