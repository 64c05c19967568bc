package com.companyintel.research.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.companyintel.research.DiscoveryExhaustedException;
import com.companyintel.research.http.PoliteHttpClient;
import com.companyintel.research.model.HttpFetchResult;
import com.companyintel.research.model.ResearchTarget;
import java.net.URI;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class DomainResolutionServiceTest {

  @Mock private PoliteHttpClient httpClient;

  @Test
  void triesWwwVariantAndReturnsRootOfFinalUrl() {
    when(httpClient.get(eq("https://acme.example/"), anyString(), anyInt()))
        .thenReturn(HttpFetchResult.error("https://acme.example/", Instant.now(), "io_error", "UnknownHostException"));
    when(httpClient.get(eq("https://www.acme.example/"), anyString(), anyInt()))
        .thenReturn(ok("https://www.acme.example/", "https://www.acme.example/en/home"));

    String resolved =
        new DomainResolutionService(httpClient).resolve(new ResearchTarget("Acme", "acme.example"));

    assertEquals("https://www.acme.example/", resolved);
  }

  @Test
  void fallsBackToSuppliedUrlWhenProbesFail() {
    when(httpClient.get(anyString(), anyString(), anyInt()))
        .thenReturn(HttpFetchResult.error("https://acme.example/", Instant.now(), "timeout", "slow"));

    String resolved =
        new DomainResolutionService(httpClient)
            .resolve(new ResearchTarget("Acme", "https://acme.example/about"));

    assertEquals("https://acme.example/about", resolved);
    verify(httpClient, times(2)).get(anyString(), anyString(), anyInt());
  }

  @Test
  void guessesDomainsFromCompanyNameAndGivesUp() {
    when(httpClient.get(anyString(), anyString(), anyInt()))
        .thenReturn(HttpFetchResult.error("https://x/", Instant.now(), "io_error", "UnknownHostException"));

    assertThrows(
        DiscoveryExhaustedException.class,
        () -> new DomainResolutionService(httpClient).resolve(new ResearchTarget("Acme Pumps, Inc.", null)));
    verify(httpClient, times(6)).get(anyString(), anyString(), anyInt());
  }

  @Test
  void slugsDropLegalSuffixes() {
    assertEquals(List.of("acmepumps", "acme-pumps"), DomainResolutionService.slugs("Acme Pumps, Inc."));
    assertEquals(
        List.of("johnsonandjohnson", "johnson-and-johnson"), DomainResolutionService.slugs("Johnson & Johnson"));
    assertEquals(List.of("stripe"), DomainResolutionService.slugs("Stripe LLC"));
    assertEquals(
        List.of("https://stripe.com/", "https://stripe.io/", "https://stripe.co/"),
        new DomainResolutionService(httpClient).guessedUrls("Stripe"));
  }

  private HttpFetchResult ok(String requested, String finalUrl) {
    return new HttpFetchResult(
        requested,
        URI.create(finalUrl),
        200,
        "<html></html>",
        null,
        "text/html",
        null,
        Instant.now(),
        Duration.ofMillis(10),
        null,
        null);
  }
}
