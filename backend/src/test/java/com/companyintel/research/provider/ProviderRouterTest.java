package com.companyintel.research.provider;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.companyintel.research.model.CallPurpose;
import com.companyintel.research.model.ProviderCallRecord;
import com.companyintel.research.model.ProviderRoute;
import com.companyintel.research.progress.RecordingProgressSink;
import java.util.List;
import org.junit.jupiter.api.Test;

class ProviderRouterTest {
  private static final ProviderRoute ROUTE = new ProviderRoute("primary", "secondary");
  private static final PageSelectionRequest REQUEST =
      new PageSelectionRequest("Acme", "https://acme.example/", List.of("https://acme.example/about"), 1, 5);

  @Test
  void usesPrimaryAndRecordsCost() {
    StubAiProvider primary = StubAiProvider.named("primary").selecting("/about");
    StubAiProvider secondary = StubAiProvider.named("secondary").selecting("/contact");
    RecordingProgressSink sink = new RecordingProgressSink();

    PageSelectionResponse response =
        StubAiProvider.routerOf(primary, secondary)
            .route(CallPurpose.PAGE_SELECTION, ROUTE, sink, provider -> provider.selectPages(REQUEST));

    assertEquals("/about", response.selections().get(0).url());
    assertTrue(secondary.selectionRequests().isEmpty());
    List<ProviderCallRecord> calls = sink.providerCalls();
    assertEquals(1, calls.size());
    ProviderCallRecord call = calls.get(0);
    assertEquals("primary", call.providerName());
    assertEquals(CallPurpose.PAGE_SELECTION, call.purpose());
    assertTrue(call.success());
    // 1000 input tokens at 0.15/M plus 100 output tokens at 0.60/M
    assertEquals(0.00021, call.estimatedCostUsd(), 1e-9);
  }

  @Test
  void quotaFailureFallsBackToSecondaryOnce() {
    StubAiProvider primary = StubAiProvider.named("primary").failingWith(ProviderFailureKind.QUOTA_EXCEEDED);
    StubAiProvider secondary = StubAiProvider.named("secondary").selecting("/contact");
    RecordingProgressSink sink = new RecordingProgressSink();

    PageSelectionResponse response =
        StubAiProvider.routerOf(primary, secondary)
            .route(CallPurpose.PAGE_SELECTION, ROUTE, sink, provider -> provider.selectPages(REQUEST));

    assertEquals("/contact", response.selections().get(0).url());
    assertThat(sink.providerCalls())
        .extracting(ProviderCallRecord::providerName, ProviderCallRecord::success)
        .containsExactly(
            tuple("primary", false),
            tuple("secondary", true));
    assertEquals("QUOTA_EXCEEDED", sink.providerCalls().get(0).failureKind());
  }

  @Test
  void malformedResponseIsNotRetriedElsewhere() {
    StubAiProvider primary = StubAiProvider.named("primary").failingWith(ProviderFailureKind.MALFORMED_RESPONSE);
    StubAiProvider secondary = StubAiProvider.named("secondary").selecting("/contact");

    ProviderException failure =
        assertThrows(
            ProviderException.class,
            () ->
                StubAiProvider.routerOf(primary, secondary)
                    .route(CallPurpose.PAGE_SELECTION, ROUTE, null, provider -> provider.selectPages(REQUEST)));

    assertFalse(failure instanceof ProviderUnavailableException);
    assertEquals(ProviderFailureKind.MALFORMED_RESPONSE, failure.getKind());
    assertTrue(secondary.selectionRequests().isEmpty());
  }

  @Test
  void bothProvidersFailingIsUnavailable() {
    StubAiProvider primary = StubAiProvider.named("primary").failingWith(ProviderFailureKind.TRANSIENT);
    StubAiProvider secondary = StubAiProvider.named("secondary").failingWith(ProviderFailureKind.QUOTA_EXCEEDED);

    ProviderUnavailableException failure =
        assertThrows(
            ProviderUnavailableException.class,
            () ->
                StubAiProvider.routerOf(primary, secondary)
                    .route(CallPurpose.SYNTHESIS, ROUTE, null, provider -> provider.selectPages(REQUEST)));

    assertEquals(CallPurpose.SYNTHESIS, failure.getPurpose());
    assertEquals("provider_unavailable", failure.getErrorKey());
    assertEquals("secondary", failure.getProviderName());
    assertEquals(1, primary.selectionRequests().size());
    assertEquals(1, secondary.selectionRequests().size());
  }

  @Test
  void missingPrimaryRegistrationFallsBack() {
    StubAiProvider secondary = StubAiProvider.named("secondary").selecting("/team");

    PageSelectionResponse response =
        StubAiProvider.routerOf(secondary)
            .route(CallPurpose.PAGE_SELECTION, ROUTE, null, provider -> provider.selectPages(REQUEST));

    assertEquals("/team", response.selections().get(0).url());
  }

  @Test
  void unexpectedProviderErrorsAreWrapped() {
    StubAiProvider primary = StubAiProvider.named("primary");

    ProviderException failure =
        assertThrows(
            ProviderException.class,
            () ->
                StubAiProvider.routerOf(primary)
                    .route(
                        CallPurpose.PAGE_SELECTION,
                        new ProviderRoute("primary", null),
                        null,
                        provider -> provider.selectPages(REQUEST)));

    assertEquals(ProviderFailureKind.UNEXPECTED, failure.getKind());
  }

  @Test
  void contextBudgetIsTheSmallerOfBothProviders() {
    ProviderRouter router =
        StubAiProvider.routerOf(new StubAiProvider("primary", 400_000), new StubAiProvider("secondary", 120_000));

    assertEquals(120_000, router.contextBudget(CallPurpose.SYNTHESIS, ROUTE));
    assertEquals(400_000, router.contextBudget(CallPurpose.SYNTHESIS, new ProviderRoute("primary", null)));
    assertEquals(0, router.contextBudget(CallPurpose.SYNTHESIS, new ProviderRoute("nobody", null)));
  }
}
