package com.companyintel.research.synthesis;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.companyintel.config.ResearchProperties;
import com.companyintel.research.CancellationToken;
import com.companyintel.research.model.CallPurpose;
import com.companyintel.research.model.DiscoveredLink;
import com.companyintel.research.model.DiscoverySource;
import com.companyintel.research.model.ExtractionBatch;
import com.companyintel.research.model.IntelligenceArtifact;
import com.companyintel.research.model.PageExtractionResult;
import com.companyintel.research.model.PageStatus;
import com.companyintel.research.model.PipelineConfig;
import com.companyintel.research.model.PrioritizedPage;
import com.companyintel.research.model.ProviderRoute;
import com.companyintel.research.model.ResearchTarget;
import com.companyintel.research.progress.RecordingProgressSink;
import com.companyintel.research.provider.ProviderFailureKind;
import com.companyintel.research.provider.ProviderUnavailableException;
import com.companyintel.research.provider.ProviderUsage;
import com.companyintel.research.provider.StubAiProvider;
import com.companyintel.research.provider.SynthesisRequest;
import com.companyintel.research.provider.SynthesisResponse;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class IntelligenceSynthesizerTest {
  private static final String SITE = "https://acme.example/";
  private static final ResearchTarget TARGET = new ResearchTarget("Acme", SITE);
  private static final String VALID =
      "{\"narrative_summary\": \"Acme makes pumps.\", \"industry\": \"Manufacturing\"}";

  private final ResearchProperties properties = new ResearchProperties();
  private final CancellationToken live = CancellationToken.create();

  @Test
  void parsesFirstAnswerWithoutRepair() {
    StubAiProvider primary = StubAiProvider.named("primary").answering(VALID);
    RecordingProgressSink sink = new RecordingProgressSink();

    IntelligenceArtifact artifact =
        synthesizer(primary).synthesize(TARGET, SITE, batch(2), config(), sink, live);

    assertFalse(artifact.softError());
    assertEquals("Manufacturing", artifact.industry());
    assertEquals(1, primary.synthesisRequests().size());
    assertEquals(2, primary.synthesisRequests().get(0).pageCount());
    assertThat(primary.synthesisRequests().get(0).packedContent())
        .startsWith("=== Page 1: https://acme.example/page-1 ===");
    assertEquals(1, sink.providerCalls().size());
  }

  @Test
  void repairsUnparseableAnswerOnce() {
    List<String> answers = new ArrayList<>(List.of("Acme is great, trust me.", VALID));
    StubAiProvider primary =
        StubAiProvider.named("primary")
            .onSynthesize(request -> new SynthesisResponse(answers.remove(0), new ProviderUsage(10, 10)));

    IntelligenceArtifact artifact =
        synthesizer(primary).synthesize(TARGET, SITE, batch(1), config(), new RecordingProgressSink(), live);

    assertFalse(artifact.softError());
    List<SynthesisRequest> requests = primary.synthesisRequests();
    assertEquals(2, requests.size());
    assertFalse(requests.get(0).isRepair());
    assertTrue(requests.get(1).isRepair());
    assertEquals("Acme is great, trust me.", requests.get(1).malformedOutput());
  }

  @Test
  void degradesWithRawNarrativeWhenRepairAlsoFails() {
    StubAiProvider primary = StubAiProvider.named("primary").answering("  Acme sells pumps to cities.  ");

    IntelligenceArtifact artifact =
        synthesizer(primary).synthesize(TARGET, SITE, batch(1), config(), new RecordingProgressSink(), live);

    assertTrue(artifact.softError());
    assertThat(artifact.softErrorReason()).startsWith("schema_parse_failed");
    assertEquals("Acme sells pumps to cities.", artifact.narrativeSummary());
    assertEquals(2, primary.synthesisRequests().size());
  }

  @Test
  void cancelDuringFirstCallSkipsRepair() {
    CancellationToken cancellation = CancellationToken.create();
    StubAiProvider primary =
        StubAiProvider.named("primary")
            .onSynthesize(
                request -> {
                  cancellation.cancel("user_cancelled");
                  return new SynthesisResponse("not json at all", new ProviderUsage(10, 10));
                });

    IntelligenceArtifact artifact =
        synthesizer(primary).synthesize(TARGET, SITE, batch(1), config(), new RecordingProgressSink(), cancellation);

    assertTrue(artifact.softError());
    assertEquals("cancelled", artifact.softErrorReason());
    assertEquals(1, primary.synthesisRequests().size());
  }

  @Test
  void skipsProviderWhenNothingWasExtracted() {
    StubAiProvider primary = StubAiProvider.named("primary").answering(VALID);
    PrioritizedPage page = page(1);
    ExtractionBatch empty =
        new ExtractionBatch(
            List.of(PageExtractionResult.failure(page, PageStatus.EMPTY, 10, Duration.ZERO, null, "thin")));

    IntelligenceArtifact artifact =
        synthesizer(primary).synthesize(TARGET, SITE, empty, config(), new RecordingProgressSink(), live);

    assertTrue(artifact.softError());
    assertEquals("no_content_extracted", artifact.softErrorReason());
    assertNull(artifact.narrativeSummary());
    assertTrue(primary.synthesisRequests().isEmpty());
  }

  @Test
  void unavailableProvidersAreFatal() {
    StubAiProvider primary = StubAiProvider.named("primary").failingWith(ProviderFailureKind.QUOTA_EXCEEDED);
    StubAiProvider secondary = StubAiProvider.named("secondary").failingWith(ProviderFailureKind.TRANSIENT);

    assertThrows(
        ProviderUnavailableException.class,
        () ->
            synthesizer(primary, secondary)
                .synthesize(TARGET, SITE, batch(1), config(), new RecordingProgressSink(), live));
  }

  @Test
  void rejectedCallDegradesInsteadOfFailing() {
    StubAiProvider primary = StubAiProvider.named("primary").failingWith(ProviderFailureKind.REJECTED);

    IntelligenceArtifact artifact =
        synthesizer(primary).synthesize(TARGET, SITE, batch(1), config(), new RecordingProgressSink(), live);

    assertTrue(artifact.softError());
    assertEquals("provider_error:rejected", artifact.softErrorReason());
  }

  @Test
  void packsPagesInRankOrderWithinBudget() {
    properties.getSynthesis().setMaxCharsPerPage(200);
    properties.getSynthesis().setPromptReserveChars(0);
    IntelligenceSynthesizer synthesizer = synthesizer(StubAiProvider.named("primary"));
    List<PageExtractionResult> pages = batch(6).successfulInRankOrder();

    IntelligenceSynthesizer.PackedContent roomy = synthesizer.pack(pages, 100_000);
    IntelligenceSynthesizer.PackedContent tight = synthesizer.pack(pages, 1_000);

    assertEquals(6, roomy.pagesIncluded());
    assertFalse(roomy.truncated());
    assertThat(roomy.text()).contains("x".repeat(200)).doesNotContain("x".repeat(201));

    assertTrue(tight.truncated());
    assertTrue(tight.text().length() <= 1_000);
    assertEquals(6, tight.pagesIncluded() + tight.pagesDropped());
    assertTrue(tight.pagesDropped() > 0);
    assertThat(tight.text()).startsWith("=== Page 1:").doesNotContain("=== Page 6:");
  }

  private IntelligenceSynthesizer synthesizer(StubAiProvider... providers) {
    return new IntelligenceSynthesizer(
        StubAiProvider.routerOf(providers), new IntelligenceResponseParser(new ObjectMapper()), properties);
  }

  private ExtractionBatch batch(int pages) {
    List<PageExtractionResult> results = new ArrayList<>();
    for (int rank = pages; rank >= 1; rank--) {
      results.add(PageExtractionResult.success(page(rank), "x".repeat(500), 2_000, Duration.ofMillis(20), "structured_text"));
    }
    return new ExtractionBatch(results);
  }

  private PrioritizedPage page(int rank) {
    return new PrioritizedPage(
        new DiscoveredLink("https://acme.example/page-" + rank, DiscoverySource.CRAWL, 1), rank, null);
  }

  private PipelineConfig config() {
    return new PipelineConfig(
        100,
        2,
        10,
        4,
        Duration.ofSeconds(5),
        null,
        100,
        Map.of(CallPurpose.SYNTHESIS, new ProviderRoute("primary", "secondary")));
  }
}
