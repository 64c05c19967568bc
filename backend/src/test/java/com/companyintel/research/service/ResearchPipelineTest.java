package com.companyintel.research.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.companyintel.config.ResearchProperties;
import com.companyintel.research.CancellationToken;
import com.companyintel.research.DiscoveryExhaustedException;
import com.companyintel.research.PipelineCancelledException;
import com.companyintel.research.discovery.LinkDiscoveryService;
import com.companyintel.research.extract.ConcurrentExtractionCoordinator;
import com.companyintel.research.extract.ExtractionStrategyChain;
import com.companyintel.research.extract.SelectorFallbackStrategy;
import com.companyintel.research.extract.StructuredTextStrategy;
import com.companyintel.research.fetch.PageFetcher;
import com.companyintel.research.model.CallPurpose;
import com.companyintel.research.model.DiscoveredLink;
import com.companyintel.research.model.DiscoveryResult;
import com.companyintel.research.model.DiscoverySource;
import com.companyintel.research.model.HttpFetchResult;
import com.companyintel.research.model.PageExtractionResult;
import com.companyintel.research.model.PageStatus;
import com.companyintel.research.model.PipelineConfig;
import com.companyintel.research.model.PrioritizedPage;
import com.companyintel.research.model.ProviderRoute;
import com.companyintel.research.model.ResearchOutcome;
import com.companyintel.research.model.ResearchTarget;
import com.companyintel.research.prioritize.HeuristicPageSelector;
import com.companyintel.research.prioritize.PagePrioritizer;
import com.companyintel.research.progress.ProgressSink;
import com.companyintel.research.progress.RecordingProgressSink;
import com.companyintel.research.provider.ProviderException;
import com.companyintel.research.provider.ProviderFailureKind;
import com.companyintel.research.provider.ProviderRouter;
import com.companyintel.research.provider.ProviderUnavailableException;
import com.companyintel.research.provider.ProviderUsage;
import com.companyintel.research.provider.StubAiProvider;
import com.companyintel.research.provider.SynthesisResponse;
import com.companyintel.research.synthesis.FieldEnricher;
import com.companyintel.research.synthesis.IntelligenceResponseParser;
import com.companyintel.research.synthesis.IntelligenceSynthesizer;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ResearchPipelineTest {
    private static final String SITE = "https://acme.example/";
    private static final ResearchTarget TARGET = new ResearchTarget("Acme Pumps", SITE);
    private static final String ABOUT_HTML = """
        <html><head><title>About Acme Pumps</title></head><body>
          <main>
            <h1>About us</h1>
            <p>Acme Pumps designs and manufactures high-efficiency pumps for municipal water utilities.</p>
            <p>Founded in 1987, the company is headquartered in Austin, Texas and serves over 300 cities.</p>
          </main>
        </body></html>
        """;
    private static final String SYNTHESIS_JSON = """
        {"narrative_summary": "Acme Pumps builds pumps for water utilities.",
         "industry": "Industrial manufacturing",
         "key_services": ["Municipal pumps"]}
        """;

    @Mock
    private DomainResolutionService domainResolutionService;
    @Mock
    private LinkDiscoveryService linkDiscoveryService;
    @Mock
    private PageFetcher pageFetcher;

    private final ExecutorService executor = Executors.newCachedThreadPool();
    private final ObjectMapper objectMapper = new ObjectMapper();

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void researchesOnlyTheSelectedPagesAndSynthesizesFromSuccessfulOnes() {
        when(domainResolutionService.resolve(TARGET)).thenReturn(SITE);
        when(linkDiscoveryService.discover(eq(SITE), any(), any(), any()))
            .thenReturn(discovery("/", "/about", "/contact", "/blog/post-1", "/blog/post-2"));
        when(pageFetcher.fetch(eq("https://acme.example/about"), any()))
            .thenReturn(html("https://acme.example/about", ABOUT_HTML));
        when(pageFetcher.fetch(eq("https://acme.example/contact"), any()))
            .thenReturn(html("https://acme.example/contact", ""));
        StubAiProvider provider = StubAiProvider.named("stub")
            .selecting("/about", "/contact")
            .answering(SYNTHESIS_JSON);
        RecordingProgressSink sink = new RecordingProgressSink();

        ResearchOutcome outcome = pipeline(StubAiProvider.routerOf(provider))
            .research(TARGET, config(), sink, CancellationToken.create());

        assertEquals(2, outcome.batch().attempted());
        assertEquals(1, outcome.batch().succeeded());
        assertThat(outcome.batch().results())
            .extracting(PageExtractionResult::url, PageExtractionResult::status)
            .containsExactly(
                tuple("https://acme.example/about", PageStatus.SUCCESS),
                tuple("https://acme.example/contact", PageStatus.EMPTY)
            );
        assertThat(outcome.prioritizedPages()).extracting(PrioritizedPage::url)
            .containsExactly("https://acme.example/about", "https://acme.example/contact");
        verify(pageFetcher, never()).fetch(eq("https://acme.example/blog/post-1"), any());

        assertFalse(outcome.artifact().softError());
        assertEquals("Industrial manufacturing", outcome.artifact().industry());
        assertEquals("1987", outcome.artifact().foundingYear());
        assertTrue(outcome.degradations().isEmpty());
        assertEquals(1, provider.synthesisRequests().size());
        assertThat(provider.synthesisRequests().get(0).packedContent())
            .contains("municipal water utilities")
            .doesNotContain("https://acme.example/contact");
        assertEquals(2, outcome.providerCalls().size());
        assertTrue(outcome.totalCostUsd() > 0);
        assertThat(sink.eventsForStage(ProgressSink.SYNTHESIS)).isNotEmpty();
    }

    @Test
    void emptyDiscoveryEndsTheRun() {
        when(domainResolutionService.resolve(TARGET)).thenReturn(SITE);
        when(linkDiscoveryService.discover(eq(SITE), any(), any(), any()))
            .thenReturn(new DiscoveryResult(List.of(), Map.of(), List.of("robots", "sitemap", "crawl")));
        StubAiProvider provider = StubAiProvider.named("stub");

        assertThrows(
            DiscoveryExhaustedException.class,
            () -> pipeline(StubAiProvider.routerOf(provider)).research(TARGET, config(), ProgressSink.noop(), null)
        );
        assertTrue(provider.selectionRequests().isEmpty());
    }

    @Test
    void providerFailureDuringSelectionStillProducesAnArtifact() {
        when(domainResolutionService.resolve(TARGET)).thenReturn(SITE);
        when(linkDiscoveryService.discover(eq(SITE), any(), any(), any()))
            .thenReturn(discovery("/about", "/blog/post-1"));
        when(pageFetcher.fetch(anyString(), any()))
            .thenReturn(html("https://acme.example/about", ABOUT_HTML));
        StubAiProvider provider = StubAiProvider.named("stub")
            .onSelectPages(request -> {
                throw new ProviderException(
                    "stub", ProviderFailureKind.REJECTED, "bad request");
            })
            .answering(SYNTHESIS_JSON);

        ResearchOutcome outcome = pipeline(StubAiProvider.routerOf(provider))
            .research(TARGET, config(), ProgressSink.noop(), CancellationToken.create());

        assertThat(outcome.degradations()).containsExactly("prioritization_degraded:provider_error:rejected");
        assertEquals("https://acme.example/about", outcome.prioritizedPages().get(0).url());
        assertFalse(outcome.artifact().softError());
    }

    @Test
    void unavailableSynthesisProvidersFailTheRun() {
        when(domainResolutionService.resolve(TARGET)).thenReturn(SITE);
        when(linkDiscoveryService.discover(eq(SITE), any(), any(), any()))
            .thenReturn(discovery("/about"));
        when(pageFetcher.fetch(anyString(), any()))
            .thenReturn(html("https://acme.example/about", ABOUT_HTML));
        StubAiProvider provider = StubAiProvider.named("stub")
            .selecting("/about")
            .onSynthesize(request -> {
                throw new ProviderException(
                    "stub", ProviderFailureKind.QUOTA_EXCEEDED, "quota");
            });

        ProviderUnavailableException failure = assertThrows(
            ProviderUnavailableException.class,
            () -> pipeline(StubAiProvider.routerOf(provider)).research(TARGET, config(), ProgressSink.noop(), null)
        );
        assertEquals(CallPurpose.SYNTHESIS, failure.getPurpose());
    }

    @Test
    void cancelledTokenStopsBeforeDiscovery() {
        when(domainResolutionService.resolve(TARGET)).thenReturn(SITE);
        CancellationToken token = CancellationToken.create();
        token.cancel("user_cancelled");

        PipelineCancelledException cancelled = assertThrows(
            PipelineCancelledException.class,
            () -> pipeline(StubAiProvider.routerOf()).research(TARGET, config(), ProgressSink.noop(), token)
        );

        assertEquals(ProgressSink.DISCOVERY, cancelled.getStage());
        assertEquals(0, cancelled.getPartialBatch().attempted());
        verify(linkDiscoveryService, never()).discover(anyString(), any(), any(), any());
    }

    @Test
    void cancelDuringSynthesisFailsTheRun() {
        when(domainResolutionService.resolve(TARGET)).thenReturn(SITE);
        when(linkDiscoveryService.discover(eq(SITE), any(), any(), any()))
            .thenReturn(discovery("/about"));
        when(pageFetcher.fetch(anyString(), any()))
            .thenReturn(html("https://acme.example/about", ABOUT_HTML));
        CancellationToken token = CancellationToken.create();
        StubAiProvider provider = StubAiProvider.named("stub")
            .selecting("/about")
            .onSynthesize(request -> {
                token.cancel("user_cancelled");
                return new SynthesisResponse(SYNTHESIS_JSON, new ProviderUsage(100, 50));
            });
        RecordingProgressSink sink = new RecordingProgressSink();

        PipelineCancelledException cancelled = assertThrows(
            PipelineCancelledException.class,
            () -> pipeline(StubAiProvider.routerOf(provider)).research(TARGET, config(), sink, token)
        );

        assertEquals(ProgressSink.SYNTHESIS, cancelled.getStage());
        assertThat(cancelled.getMessage()).endsWith(": user_cancelled");
        assertEquals(1, cancelled.getPartialBatch().succeeded());
        assertEquals(1, provider.synthesisRequests().size());
    }

    @Test
    void degradedSynthesisIsNotEnrichedFromPageText() {
        when(domainResolutionService.resolve(TARGET)).thenReturn(SITE);
        when(linkDiscoveryService.discover(eq(SITE), any(), any(), any()))
            .thenReturn(discovery("/about"));
        when(pageFetcher.fetch(anyString(), any()))
            .thenReturn(html("https://acme.example/about", ABOUT_HTML));
        StubAiProvider provider = StubAiProvider.named("stub")
            .selecting("/about")
            .answering("Acme Pumps is a pump company.");

        ResearchOutcome outcome = pipeline(StubAiProvider.routerOf(provider))
            .research(TARGET, config(), ProgressSink.noop(), CancellationToken.create());

        assertTrue(outcome.artifact().softError());
        assertThat(outcome.artifact().softErrorReason()).startsWith("schema_parse_failed");
        assertEquals("Acme Pumps is a pump company.", outcome.artifact().narrativeSummary());
        assertNull(outcome.artifact().foundingYear());
        assertNull(outcome.artifact().location());
        assertEquals(2, provider.synthesisRequests().size());
    }

    private ResearchPipeline pipeline(ProviderRouter router) {
        ResearchProperties properties = new ResearchProperties();
        ExtractionStrategyChain chain = new ExtractionStrategyChain(
            new StructuredTextStrategy(objectMapper),
            new SelectorFallbackStrategy()
        );
        return new ResearchPipeline(
            properties,
            domainResolutionService,
            linkDiscoveryService,
            new PagePrioritizer(router, new HeuristicPageSelector(), properties),
            new ConcurrentExtractionCoordinator(pageFetcher, chain, executor),
            new IntelligenceSynthesizer(router, new IntelligenceResponseParser(objectMapper), properties),
            new FieldEnricher()
        );
    }

    private PipelineConfig config() {
        ProviderRoute route = new ProviderRoute("stub", null);
        return new PipelineConfig(
            100,
            2,
            5,
            4,
            Duration.ofSeconds(5),
            Duration.ofSeconds(60),
            100,
            Map.of(CallPurpose.PAGE_SELECTION, route, CallPurpose.SYNTHESIS, route)
        );
    }

    private DiscoveryResult discovery(String... paths) {
        List<DiscoveredLink> links = Arrays.stream(paths)
            .map(path -> new DiscoveredLink("https://acme.example" + path, DiscoverySource.CRAWL, path.equals("/") ? 0 : 1))
            .toList();
        return new DiscoveryResult(links, Map.of(DiscoverySource.CRAWL, links.size()), List.of());
    }

    private HttpFetchResult html(String url, String body) {
        return new HttpFetchResult(
            url,
            URI.create(url),
            200,
            body,
            body.getBytes(StandardCharsets.UTF_8),
            "text/html; charset=utf-8",
            null,
            Instant.now(),
            Duration.ofMillis(3),
            null,
            null
        );
    }
}
