package com.companyintel.research.service;

import com.companyintel.config.ResearchProperties;
import com.companyintel.research.CancellationToken;
import com.companyintel.research.DiscoveryExhaustedException;
import com.companyintel.research.PipelineCancelledException;
import com.companyintel.research.discovery.LinkDiscoveryService;
import com.companyintel.research.extract.ConcurrentExtractionCoordinator;
import com.companyintel.research.model.DiscoveryResult;
import com.companyintel.research.model.ExtractionBatch;
import com.companyintel.research.model.IntelligenceArtifact;
import com.companyintel.research.model.PipelineConfig;
import com.companyintel.research.model.PrioritizationResult;
import com.companyintel.research.model.ResearchOutcome;
import com.companyintel.research.model.ResearchTarget;
import com.companyintel.research.prioritize.PagePrioritizer;
import com.companyintel.research.progress.ProgressSink;
import com.companyintel.research.progress.ProgressStatus;
import com.companyintel.research.progress.RecordingProgressSink;
import com.companyintel.research.synthesis.FieldEnricher;
import com.companyintel.research.synthesis.IntelligenceSynthesizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Service
public class ResearchPipeline {
    private static final Logger log = LoggerFactory.getLogger(ResearchPipeline.class);

    private final ResearchProperties properties;
    private final DomainResolutionService domainResolutionService;
    private final LinkDiscoveryService linkDiscoveryService;
    private final PagePrioritizer pagePrioritizer;
    private final ConcurrentExtractionCoordinator extractionCoordinator;
    private final IntelligenceSynthesizer intelligenceSynthesizer;
    private final FieldEnricher fieldEnricher;

    public ResearchPipeline(
        ResearchProperties properties,
        DomainResolutionService domainResolutionService,
        LinkDiscoveryService linkDiscoveryService,
        PagePrioritizer pagePrioritizer,
        ConcurrentExtractionCoordinator extractionCoordinator,
        IntelligenceSynthesizer intelligenceSynthesizer,
        FieldEnricher fieldEnricher
    ) {
        this.properties = properties;
        this.domainResolutionService = domainResolutionService;
        this.linkDiscoveryService = linkDiscoveryService;
        this.pagePrioritizer = pagePrioritizer;
        this.extractionCoordinator = extractionCoordinator;
        this.intelligenceSynthesizer = intelligenceSynthesizer;
        this.fieldEnricher = fieldEnricher;
    }

    public ResearchOutcome research(ResearchTarget target) {
        return research(target, properties.toPipelineConfig(), ProgressSink.noop(), CancellationToken.create());
    }

    public ResearchOutcome research(
        ResearchTarget target,
        PipelineConfig config,
        ProgressSink sink,
        CancellationToken token
    ) {
        Instant startedAt = Instant.now();
        RecordingProgressSink events = new RecordingProgressSink(sink);
        CancellationToken cancellation = token == null ? CancellationToken.create() : token;
        cancellation.expireAfter(config.globalTimeout());
        List<String> degradations = new ArrayList<>();

        events.emit(ProgressSink.DISCOVERY, ProgressStatus.STARTED, "company=" + target.companyName());
        String websiteUrl;
        try {
            websiteUrl = domainResolutionService.resolve(target);
        } catch (DiscoveryExhaustedException e) {
            events.emit(ProgressSink.DISCOVERY, ProgressStatus.FAILED, e.getMessage());
            throw e;
        }
        checkCancelled(cancellation, ProgressSink.DISCOVERY, ExtractionBatch.empty(), events);

        DiscoveryResult discovery = linkDiscoveryService.discover(websiteUrl, config, events, cancellation);
        for (String failed : discovery.failedSources()) {
            degradations.add("discovery_source_failed:" + failed);
        }
        checkCancelled(cancellation, ProgressSink.DISCOVERY, ExtractionBatch.empty(), events);
        if (discovery.isEmpty()) {
            events.emit(ProgressSink.DISCOVERY, ProgressStatus.FAILED, "no links discovered url=" + websiteUrl);
            throw new DiscoveryExhaustedException("No content discoverable for " + websiteUrl);
        }
        events.emit(
            ProgressSink.DISCOVERY,
            ProgressStatus.COMPLETED,
            "links=" + discovery.links().size() + " bySource=" + discovery.countsBySource()
        );

        PrioritizationResult prioritization = pagePrioritizer.prioritize(
            target,
            websiteUrl,
            discovery.links(),
            config,
            events
        );
        if (prioritization.degraded()) {
            degradations.add("prioritization_degraded:" + prioritization.degradedReason());
        }
        checkCancelled(cancellation, ProgressSink.PRIORITIZATION, ExtractionBatch.empty(), events);

        events.emit(ProgressSink.EXTRACTION, ProgressStatus.STARTED, "pages=" + prioritization.pages().size());
        ExtractionBatch batch;
        try {
            batch = extractionCoordinator.extract(prioritization.pages(), config, events, cancellation);
        } catch (PipelineCancelledException e) {
            events.emit(ProgressSink.EXTRACTION, ProgressStatus.FAILED, e.getMessage());
            throw e;
        }
        events.emit(
            ProgressSink.EXTRACTION,
            ProgressStatus.COMPLETED,
            "attempted=" + batch.attempted() + " succeeded=" + batch.succeeded() + " byStatus=" + batch.countsByStatus()
        );
        checkCancelled(cancellation, ProgressSink.EXTRACTION, batch, events);

        IntelligenceArtifact artifact =
            intelligenceSynthesizer.synthesize(target, websiteUrl, batch, config, events, cancellation);
        artifact = fieldEnricher.enrich(artifact, batch);
        checkCancelled(cancellation, ProgressSink.SYNTHESIS, batch, events);
        if (artifact.softError()) {
            degradations.add("synthesis_degraded:" + artifact.softErrorReason());
        }

        Duration elapsed = Duration.between(startedAt, Instant.now());
        ResearchOutcome outcome = new ResearchOutcome(
            target,
            websiteUrl,
            artifact,
            batch,
            discovery.links(),
            prioritization.pages(),
            List.copyOf(degradations),
            events.providerCalls(),
            elapsed
        );
        log.info(
            "research complete company={} url={} attempted={} succeeded={} softError={} degradations={} costUsd={} elapsedMs={}",
            target.companyName(),
            websiteUrl,
            batch.attempted(),
            batch.succeeded(),
            artifact.softError(),
            degradations,
            outcome.totalCostUsd(),
            elapsed.toMillis()
        );
        return outcome;
    }

    private void checkCancelled(CancellationToken token, String stage, ExtractionBatch partial, ProgressSink sink) {
        if (token.isCancelled()) {
            sink.emit(stage, ProgressStatus.FAILED, "cancelled reason=" + token.reason());
            throw new PipelineCancelledException(stage, token.reason(), partial);
        }
    }
}
