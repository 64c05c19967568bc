package com.companyintel.research.synthesis;

import com.companyintel.config.ResearchProperties;
import com.companyintel.research.CancellationToken;
import com.companyintel.research.model.CallPurpose;
import com.companyintel.research.model.ExtractionBatch;
import com.companyintel.research.model.IntelligenceArtifact;
import com.companyintel.research.model.PageExtractionResult;
import com.companyintel.research.model.PipelineConfig;
import com.companyintel.research.model.ProviderRoute;
import com.companyintel.research.model.ResearchTarget;
import com.companyintel.research.progress.ProgressSink;
import com.companyintel.research.progress.ProgressStatus;
import com.companyintel.research.provider.ProviderException;
import com.companyintel.research.provider.ProviderRouter;
import com.companyintel.research.provider.ProviderUnavailableException;
import com.companyintel.research.provider.SynthesisRequest;
import com.companyintel.research.provider.SynthesisResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;

/**
 * Turns the successful pages of a batch into one {@link IntelligenceArtifact} with a single
 * synthesis call and at most one repair call. Unparseable output yields a degraded artifact that
 * carries the raw narrative.
 */
@Service
public class IntelligenceSynthesizer {
    private static final Logger log = LoggerFactory.getLogger(IntelligenceSynthesizer.class);
    static final int DEFAULT_CONTEXT_BUDGET_CHARS = 60_000;
    private static final int MIN_CONTENT_CHARS = 1000;

    private final ProviderRouter providerRouter;
    private final IntelligenceResponseParser responseParser;
    private final ResearchProperties properties;

    public IntelligenceSynthesizer(
        ProviderRouter providerRouter,
        IntelligenceResponseParser responseParser,
        ResearchProperties properties
    ) {
        this.providerRouter = providerRouter;
        this.responseParser = responseParser;
        this.properties = properties;
    }

    public IntelligenceArtifact synthesize(
        ResearchTarget target,
        String websiteUrl,
        ExtractionBatch batch,
        PipelineConfig config,
        ProgressSink sink,
        CancellationToken cancellation
    ) {
        List<PageExtractionResult> pages = batch.successfulInRankOrder();
        sink.emit(ProgressSink.SYNTHESIS, ProgressStatus.STARTED, "pages=" + pages.size());
        if (pages.isEmpty()) {
            log.warn("synthesis skipped company={} reason=no_content_extracted", target.companyName());
            sink.emit(ProgressSink.SYNTHESIS, ProgressStatus.FAILED, "degraded reason=no_content_extracted");
            return IntelligenceArtifact.degraded(null, "no_content_extracted");
        }

        ProviderRoute route = config.route(CallPurpose.SYNTHESIS);
        int budget = providerRouter.contextBudget(CallPurpose.SYNTHESIS, route);
        PackedContent packed = pack(pages, budget > 0 ? budget : DEFAULT_CONTEXT_BUDGET_CHARS);
        log.info(
            "synthesis input company={} pagesIncluded={} pagesDropped={} truncated={} chars={}",
            target.companyName(),
            packed.pagesIncluded(),
            packed.pagesDropped(),
            packed.truncated(),
            packed.text().length()
        );
        SynthesisRequest request = SynthesisRequest.initial(
            target.companyName(),
            websiteUrl,
            packed.text(),
            packed.pagesIncluded()
        );

        SynthesisResponse first;
        try {
            first = providerRouter.route(CallPurpose.SYNTHESIS, route, sink, provider -> provider.synthesize(request));
        } catch (ProviderUnavailableException e) {
            sink.emit(ProgressSink.SYNTHESIS, ProgressStatus.FAILED, "provider_unavailable " + e.getMessage());
            throw e;
        } catch (ProviderException e) {
            String reason = "provider_error:" + e.getKind().name().toLowerCase(Locale.ROOT);
            log.warn("synthesis call failed company={} kind={} error={}", target.companyName(), e.getKind(), e.getMessage());
            sink.emit(ProgressSink.SYNTHESIS, ProgressStatus.FAILED, "degraded reason=" + reason);
            return IntelligenceArtifact.degraded(null, reason);
        }

        try {
            IntelligenceArtifact artifact = responseParser.parse(first.rawText());
            sink.emit(ProgressSink.SYNTHESIS, ProgressStatus.COMPLETED, "parsed=true repaired=false");
            return artifact;
        } catch (IntelligenceParseException firstError) {
            if (cancellation != null && cancellation.isCancelled()) {
                log.info("synthesis repair skipped company={} reason={}", target.companyName(), cancellation.reason());
                return IntelligenceArtifact.degraded(rawNarrative(first.rawText()), "cancelled");
            }
            log.info("synthesis response unparseable, attempting repair company={} error={}", target.companyName(), firstError.getMessage());
            sink.emit(ProgressSink.SYNTHESIS, ProgressStatus.PROGRESS, "repair error=" + firstError.getMessage());
            return repair(target, route, request, first.rawText(), firstError, sink);
        }
    }

    private IntelligenceArtifact repair(
        ResearchTarget target,
        ProviderRoute route,
        SynthesisRequest request,
        String rawText,
        IntelligenceParseException firstError,
        ProgressSink sink
    ) {
        SynthesisRequest repairRequest = request.repair(rawText, firstError.getMessage());
        String failure;
        try {
            SynthesisResponse repaired = providerRouter.route(
                CallPurpose.SYNTHESIS,
                route,
                sink,
                provider -> provider.synthesize(repairRequest)
            );
            IntelligenceArtifact artifact = responseParser.parse(repaired.rawText());
            sink.emit(ProgressSink.SYNTHESIS, ProgressStatus.COMPLETED, "parsed=true repaired=true");
            return artifact;
        } catch (IntelligenceParseException e) {
            failure = "schema_parse_failed: " + e.getMessage();
        } catch (ProviderException e) {
            failure = "repair_provider_error:" + e.getKind().name().toLowerCase(Locale.ROOT);
        }
        log.warn("synthesis degraded company={} reason={}", target.companyName(), failure);
        sink.emit(ProgressSink.SYNTHESIS, ProgressStatus.FAILED, "degraded reason=" + failure);
        return IntelligenceArtifact.degraded(rawNarrative(rawText), failure);
    }

    /**
     * Concatenates pages in rank order. Each page is capped at the per-page limit; the page that
     * crosses the budget is cut and every lower-ranked page is dropped.
     */
    PackedContent pack(List<PageExtractionResult> pages, int contextBudgetChars) {
        int available = Math.max(MIN_CONTENT_CHARS, contextBudgetChars - properties.getSynthesis().getPromptReserveChars());
        int perPage = properties.getSynthesis().getMaxCharsPerPage();
        StringBuilder out = new StringBuilder();
        int included = 0;
        boolean truncated = false;
        for (PageExtractionResult page : pages) {
            String header = "=== Page " + page.rank() + ": " + page.url() + " ===\n";
            String text = page.text().length() > perPage ? page.text().substring(0, perPage) : page.text();
            String block = header + text + "\n\n";
            int remaining = available - out.length();
            if (block.length() <= remaining) {
                out.append(block);
                included++;
                continue;
            }
            if (remaining > header.length()) {
                out.append(block, 0, remaining);
                included++;
            }
            truncated = true;
            break;
        }
        return new PackedContent(out.toString().trim(), included, pages.size() - included, truncated);
    }

    private String rawNarrative(String rawText) {
        if (rawText == null) {
            return null;
        }
        String cleaned = rawText.trim();
        return cleaned.isEmpty() ? null : cleaned;
    }

    record PackedContent(String text, int pagesIncluded, int pagesDropped, boolean truncated) {
    }
}
