package com.companyintel.research.prioritize;

import com.companyintel.config.ResearchProperties;
import com.companyintel.research.model.CallPurpose;
import com.companyintel.research.model.DiscoveredLink;
import com.companyintel.research.model.PipelineConfig;
import com.companyintel.research.model.PrioritizationResult;
import com.companyintel.research.model.PrioritizedPage;
import com.companyintel.research.model.ProviderRoute;
import com.companyintel.research.model.ResearchTarget;
import com.companyintel.research.progress.ProgressSink;
import com.companyintel.research.progress.ProgressStatus;
import com.companyintel.research.provider.PageSelectionRequest;
import com.companyintel.research.provider.PageSelectionResponse;
import com.companyintel.research.provider.ProviderException;
import com.companyintel.research.provider.ProviderRouter;
import com.companyintel.research.provider.SelectedPage;
import com.companyintel.research.util.UrlNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Asks the page-selection provider which discovered pages are worth reading. Only URLs that were
 * actually discovered survive; when nothing usable comes back the keyword heuristic decides.
 */
@Service
public class PagePrioritizer {
    private static final Logger log = LoggerFactory.getLogger(PagePrioritizer.class);
    private static final int PROMPT_OVERHEAD_CHARS = 2000;
    private static final int PER_LINK_OVERHEAD_CHARS = 6;

    private final ProviderRouter providerRouter;
    private final HeuristicPageSelector heuristicPageSelector;
    private final ResearchProperties properties;

    public PagePrioritizer(
        ProviderRouter providerRouter,
        HeuristicPageSelector heuristicPageSelector,
        ResearchProperties properties
    ) {
        this.providerRouter = providerRouter;
        this.heuristicPageSelector = heuristicPageSelector;
        this.properties = properties;
    }

    public PrioritizationResult prioritize(
        ResearchTarget target,
        String websiteUrl,
        List<DiscoveredLink> links,
        PipelineConfig config,
        ProgressSink sink
    ) {
        int maxPages = config.maxPrioritizedPages();
        sink.emit(ProgressSink.PRIORITIZATION, ProgressStatus.STARTED, "candidates=" + links.size() + " max=" + maxPages);
        if (links.isEmpty()) {
            sink.emit(ProgressSink.PRIORITIZATION, ProgressStatus.COMPLETED, "selected=0");
            return new PrioritizationResult(List.of(), false, null, 0);
        }

        ProviderRoute route = config.route(CallPurpose.PAGE_SELECTION);
        List<String> candidates = sampleForPrompt(links, providerRouter.contextBudget(CallPurpose.PAGE_SELECTION, route));
        PageSelectionRequest request = new PageSelectionRequest(
            target.companyName(),
            websiteUrl,
            candidates,
            links.size(),
            maxPages
        );

        PageSelectionResponse response;
        try {
            response = providerRouter.route(
                CallPurpose.PAGE_SELECTION,
                route,
                sink,
                provider -> provider.selectPages(request)
            );
        } catch (ProviderException e) {
            log.warn(
                "page selection failed company={} kind={} error={}",
                target.companyName(),
                e.getKind(),
                e.getMessage()
            );
            return fallback(links, maxPages, "provider_error:" + e.getKind().name().toLowerCase(Locale.ROOT), 0, sink);
        }

        GuardedSelection guarded = guard(websiteUrl, links, response.selections(), maxPages);
        if (guarded.dropped() > 0) {
            log.info("dropped unknown urls from page selection company={} dropped={}", target.companyName(), guarded.dropped());
        }
        if (guarded.pages().isEmpty()) {
            return fallback(links, maxPages, "no_usable_urls", guarded.dropped(), sink);
        }
        sink.emit(
            ProgressSink.PRIORITIZATION,
            ProgressStatus.COMPLETED,
            "selected=" + guarded.pages().size() + " droppedUnknown=" + guarded.dropped()
        );
        return new PrioritizationResult(guarded.pages(), false, null, guarded.dropped());
    }

    /**
     * Keeps returned URLs that resolve to a discovered link, in the order the model gave them,
     * without duplicates and capped at {@code maxPages}.
     */
    GuardedSelection guard(String websiteUrl, List<DiscoveredLink> links, List<SelectedPage> selections, int maxPages) {
        Map<String, DiscoveredLink> known = new LinkedHashMap<>();
        for (DiscoveredLink link : links) {
            String key = UrlNormalizer.dedupKey(link.url());
            if (key != null) {
                known.putIfAbsent(key, link);
            }
        }
        List<PrioritizedPage> pages = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        int dropped = 0;
        for (SelectedPage selection : selections) {
            if (pages.size() >= maxPages) {
                break;
            }
            String resolved = selection.url() == null ? null : UrlNormalizer.toAbsolute(websiteUrl, selection.url().trim());
            String key = resolved == null ? null : UrlNormalizer.dedupKey(resolved);
            DiscoveredLink link = key == null ? null : known.get(key);
            if (link == null) {
                dropped++;
                continue;
            }
            if (seen.add(key)) {
                pages.add(new PrioritizedPage(link, pages.size() + 1, selection.rationale()));
            }
        }
        return new GuardedSelection(pages, dropped);
    }

    /**
     * Evenly spaced sample of the discovered links, sized to the prompt budget and the configured
     * link ceiling. Deterministic for a given link list.
     */
    List<String> sampleForPrompt(List<DiscoveredLink> links, int contextBudgetChars) {
        int limit = Math.min(links.size(), properties.getPrioritization().getMaxPromptLinks());
        if (contextBudgetChars > 0) {
            long totalChars = 0;
            for (DiscoveredLink link : links) {
                totalChars += link.url().length() + PER_LINK_OVERHEAD_CHARS;
            }
            long averageChars = Math.max(1, totalChars / links.size());
            long available = Math.max(0, contextBudgetChars - PROMPT_OVERHEAD_CHARS);
            limit = (int) Math.max(1, Math.min(limit, available / averageChars));
        }
        List<String> sample = new ArrayList<>(limit);
        if (limit >= links.size()) {
            for (DiscoveredLink link : links) {
                sample.add(link.url());
            }
            return sample;
        }
        for (int i = 0; i < limit; i++) {
            int index = (int) ((long) i * links.size() / limit);
            sample.add(links.get(index).url());
        }
        return sample;
    }

    private PrioritizationResult fallback(
        List<DiscoveredLink> links,
        int maxPages,
        String reason,
        int dropped,
        ProgressSink sink
    ) {
        List<PrioritizedPage> pages = heuristicPageSelector.select(links, maxPages);
        log.warn("page prioritization degraded reason={} heuristicSelected={}", reason, pages.size());
        sink.emit(
            ProgressSink.PRIORITIZATION,
            ProgressStatus.COMPLETED,
            "degraded reason=" + reason + " selected=" + pages.size()
        );
        return new PrioritizationResult(pages, true, reason, dropped);
    }

    record GuardedSelection(List<PrioritizedPage> pages, int dropped) {
    }
}
