package com.companyintel.research.model;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

public record PipelineConfig(
    int maxLinks,
    int maxCrawlDepth,
    int maxPrioritizedPages,
    int concurrency,
    Duration perPageTimeout,
    Duration globalTimeout,
    int minSubstantialContentLength,
    Map<CallPurpose, ProviderRoute> providerRoutes
) {
    public PipelineConfig {
        maxLinks = Math.max(1, maxLinks);
        maxCrawlDepth = Math.max(0, maxCrawlDepth);
        maxPrioritizedPages = Math.max(1, maxPrioritizedPages);
        concurrency = Math.max(1, concurrency);
        if (perPageTimeout == null || perPageTimeout.isNegative() || perPageTimeout.isZero()) {
            perPageTimeout = Duration.ofSeconds(15);
        }
        if (globalTimeout != null && (globalTimeout.isNegative() || globalTimeout.isZero())) {
            globalTimeout = null;
        }
        minSubstantialContentLength = Math.max(1, minSubstantialContentLength);
        Map<CallPurpose, ProviderRoute> routes = new EnumMap<>(CallPurpose.class);
        if (providerRoutes != null) {
            routes.putAll(providerRoutes);
        }
        providerRoutes = Map.copyOf(routes);
    }

    public ProviderRoute route(CallPurpose purpose) {
        ProviderRoute route = providerRoutes.get(purpose);
        if (route == null) {
            throw new IllegalStateException("No provider route configured for " + purpose);
        }
        return route;
    }

    public PipelineConfig withOverrides(
        Integer maxLinksOverride,
        Integer maxCrawlDepthOverride,
        Integer maxPrioritizedPagesOverride,
        Integer concurrencyOverride,
        Integer perPageTimeoutSecondsOverride,
        Integer globalTimeoutSecondsOverride,
        Integer minSubstantialContentLengthOverride
    ) {
        return new PipelineConfig(
            maxLinksOverride == null ? maxLinks : maxLinksOverride,
            maxCrawlDepthOverride == null ? maxCrawlDepth : maxCrawlDepthOverride,
            maxPrioritizedPagesOverride == null ? maxPrioritizedPages : maxPrioritizedPagesOverride,
            concurrencyOverride == null ? concurrency : concurrencyOverride,
            perPageTimeoutSecondsOverride == null ? perPageTimeout : Duration.ofSeconds(perPageTimeoutSecondsOverride),
            globalTimeoutSecondsOverride == null ? globalTimeout : Duration.ofSeconds(globalTimeoutSecondsOverride),
            minSubstantialContentLengthOverride == null ? minSubstantialContentLength : minSubstantialContentLengthOverride,
            providerRoutes
        );
    }
}
