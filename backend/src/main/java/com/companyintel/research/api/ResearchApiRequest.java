package com.companyintel.research.api;

public record ResearchApiRequest(
    String companyName,
    String url,
    Integer maxLinks,
    Integer maxCrawlDepth,
    Integer maxPrioritizedPages,
    Integer concurrency,
    Integer perPageTimeoutSeconds,
    Integer globalTimeoutSeconds,
    Integer minSubstantialContentLength
) {
}
