package com.companyintel.research.model;

import java.util.List;
import java.util.Map;

public record SitemapDiscoveryResult(
    List<String> fetchedSitemaps,
    List<SitemapUrlEntry> discoveredUrls,
    Map<String, Integer> errors
) {
}
