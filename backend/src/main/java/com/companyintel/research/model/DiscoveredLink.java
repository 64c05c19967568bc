package com.companyintel.research.model;

public record DiscoveredLink(
    String url,
    DiscoverySource source,
    int depth
) {
}
