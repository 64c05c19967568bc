package com.companyintel.research.model;

import java.util.List;
import java.util.Map;

public record DiscoveryResult(
    List<DiscoveredLink> links,
    Map<DiscoverySource, Integer> countsBySource,
    List<String> failedSources
) {
    public boolean isEmpty() {
        return links.isEmpty();
    }
}
