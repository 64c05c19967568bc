package com.companyintel.research.model;

import java.time.Duration;
import java.util.List;

public record ResearchOutcome(
    ResearchTarget target,
    String resolvedUrl,
    IntelligenceArtifact artifact,
    ExtractionBatch batch,
    List<DiscoveredLink> discoveredLinks,
    List<PrioritizedPage> prioritizedPages,
    List<String> degradations,
    List<ProviderCallRecord> providerCalls,
    Duration elapsed
) {
    public double totalCostUsd() {
        return providerCalls.stream().mapToDouble(ProviderCallRecord::estimatedCostUsd).sum();
    }
}
