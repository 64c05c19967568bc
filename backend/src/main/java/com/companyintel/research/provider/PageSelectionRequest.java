package com.companyintel.research.provider;

import java.util.List;

public record PageSelectionRequest(
    String companyName,
    String websiteUrl,
    List<String> candidateUrls,
    int totalDiscovered,
    int maxPages
) {
    public PageSelectionRequest {
        candidateUrls = candidateUrls == null ? List.of() : List.copyOf(candidateUrls);
    }
}
