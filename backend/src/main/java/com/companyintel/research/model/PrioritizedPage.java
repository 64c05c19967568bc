package com.companyintel.research.model;

public record PrioritizedPage(
    DiscoveredLink link,
    int rank,
    String rationale
) {
    public String url() {
        return link.url();
    }
}
