package com.companyintel.research.model;

public record ResearchTarget(
    String companyName,
    String primaryUrl
) {
    public ResearchTarget {
        if (companyName == null || companyName.isBlank()) {
            throw new IllegalArgumentException("companyName is required");
        }
        companyName = companyName.trim();
        primaryUrl = primaryUrl == null || primaryUrl.isBlank() ? null : primaryUrl.trim();
    }

    public boolean hasPrimaryUrl() {
        return primaryUrl != null;
    }
}
