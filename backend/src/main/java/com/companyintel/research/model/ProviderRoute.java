package com.companyintel.research.model;

public record ProviderRoute(
    String primary,
    String secondary
) {
    public boolean hasSecondary() {
        return secondary != null && !secondary.isBlank() && !secondary.equals(primary);
    }
}
