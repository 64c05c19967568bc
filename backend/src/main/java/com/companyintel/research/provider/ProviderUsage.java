package com.companyintel.research.provider;

public record ProviderUsage(
    long inputTokens,
    long outputTokens
) {
    public static ProviderUsage none() {
        return new ProviderUsage(0, 0);
    }
}
