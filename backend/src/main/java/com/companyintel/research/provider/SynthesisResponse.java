package com.companyintel.research.provider;

public record SynthesisResponse(
    String rawText,
    ProviderUsage usage
) implements ProviderResult {
    public SynthesisResponse {
        usage = usage == null ? ProviderUsage.none() : usage;
    }
}
