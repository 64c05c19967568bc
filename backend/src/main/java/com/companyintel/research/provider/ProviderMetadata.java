package com.companyintel.research.provider;

import java.time.Duration;

public record ProviderMetadata(
    String model,
    int contextBudgetChars,
    double inputCostPerMillionTokens,
    double outputCostPerMillionTokens,
    Duration typicalLatency
) {
    public double estimateCostUsd(ProviderUsage usage) {
        if (usage == null) {
            return 0.0;
        }
        return (usage.inputTokens() * inputCostPerMillionTokens
            + usage.outputTokens() * outputCostPerMillionTokens) / 1_000_000.0;
    }
}
