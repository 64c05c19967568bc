package com.companyintel.research.model;

import java.time.Duration;

public record ProviderCallRecord(
    String providerName,
    CallPurpose purpose,
    long inputTokens,
    long outputTokens,
    double estimatedCostUsd,
    boolean success,
    Duration latency,
    String failureKind
) {
}
