package com.companyintel.research.provider;

public enum ProviderFailureKind {
    QUOTA_EXCEEDED(true),
    TRANSIENT(true),
    NOT_CONFIGURED(true),
    THROTTLED(false),
    MALFORMED_RESPONSE(false),
    REJECTED(false),
    UNEXPECTED(false);

    private final boolean fallbackEligible;

    ProviderFailureKind(boolean fallbackEligible) {
        this.fallbackEligible = fallbackEligible;
    }

    public boolean isFallbackEligible() {
        return fallbackEligible;
    }
}
