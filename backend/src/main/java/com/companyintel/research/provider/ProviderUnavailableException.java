package com.companyintel.research.provider;

import com.companyintel.research.model.CallPurpose;

public class ProviderUnavailableException extends ProviderException {
    private final CallPurpose purpose;

    public ProviderUnavailableException(CallPurpose purpose, ProviderException lastFailure, String message) {
        super(
            "provider_unavailable",
            lastFailure == null ? null : lastFailure.getProviderName(),
            lastFailure == null ? ProviderFailureKind.NOT_CONFIGURED : lastFailure.getKind(),
            message,
            lastFailure
        );
        this.purpose = purpose;
    }

    public CallPurpose getPurpose() {
        return purpose;
    }
}
