package com.companyintel.research.provider;

import com.companyintel.research.ResearchPipelineException;

public class ProviderException extends ResearchPipelineException {
    private final String providerName;
    private final ProviderFailureKind kind;

    public ProviderException(String providerName, ProviderFailureKind kind, String message) {
        this(providerName, kind, message, null);
    }

    public ProviderException(String providerName, ProviderFailureKind kind, String message, Throwable cause) {
        this("provider_error", providerName, kind, message, cause);
    }

    protected ProviderException(
        String errorKey,
        String providerName,
        ProviderFailureKind kind,
        String message,
        Throwable cause
    ) {
        super(errorKey, message, cause);
        this.providerName = providerName;
        this.kind = kind;
    }

    public String getProviderName() {
        return providerName;
    }

    public ProviderFailureKind getKind() {
        return kind;
    }
}
