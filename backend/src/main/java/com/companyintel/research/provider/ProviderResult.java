package com.companyintel.research.provider;

public interface ProviderResult {

    ProviderUsage usage();
}
