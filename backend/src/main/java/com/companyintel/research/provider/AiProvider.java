package com.companyintel.research.provider;

/**
 * Adapter over one language-model backend. Implementations throw {@link ProviderException} with
 * a classified {@link ProviderFailureKind} so the router can decide whether a secondary provider
 * is worth trying.
 */
public interface AiProvider {

    String providerName();

    ProviderMetadata metadata();

    PageSelectionResponse selectPages(PageSelectionRequest request);

    SynthesisResponse synthesize(SynthesisRequest request);
}
