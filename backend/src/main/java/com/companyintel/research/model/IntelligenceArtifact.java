package com.companyintel.research.model;

import java.util.List;
import java.util.Map;

public record IntelligenceArtifact(
    String narrativeSummary,
    String companyOverview,
    String businessModel,
    String industry,
    String targetMarket,
    List<String> keyServices,
    String valueProposition,
    String companySize,
    String foundingYear,
    String location,
    List<String> leadership,
    Map<String, String> contactInfo,
    Map<String, String> socialMedia,
    boolean softError,
    String softErrorReason
) {
    public IntelligenceArtifact {
        keyServices = keyServices == null ? List.of() : List.copyOf(keyServices);
        leadership = leadership == null ? List.of() : List.copyOf(leadership);
        contactInfo = contactInfo == null ? Map.of() : Map.copyOf(contactInfo);
        socialMedia = socialMedia == null ? Map.of() : Map.copyOf(socialMedia);
    }

    public static IntelligenceArtifact degraded(String narrative, String reason) {
        return new IntelligenceArtifact(
            narrative,
            null,
            null,
            null,
            null,
            List.of(),
            null,
            null,
            null,
            null,
            List.of(),
            Map.of(),
            Map.of(),
            true,
            reason
        );
    }

    public IntelligenceArtifact withEnrichment(
        String enrichedCompanySize,
        String enrichedFoundingYear,
        String enrichedLocation,
        Map<String, String> enrichedContactInfo,
        Map<String, String> enrichedSocialMedia
    ) {
        return new IntelligenceArtifact(
            narrativeSummary,
            companyOverview,
            businessModel,
            industry,
            targetMarket,
            keyServices,
            valueProposition,
            enrichedCompanySize,
            enrichedFoundingYear,
            enrichedLocation,
            leadership,
            enrichedContactInfo,
            enrichedSocialMedia,
            softError,
            softErrorReason
        );
    }
}
