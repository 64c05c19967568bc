package com.companyintel.research.provider;

public record SynthesisRequest(
    String companyName,
    String websiteUrl,
    String packedContent,
    int pageCount,
    String malformedOutput,
    String parseError
) {
    public static SynthesisRequest initial(String companyName, String websiteUrl, String packedContent, int pageCount) {
        return new SynthesisRequest(companyName, websiteUrl, packedContent, pageCount, null, null);
    }

    public SynthesisRequest repair(String previousOutput, String error) {
        return new SynthesisRequest(companyName, websiteUrl, packedContent, pageCount, previousOutput, error);
    }

    public boolean isRepair() {
        return malformedOutput != null;
    }
}
