package com.companyintel.research.provider;

import java.util.List;

public final class PromptTemplates {
    static final String PAGE_SELECTION_SYSTEM = """
        You are a research assistant choosing which pages of a company website to read.
        Respond with JSON only: an array of objects {"url": "...", "reason": "..."}.
        Use URLs exactly as listed. Do not invent URLs.""";

    static final String SYNTHESIS_SYSTEM = """
        You are a business analyst. Summarize the company strictly from the supplied website text.
        Respond with a single JSON object and nothing else. Use null for unknown scalar fields and []
        for unknown lists.""";

    static final String SYNTHESIS_SCHEMA = """
        {
          "narrative_summary": "3-5 sentence overview written for a sales or investment audience",
          "company_overview": "string",
          "business_model": "string",
          "industry": "string",
          "target_market": "string",
          "key_services": ["string"],
          "value_proposition": "string",
          "company_size": "string",
          "founding_year": "string",
          "location": "string",
          "leadership": ["Name - Title"]
        }""";

    private PromptTemplates() {
    }

    public static String pageSelection(PageSelectionRequest request) {
        StringBuilder links = new StringBuilder();
        List<String> urls = request.candidateUrls();
        for (int i = 0; i < urls.size(); i++) {
            links.append(i + 1).append(". ").append(urls.get(i)).append('\n');
        }
        String sampleNote = urls.size() < request.totalDiscovered()
            ? "The list is an evenly spaced sample of " + urls.size() + " out of " + request.totalDiscovered() + " links.\n"
            : "";
        return """
            Company: %s
            Website: %s

            Select at most %d pages most likely to describe the company's founding and history,
            leadership team, products and services, pricing, customers and business model, and
            contact details. Order them from most to least useful.
            %s
            Links:
            %s""".formatted(
            request.companyName(),
            request.websiteUrl(),
            request.maxPages(),
            sampleNote,
            links
        );
    }

    public static String synthesis(SynthesisRequest request) {
        return """
            Company: %s
            Website: %s

            Below is text extracted from %d pages of the company's website, most relevant first.
            Fill in this JSON schema:
            %s

            Website text:
            %s""".formatted(
            request.companyName(),
            request.websiteUrl(),
            request.pageCount(),
            SYNTHESIS_SCHEMA,
            request.packedContent()
        );
    }

    public static String synthesisRepair(SynthesisRequest request) {
        return """
            Your previous answer could not be parsed: %s

            Previous answer:
            %s

            Return the same information as one valid JSON object matching this schema, with no
            commentary and no code fences:
            %s""".formatted(
            request.parseError(),
            request.malformedOutput(),
            SYNTHESIS_SCHEMA
        );
    }
}
