package com.companyintel.research.provider;

public record SelectedPage(
    String url,
    String rationale
) {
}
