package com.companyintel.research.model;

public record SitemapUrlEntry(
    String url,
    String lastmod,
    int depth
) {
}
