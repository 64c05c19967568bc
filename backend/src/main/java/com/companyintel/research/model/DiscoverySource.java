package com.companyintel.research.model;

public enum DiscoverySource {
    ROBOTS,
    SITEMAP,
    CRAWL
}
