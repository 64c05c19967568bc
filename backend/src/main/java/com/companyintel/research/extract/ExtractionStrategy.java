package com.companyintel.research.extract;

/**
 * Turns fetched markup into clean text. Implementations may throw on unparseable input; the chain
 * records that as an extraction error.
 */
public interface ExtractionStrategy {
    String name();

    String extract(String html, String pageUrl, int minSubstantialLength);
}
