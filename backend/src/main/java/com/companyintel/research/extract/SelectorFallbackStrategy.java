package com.companyintel.research.extract;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.util.LinkedHashSet;
import java.util.Set;

@Component
public class SelectorFallbackStrategy implements ExtractionStrategy {
    private static final String NAME = "selector_fallback";
    private static final String STRIP_TAGS = "script, style, noscript, template, svg, nav, header, footer, aside";
    private static final String CONTENT_SELECTORS =
        "main, [role=main], .main-content, .content, .page-content, .services-content, .container, #content";
    private static final String SERVICE_SELECTORS =
        "[class*=service], [class*=offering], [class*=solution], [class*=product], [class*=partner], "
            + "[id*=service], [id*=offering], [id*=partner], section, .section";
    private static final int MIN_SNIPPET_CHARS = 50;
    private static final int BODY_FALLBACK_CHARS = 200;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String extract(String html, String pageUrl, int minSubstantialLength) {
        if (html == null || html.isBlank()) {
            return "";
        }
        Document document = Jsoup.parse(html, pageUrl == null ? "" : pageUrl);
        document.select(STRIP_TAGS).remove();
        Element body = document.body();
        if (body == null) {
            return "";
        }

        String content = "";
        for (Element candidate : body.select(CONTENT_SELECTORS)) {
            String text = TextNormalizer.collapseInline(candidate.text());
            if (text.length() > content.length()) {
                content = text;
            }
        }

        if (content.length() < minSubstantialLength) {
            Set<String> snippets = new LinkedHashSet<>();
            if (!content.isEmpty()) {
                snippets.add(content);
            }
            for (Element element : body.select(SERVICE_SELECTORS)) {
                String text = TextNormalizer.collapseInline(element.text());
                if (text.length() > MIN_SNIPPET_CHARS && !containedIn(snippets, text)) {
                    snippets.add(text);
                }
            }
            content = String.join("\n", snippets);
        }

        if (content.length() < BODY_FALLBACK_CHARS) {
            content = TextNormalizer.collapseInline(body.text());
        }
        return TextNormalizer.collapseLines(content);
    }

    private boolean containedIn(Set<String> snippets, String text) {
        for (String existing : snippets) {
            if (existing.contains(text)) {
                return true;
            }
        }
        return false;
    }
}
