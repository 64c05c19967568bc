package com.companyintel.research.extract;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

@Component
public class StructuredTextStrategy implements ExtractionStrategy {
    private static final Logger log = LoggerFactory.getLogger(StructuredTextStrategy.class);
    private static final String NAME = "structured_text";
    private static final String NOISE_TAGS =
        "script, style, noscript, template, svg, iframe, nav, header, footer, aside, form, button, select";
    private static final String BLOCK_TAGS = "h1, h2, h3, h4, h5, h6, p, li, blockquote, dd, dt, td, figcaption";
    private static final Set<String> BLOCK_TAG_NAMES = Set.of(
        "h1", "h2", "h3", "h4", "h5", "h6", "p", "li", "blockquote", "dd", "dt", "td", "figcaption"
    );
    private static final Pattern BOILERPLATE = Pattern.compile(
        "(?:^|[\\s_-])(?:cookies?|consent|gdpr|newsletter|popup|modal|breadcrumbs?|sidebar|share|skip-link|navbar|menu)(?:$|[\\s_-])"
    );
    private static final Set<String> ORGANIZATION_TYPES = Set.of(
        "organization", "corporation", "localbusiness", "professionalservice", "ngo", "educationalorganization"
    );
    private static final int MIN_BLOCK_CHARS = 30;
    private static final double MAX_LINK_DENSITY = 0.6;

    private final ObjectMapper objectMapper;

    public StructuredTextStrategy(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

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
        List<String> header = new ArrayList<>();
        header.addAll(organizationFacts(document));
        String title = TextNormalizer.collapseInline(document.title());
        if (!title.isEmpty()) {
            header.add(0, title);
        }
        String description = metaDescription(document);
        if (!description.isEmpty()) {
            header.add(description);
        }

        document.select(NOISE_TAGS).remove();
        removeBoilerplate(document);

        Element root = contentRoot(document);
        LinkedHashSet<String> blocks = new LinkedHashSet<>();
        if (root != null) {
            for (Element block : root.select(BLOCK_TAGS)) {
                if (hasNestedBlock(block)) {
                    continue;
                }
                String text = TextNormalizer.collapseInline(block.text());
                if (keep(block, text)) {
                    blocks.add(text);
                }
            }
        }

        LinkedHashSet<String> lines = new LinkedHashSet<>(header);
        lines.addAll(blocks);
        return String.join("\n", lines);
    }

    private boolean keep(Element block, String text) {
        if (text.isEmpty()) {
            return false;
        }
        String tag = block.normalName();
        if (tag.length() == 2 && tag.charAt(0) == 'h') {
            return text.length() >= 3;
        }
        if (text.length() < MIN_BLOCK_CHARS) {
            return false;
        }
        int linkChars = 0;
        for (Element anchor : block.select("a")) {
            linkChars += anchor.text().length();
        }
        return (double) linkChars / text.length() <= MAX_LINK_DENSITY;
    }

    private boolean hasNestedBlock(Element block) {
        for (Element descendant : block.getAllElements()) {
            if (descendant != block && BLOCK_TAG_NAMES.contains(descendant.normalName())) {
                return true;
            }
        }
        return false;
    }

    private Element contentRoot(Document document) {
        Element body = document.body();
        if (body == null) {
            return null;
        }
        Element best = null;
        int bestLength = 0;
        for (Element candidate : body.select("article, main, [role=main]")) {
            int length = candidate.text().length();
            if (length > bestLength) {
                best = candidate;
                bestLength = length;
            }
        }
        // a tiny <main> usually wraps only a hero banner
        if (best != null && bestLength >= body.text().length() / 3) {
            return best;
        }
        return body;
    }

    private void removeBoilerplate(Document document) {
        Element body = document.body();
        if (body == null) {
            return;
        }
        Elements candidates = body.select("[class], [id]");
        for (Element element : candidates) {
            if (element.parent() == null || element == body) {
                continue;
            }
            String marker = (element.className() + " " + element.id()).toLowerCase(Locale.ROOT);
            if (BOILERPLATE.matcher(marker).find()) {
                element.remove();
            }
        }
    }

    private String metaDescription(Document document) {
        Element meta = document.selectFirst("meta[name=description]");
        if (meta == null) {
            meta = document.selectFirst("meta[property=og:description]");
        }
        return meta == null ? "" : TextNormalizer.collapseInline(meta.attr("content"));
    }

    private List<String> organizationFacts(Document document) {
        List<String> facts = new ArrayList<>();
        for (Element script : document.select("script[type=application/ld+json]")) {
            String payload = script.data();
            if (payload == null || payload.isBlank()) {
                continue;
            }
            try {
                collectOrganizationFacts(objectMapper.readTree(payload), facts);
            } catch (JsonProcessingException e) {
                log.debug("skipping malformed json-ld error={}", e.getOriginalMessage());
            }
        }
        return facts;
    }

    private void collectOrganizationFacts(JsonNode node, List<String> facts) {
        if (node == null || node.isNull()) {
            return;
        }
        if (node.isArray()) {
            for (JsonNode child : node) {
                collectOrganizationFacts(child, facts);
            }
            return;
        }
        if (!node.isObject()) {
            return;
        }
        if (isOrganization(node.get("@type"))) {
            addFact(facts, "Organization", node.path("name").asText(""));
            addFact(facts, "Description", node.path("description").asText(""));
            addFact(facts, "Founded", node.path("foundingDate").asText(""));
            JsonNode employees = node.path("numberOfEmployees");
            addFact(facts, "Employees", employees.isObject() ? employees.path("value").asText("") : employees.asText(""));
            JsonNode address = node.path("address");
            if (address.isObject()) {
                addFact(facts, "Address", String.join(", ", nonBlank(
                    address.path("streetAddress").asText(""),
                    address.path("addressLocality").asText(""),
                    address.path("addressRegion").asText(""),
                    address.path("addressCountry").isObject()
                        ? address.path("addressCountry").path("name").asText("")
                        : address.path("addressCountry").asText("")
                )));
            }
        }
        JsonNode graph = node.get("@graph");
        if (graph != null) {
            collectOrganizationFacts(graph, facts);
        }
    }

    private boolean isOrganization(JsonNode typeNode) {
        if (typeNode == null || typeNode.isNull()) {
            return false;
        }
        if (typeNode.isTextual()) {
            return ORGANIZATION_TYPES.contains(typeNode.asText().toLowerCase(Locale.ROOT));
        }
        if (typeNode.isArray()) {
            for (JsonNode child : typeNode) {
                if (child.isTextual() && ORGANIZATION_TYPES.contains(child.asText().toLowerCase(Locale.ROOT))) {
                    return true;
                }
            }
        }
        return false;
    }

    private void addFact(List<String> facts, String label, String value) {
        String cleaned = TextNormalizer.collapseInline(value);
        if (!cleaned.isEmpty()) {
            facts.add(label + ": " + cleaned);
        }
    }

    private List<String> nonBlank(String... values) {
        List<String> out = new ArrayList<>();
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                out.add(value.trim());
            }
        }
        return out;
    }
}
