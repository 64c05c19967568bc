package com.companyintel.research.synthesis;

import com.companyintel.research.model.IntelligenceArtifact;
import com.companyintel.research.provider.JsonResponses;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Component
public class IntelligenceResponseParser {
    private static final List<String> SCALAR_FIELDS = List.of(
        "narrative_summary",
        "company_overview",
        "business_model",
        "industry",
        "target_market",
        "value_proposition",
        "company_size",
        "founding_year",
        "location"
    );
    private static final List<String> LIST_FIELDS = List.of("key_services", "leadership");

    private final ObjectMapper objectMapper;

    public IntelligenceResponseParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public IntelligenceArtifact parse(String raw) throws IntelligenceParseException {
        if (raw == null || raw.isBlank()) {
            throw new IntelligenceParseException("empty response");
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(JsonResponses.extractJson(raw));
        } catch (JsonProcessingException e) {
            throw new IntelligenceParseException("invalid JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new IntelligenceParseException("expected a JSON object");
        }
        for (String field : SCALAR_FIELDS) {
            JsonNode value = root.get(field);
            if (value != null && !value.isNull() && !value.isTextual() && !value.isNumber()) {
                throw new IntelligenceParseException("field " + field + " must be a string");
            }
        }
        for (String field : LIST_FIELDS) {
            JsonNode value = root.get(field);
            if (value != null && !value.isNull() && !value.isArray()) {
                throw new IntelligenceParseException("field " + field + " must be an array");
            }
        }
        String narrative = text(root, "narrative_summary");
        if (narrative == null) {
            throw new IntelligenceParseException("field narrative_summary is missing");
        }

        return new IntelligenceArtifact(
            narrative,
            text(root, "company_overview"),
            text(root, "business_model"),
            text(root, "industry"),
            text(root, "target_market"),
            strings(root.get("key_services")),
            text(root, "value_proposition"),
            text(root, "company_size"),
            text(root, "founding_year"),
            text(root, "location"),
            leadership(root.get("leadership")),
            Map.of(),
            Map.of(),
            false,
            null
        );
    }

    private String text(JsonNode root, String field) {
        JsonNode value = root.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        String text = value.asText().trim();
        if (text.isEmpty() || text.equalsIgnoreCase("null") || text.equalsIgnoreCase("unknown")) {
            return null;
        }
        return text;
    }

    private List<String> strings(JsonNode array) {
        List<String> values = new ArrayList<>();
        if (array == null || !array.isArray()) {
            return values;
        }
        for (JsonNode item : array) {
            if (item.isValueNode() && !item.isNull()) {
                String text = item.asText().trim();
                if (!text.isEmpty()) {
                    values.add(text);
                }
            }
        }
        return values;
    }

    private List<String> leadership(JsonNode array) {
        List<String> values = new ArrayList<>();
        if (array == null || !array.isArray()) {
            return values;
        }
        for (JsonNode item : array) {
            if (item.isObject()) {
                String name = item.path("name").asText("").trim();
                String title = item.path("title").asText(item.path("role").asText("")).trim();
                if (!name.isEmpty()) {
                    values.add(title.isEmpty() ? name : name + " - " + title);
                }
            } else if (item.isValueNode() && !item.isNull() && !item.asText().isBlank()) {
                values.add(item.asText().trim());
            }
        }
        return values;
    }
}
