package com.companyintel.research.synthesis;

import com.companyintel.research.model.ExtractionBatch;
import com.companyintel.research.model.IntelligenceArtifact;
import com.companyintel.research.model.PageExtractionResult;
import org.springframework.stereotype.Component;

import java.time.Year;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

@Component
public class FieldEnricher {
    private static final int EARLIEST_FOUNDING_YEAR = 1800;

    private static final List<Pattern> FOUNDING_YEAR = List.of(
        Pattern.compile("(?:founded|established|started|began|launched)\\s+(?:in\\s+)?(\\d{4})", Pattern.CASE_INSENSITIVE),
        Pattern.compile("since\\s+(\\d{4})", Pattern.CASE_INSENSITIVE),
        Pattern.compile("(\\d{4})\\s*[-–]\\s*(?:present|today)", Pattern.CASE_INSENSITIVE)
    );
    private static final Pattern EMPLOYEE_RANGE =
        Pattern.compile("(\\d[\\d,]*)\\s*(?:-|to)\\s*(\\d[\\d,]*)\\s*employees", Pattern.CASE_INSENSITIVE);
    private static final Pattern EMPLOYEE_OVER =
        Pattern.compile("(?:over|more\\s+than)\\s+(\\d[\\d,]*)\\s*(?:employees|people)", Pattern.CASE_INSENSITIVE);
    private static final Pattern EMPLOYEE_COUNT =
        Pattern.compile("(\\d[\\d,]*)\\+?\\s*(?:employees|team\\s+members)", Pattern.CASE_INSENSITIVE);
    private static final Pattern TEAM_OF = Pattern.compile("team\\s+of\\s+(\\d[\\d,]*)", Pattern.CASE_INSENSITIVE);
    private static final List<Pattern> LOCATION = List.of(
        Pattern.compile("(?:headquartered|based|located)\\s+(?:in|at)\\s+([A-Z][a-zA-Z]+(?:[ ,]+[A-Z][a-zA-Z]+){0,3})"),
        Pattern.compile("([A-Z][a-zA-Z]+(?: [A-Z][a-zA-Z]+)?, [A-Z]{2})\\s+\\d{5}")
    );
    private static final Pattern EMAIL = Pattern.compile("([a-zA-Z0-9._%+-]+@[a-zA-Z0-9.-]+\\.[a-zA-Z]{2,})");
    private static final Pattern PHONE =
        Pattern.compile("(?<![\\d])(?:\\+?1[-.\\s]?)?\\(?([2-9][0-9]{2})\\)?[-.\\s]([0-9]{3})[-.\\s]([0-9]{4})(?![\\d])");
    private static final Map<String, Pattern> SOCIAL = socialPatterns();

    public IntelligenceArtifact enrich(IntelligenceArtifact artifact, ExtractionBatch batch) {
        if (artifact == null || batch == null || artifact.softError()) {
            return artifact;
        }
        String content = corpus(batch);
        if (content.isEmpty()) {
            return artifact;
        }

        Map<String, String> contactInfo = new LinkedHashMap<>(artifact.contactInfo());
        if (!contactInfo.containsKey("email")) {
            String email = firstGroup(EMAIL, content);
            if (email != null) {
                contactInfo.put("email", email);
            }
        }
        if (!contactInfo.containsKey("phone")) {
            Matcher phone = PHONE.matcher(content);
            if (phone.find()) {
                contactInfo.put("phone", "(" + phone.group(1) + ") " + phone.group(2) + "-" + phone.group(3));
            }
        }

        Map<String, String> socialMedia = new LinkedHashMap<>(artifact.socialMedia());
        for (Map.Entry<String, Pattern> entry : SOCIAL.entrySet()) {
            if (!socialMedia.containsKey(entry.getKey())) {
                Matcher matcher = entry.getValue().matcher(content);
                if (matcher.find()) {
                    socialMedia.put(entry.getKey(), "https://" + matcher.group(0));
                }
            }
        }

        return artifact.withEnrichment(
            isBlank(artifact.companySize()) ? companySize(content) : artifact.companySize(),
            isBlank(artifact.foundingYear()) ? foundingYear(content) : artifact.foundingYear(),
            isBlank(artifact.location()) ? location(content) : artifact.location(),
            contactInfo,
            socialMedia
        );
    }

    String foundingYear(String content) {
        int currentYear = Year.now().getValue();
        for (Pattern pattern : FOUNDING_YEAR) {
            Matcher matcher = pattern.matcher(content);
            while (matcher.find()) {
                int year = Integer.parseInt(matcher.group(1));
                if (year >= EARLIEST_FOUNDING_YEAR && year <= currentYear) {
                    return matcher.group(1);
                }
            }
        }
        return null;
    }

    String companySize(String content) {
        Matcher range = EMPLOYEE_RANGE.matcher(content);
        if (range.find()) {
            return digits(range.group(1)) + "-" + digits(range.group(2)) + " employees";
        }
        Matcher over = EMPLOYEE_OVER.matcher(content);
        if (over.find()) {
            return digits(over.group(1)) + "+ employees";
        }
        Matcher count = EMPLOYEE_COUNT.matcher(content);
        if (count.find()) {
            return digits(count.group(1)) + " employees";
        }
        Matcher team = TEAM_OF.matcher(content);
        if (team.find()) {
            return digits(team.group(1)) + " employees";
        }
        return null;
    }

    String location(String content) {
        for (Pattern pattern : LOCATION) {
            Matcher matcher = pattern.matcher(content);
            if (matcher.find()) {
                return matcher.group(1).replaceAll("\\s+", " ").replaceAll("[ ,]+$", "").trim();
            }
        }
        return null;
    }

    private String corpus(ExtractionBatch batch) {
        StringBuilder out = new StringBuilder();
        for (PageExtractionResult page : batch.successfulInRankOrder()) {
            out.append(page.text()).append('\n');
        }
        return out.toString();
    }

    private String firstGroup(Pattern pattern, String content) {
        Matcher matcher = pattern.matcher(content);
        return matcher.find() ? matcher.group(1) : null;
    }

    private String digits(String value) {
        return value.replace(",", "");
    }

    private boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static Map<String, Pattern> socialPatterns() {
        Map<String, Pattern> patterns = new LinkedHashMap<>();
        patterns.put("linkedin", Pattern.compile("linkedin\\.com/company/[a-zA-Z0-9-]+", Pattern.CASE_INSENSITIVE));
        patterns.put("twitter", Pattern.compile("\\b(?:twitter|x)\\.com/[a-zA-Z0-9_]+", Pattern.CASE_INSENSITIVE));
        patterns.put("facebook", Pattern.compile("facebook\\.com/[a-zA-Z0-9.]+", Pattern.CASE_INSENSITIVE));
        patterns.put("instagram", Pattern.compile("instagram\\.com/[a-zA-Z0-9_.]+", Pattern.CASE_INSENSITIVE));
        patterns.put("youtube", Pattern.compile("youtube\\.com/(?:c|channel|user|@)/?[a-zA-Z0-9_-]+", Pattern.CASE_INSENSITIVE));
        patterns.put("github", Pattern.compile("github\\.com/[a-zA-Z0-9-]+", Pattern.CASE_INSENSITIVE));
        return patterns;
    }
}
