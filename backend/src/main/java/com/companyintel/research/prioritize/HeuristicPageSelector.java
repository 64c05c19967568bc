package com.companyintel.research.prioritize;

import com.companyintel.research.model.DiscoveredLink;
import com.companyintel.research.model.PrioritizedPage;
import com.companyintel.research.util.UrlNormalizer;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

@Component
public class HeuristicPageSelector {
    private static final Map<String, Integer> KEYWORD_WEIGHTS = keywordWeights();

    public List<PrioritizedPage> select(List<DiscoveredLink> links, int maxPages) {
        if (links == null || links.isEmpty() || maxPages <= 0) {
            return List.of();
        }
        List<ScoredLink> scored = new ArrayList<>();
        for (int i = 0; i < links.size(); i++) {
            DiscoveredLink link = links.get(i);
            ScoredLink candidate = score(link, i);
            if (candidate.score() > 0) {
                scored.add(candidate);
            }
        }

        List<PrioritizedPage> pages = new ArrayList<>();
        if (scored.isEmpty()) {
            for (DiscoveredLink link : links) {
                if (pages.size() >= maxPages) {
                    break;
                }
                pages.add(new PrioritizedPage(link, pages.size() + 1, "heuristic: discovery order"));
            }
            return pages;
        }

        scored.sort(Comparator.comparingInt(ScoredLink::score).reversed().thenComparingInt(ScoredLink::order));
        for (ScoredLink candidate : scored) {
            if (pages.size() >= maxPages) {
                break;
            }
            pages.add(new PrioritizedPage(
                candidate.link(),
                pages.size() + 1,
                "heuristic: path mentions " + candidate.keyword()
            ));
        }
        return pages;
    }

    static int weightOf(String url) {
        return score(new DiscoveredLink(url, null, 0), 0).score();
    }

    private static ScoredLink score(DiscoveredLink link, int order) {
        String path = UrlNormalizer.pathOf(link.url()).toLowerCase(Locale.ROOT);
        int best = 0;
        String bestKeyword = null;
        for (Map.Entry<String, Integer> entry : KEYWORD_WEIGHTS.entrySet()) {
            if (entry.getValue() > best && path.contains(entry.getKey())) {
                best = entry.getValue();
                bestKeyword = entry.getKey();
            }
        }
        return new ScoredLink(link, order, best, bestKeyword);
    }

    private static Map<String, Integer> keywordWeights() {
        Map<String, Integer> weights = new LinkedHashMap<>();
        weights.put("contact", 10);
        weights.put("about", 9);
        weights.put("team", 8);
        weights.put("careers", 7);
        weights.put("leadership", 7);
        weights.put("company", 6);
        weights.put("management", 6);
        weights.put("services", 5);
        weights.put("product", 5);
        weights.put("pricing", 5);
        weights.put("history", 4);
        weights.put("our-story", 4);
        return weights;
    }

    private record ScoredLink(DiscoveredLink link, int order, int score, String keyword) {
    }
}
