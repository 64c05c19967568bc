package com.companyintel.research.model;

import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

public record ExtractionBatch(List<PageExtractionResult> results) {
    public ExtractionBatch {
        results = results == null
            ? List.of()
            : results.stream().sorted(Comparator.comparingInt(PageExtractionResult::rank)).toList();
    }

    public static ExtractionBatch empty() {
        return new ExtractionBatch(List.of());
    }

    public int attempted() {
        return results.size();
    }

    public int succeeded() {
        return (int) results.stream().filter(PageExtractionResult::isSuccessful).count();
    }

    public long totalCharacters() {
        return results.stream().mapToLong(PageExtractionResult::charLength).sum();
    }

    public Map<PageStatus, Integer> countsByStatus() {
        Map<PageStatus, Integer> counts = new EnumMap<>(PageStatus.class);
        for (PageExtractionResult result : results) {
            counts.merge(result.status(), 1, Integer::sum);
        }
        return counts;
    }

    public List<PageExtractionResult> successfulInRankOrder() {
        return results.stream().filter(PageExtractionResult::isSuccessful).toList();
    }
}
