package com.companyintel.research.extract;

import com.companyintel.research.model.PageStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
public class ExtractionStrategyChain {
    private static final Logger log = LoggerFactory.getLogger(ExtractionStrategyChain.class);

    private final List<ExtractionStrategy> strategies;

    @Autowired
    public ExtractionStrategyChain(StructuredTextStrategy structured, SelectorFallbackStrategy fallback) {
        this(List.of(structured, fallback));
    }

    public ExtractionStrategyChain(List<ExtractionStrategy> strategies) {
        if (strategies == null || strategies.isEmpty()) {
            throw new IllegalArgumentException("at least one extraction strategy is required");
        }
        this.strategies = List.copyOf(strategies);
    }

    public ExtractionOutcome extract(String html, String pageUrl, int minSubstantialLength) {
        List<String> failures = new ArrayList<>();
        int bestLength = 0;
        for (ExtractionStrategy strategy : strategies) {
            String text;
            try {
                text = strategy.extract(html, pageUrl, minSubstantialLength);
            } catch (RuntimeException e) {
                log.debug("extraction strategy failed strategy={} url={} error={}", strategy.name(), pageUrl, e.toString());
                failures.add(strategy.name() + ": " + e.getMessage());
                continue;
            }
            int length = text == null ? 0 : text.length();
            if (length >= minSubstantialLength) {
                return new ExtractionOutcome(PageStatus.SUCCESS, text, strategy.name(), null);
            }
            bestLength = Math.max(bestLength, length);
            log.debug(
                "extraction below threshold strategy={} url={} chars={} min={}",
                strategy.name(),
                pageUrl,
                length,
                minSubstantialLength
            );
        }
        if (failures.size() == strategies.size()) {
            return new ExtractionOutcome(PageStatus.EXTRACT_ERROR, "", null, String.join("; ", failures));
        }
        String detail = "no strategy reached " + minSubstantialLength + " chars (best=" + bestLength + ")";
        if (!failures.isEmpty()) {
            detail = detail + "; " + String.join("; ", failures);
        }
        return new ExtractionOutcome(PageStatus.EMPTY, "", null, detail);
    }

    public List<String> strategyNames() {
        return strategies.stream().map(ExtractionStrategy::name).toList();
    }
}
