package com.companyintel.research.progress;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class LoggingProgressSink implements ProgressSink {
    private static final Logger log = LoggerFactory.getLogger(LoggingProgressSink.class);

    private final String runLabel;

    public LoggingProgressSink(String runLabel) {
        this.runLabel = runLabel;
    }

    @Override
    public void onEvent(ProgressEvent event) {
        if (event.status() == ProgressStatus.FAILED) {
            log.warn("research run={} stage={} status={} detail={}", runLabel, event.stage(), event.status(), event.detail());
        } else if (event.providerCall() != null) {
            log.debug(
                "research run={} provider={} purpose={} tokensIn={} tokensOut={} costUsd={} latencyMs={}",
                runLabel,
                event.providerCall().providerName(),
                event.providerCall().purpose(),
                event.providerCall().inputTokens(),
                event.providerCall().outputTokens(),
                event.providerCall().estimatedCostUsd(),
                event.providerCall().latency().toMillis()
            );
        } else {
            log.info("research run={} stage={} status={} detail={}", runLabel, event.stage(), event.status(), event.detail());
        }
    }
}
