package com.companyintel.research.model;

import com.companyintel.research.progress.ProgressEvent;

import java.time.Instant;
import java.util.List;

public record ResearchRunView(
    String runId,
    ResearchRunState state,
    String companyName,
    Instant startedAt,
    Instant finishedAt,
    List<ProgressEvent> events,
    ResearchOutcome outcome,
    ExtractionBatch partialBatch,
    String errorKey,
    String errorMessage
) {
}
