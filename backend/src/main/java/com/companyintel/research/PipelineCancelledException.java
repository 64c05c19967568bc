package com.companyintel.research;

import com.companyintel.research.model.ExtractionBatch;

public class PipelineCancelledException extends ResearchPipelineException {
    private final String stage;
    private final ExtractionBatch partialBatch;

    public PipelineCancelledException(String stage, String reason, ExtractionBatch partialBatch) {
        super("pipeline_cancelled", "Research cancelled during " + stage + ": " + reason);
        this.stage = stage;
        this.partialBatch = partialBatch == null ? ExtractionBatch.empty() : partialBatch;
    }

    public String getStage() {
        return stage;
    }

    public ExtractionBatch getPartialBatch() {
        return partialBatch;
    }
}
