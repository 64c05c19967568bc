package com.companyintel.research.progress;

@FunctionalInterface
public interface ProgressSink {
    String DISCOVERY = "discovery";
    String PRIORITIZATION = "prioritization";
    String EXTRACTION = "extraction";
    String SYNTHESIS = "synthesis";

    void onEvent(ProgressEvent event);

    default void emit(String stage, ProgressStatus status, String detail) {
        onEvent(ProgressEvent.of(stage, status, detail));
    }

    static ProgressSink noop() {
        return event -> {
        };
    }
}
