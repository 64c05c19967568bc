package com.companyintel.research.model;

import java.time.Duration;

public record PageExtractionResult(
    String url,
    int rank,
    PageStatus status,
    String text,
    int charLength,
    long byteLength,
    Duration elapsed,
    String strategy,
    String errorMessage
) {
    public static PageExtractionResult success(
        PrioritizedPage page,
        String text,
        long byteLength,
        Duration elapsed,
        String strategy
    ) {
        return new PageExtractionResult(
            page.url(),
            page.rank(),
            PageStatus.SUCCESS,
            text,
            text.length(),
            byteLength,
            elapsed,
            strategy,
            null
        );
    }

    public static PageExtractionResult failure(
        PrioritizedPage page,
        PageStatus status,
        long byteLength,
        Duration elapsed,
        String strategy,
        String errorMessage
    ) {
        return new PageExtractionResult(
            page.url(),
            page.rank(),
            status,
            "",
            0,
            byteLength,
            elapsed,
            strategy,
            errorMessage
        );
    }

    public boolean isSuccessful() {
        return status == PageStatus.SUCCESS;
    }
}
