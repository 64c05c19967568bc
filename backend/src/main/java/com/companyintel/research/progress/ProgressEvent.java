package com.companyintel.research.progress;

import com.companyintel.research.model.ProviderCallRecord;

import java.time.Instant;

public record ProgressEvent(
    String stage,
    ProgressStatus status,
    String detail,
    Instant timestamp,
    ProviderCallRecord providerCall
) {
    public static ProgressEvent of(String stage, ProgressStatus status, String detail) {
        return new ProgressEvent(stage, status, detail, Instant.now(), null);
    }

    public static ProgressEvent providerCall(ProviderCallRecord record) {
        return new ProgressEvent(
            "provider",
            record.success() ? ProgressStatus.COMPLETED : ProgressStatus.FAILED,
            record.providerName() + " " + record.purpose(),
            Instant.now(),
            record
        );
    }
}
