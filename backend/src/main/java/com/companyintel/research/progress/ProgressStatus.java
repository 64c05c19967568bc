package com.companyintel.research.progress;

public enum ProgressStatus {
    STARTED,
    PROGRESS,
    COMPLETED,
    FAILED
}
