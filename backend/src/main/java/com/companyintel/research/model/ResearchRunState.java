package com.companyintel.research.model;

public enum ResearchRunState {
    RUNNING,
    COMPLETED,
    FAILED,
    CANCELLED
}
