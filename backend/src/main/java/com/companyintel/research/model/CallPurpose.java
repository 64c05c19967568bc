package com.companyintel.research.model;

public enum CallPurpose {
    PAGE_SELECTION,
    SYNTHESIS,
    CLASSIFICATION,
    EMBEDDING
}
