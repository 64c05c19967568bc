package com.companyintel.research.extract;

import com.companyintel.research.model.PageStatus;

public record ExtractionOutcome(
    PageStatus status,
    String text,
    String strategy,
    String errorMessage
) {
}
