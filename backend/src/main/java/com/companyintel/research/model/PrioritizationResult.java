package com.companyintel.research.model;

import java.util.List;

public record PrioritizationResult(
    List<PrioritizedPage> pages,
    boolean degraded,
    String degradedReason,
    int droppedUnknownUrls
) {
}
