package com.companyintel.research.provider;

import java.util.List;

public record PageSelectionResponse(
    List<SelectedPage> selections,
    ProviderUsage usage
) implements ProviderResult {
    public PageSelectionResponse {
        selections = selections == null ? List.of() : List.copyOf(selections);
        usage = usage == null ? ProviderUsage.none() : usage;
    }
}
