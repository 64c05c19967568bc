package com.companyintel.research;

public class DiscoveryExhaustedException extends ResearchPipelineException {
    public DiscoveryExhaustedException(String message) {
        super("discovery_exhausted", message);
    }
}
